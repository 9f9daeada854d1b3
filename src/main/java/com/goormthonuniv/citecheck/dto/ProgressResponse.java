package com.goormthonuniv.citecheck.dto;

public record ProgressResponse(
        String jobId,
        String status,       // queued | running | completed | failed
        String currentStep,  // init | extract | analyze | extract_names | verify | cluster
        int percent,         // 0~100, 감소하지 않음
        String message
) {}
