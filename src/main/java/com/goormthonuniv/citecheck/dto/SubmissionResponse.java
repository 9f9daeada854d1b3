package com.goormthonuniv.citecheck.dto;

public record SubmissionResponse(
        String jobId,
        String status,           // queued
        String progressEndpoint  // 폴링 경로
) {}
