package com.goormthonuniv.citecheck.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultResponse(
        String jobId,
        String status,         // completed | failed
        AnalysisResult result, // completed 일 때만
        String error           // failed 일 때만
) {}
