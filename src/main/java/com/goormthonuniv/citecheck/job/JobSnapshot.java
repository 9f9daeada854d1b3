package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.dto.AnalysisResult;
import com.goormthonuniv.citecheck.pipeline.PipelineStage;

import java.time.Instant;

/** 한 시점의 작업 상태. 폴링 응답은 이것으로 만든다. */
public record JobSnapshot(
        String id,
        JobStatus status,
        PipelineStage currentStep,
        int percent,
        String message,
        AnalysisResult result,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {}
