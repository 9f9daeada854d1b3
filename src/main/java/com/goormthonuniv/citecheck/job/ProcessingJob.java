package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.dto.AnalysisResult;
import com.goormthonuniv.citecheck.pipeline.PipelineStage;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 작업 진행 상태. 모든 변경은 synchronized 이고,
 * 상태는 앞으로만 움직이며 percent 는 줄지 않는다. 종료 후의 변경 요청은 무시된다(false 반환).
 */
public class ProcessingJob {

    @Getter private final String id;
    @Getter private final String text;
    @Getter private final boolean verify;
    @Getter private final Instant createdAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private JobStatus status = JobStatus.QUEUED;
    private PipelineStage currentStep = PipelineStage.INIT;
    private int percent = 0;
    private String message = "queued";
    private AnalysisResult result;
    private String error;
    private Instant startedAt;
    private Instant finishedAt;

    public ProcessingJob(String text, boolean verify) {
        this(UUID.randomUUID().toString(), text, verify, Instant.now());
    }

    ProcessingJob(String id, String text, boolean verify, Instant createdAt) {
        this.id = id;
        this.text = text;
        this.verify = verify;
        this.createdAt = createdAt;
    }

    /** QUEUED → RUNNING. 이미 누군가 가져갔거나 끝난 작업이면 false. */
    public synchronized boolean tryStart() {
        if (status != JobStatus.QUEUED) return false;
        status = JobStatus.RUNNING;
        startedAt = Instant.now();
        message = "started";
        return true;
    }

    /** 단계 진입. 이전 단계로 돌아가거나 percent 를 낮추는 요청은 반영하지 않는다. */
    public synchronized boolean advance(PipelineStage stage, String message) {
        if (status != JobStatus.RUNNING) return false;
        if (stage.ordinal() < currentStep.ordinal()) return false;
        currentStep = stage;
        percent = Math.max(percent, stage.percent());
        this.message = message;
        return true;
    }

    public synchronized boolean complete(AnalysisResult result) {
        if (status != JobStatus.RUNNING) return false;
        this.result = result;
        this.status = JobStatus.COMPLETED;
        this.percent = 100;
        this.message = "completed";
        this.finishedAt = Instant.now();
        return true;
    }

    /** QUEUED 나 RUNNING 에서만. percent 는 그대로 둔다. */
    public synchronized boolean fail(String error) {
        if (status.isTerminal()) return false;
        this.error = error;
        this.status = JobStatus.FAILED;
        this.message = "failed: " + error;
        this.finishedAt = Instant.now();
        return true;
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(id, status, currentStep, percent, message, result, error,
                createdAt, startedAt, finishedAt);
    }
}
