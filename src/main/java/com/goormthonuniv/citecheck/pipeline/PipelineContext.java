package com.goormthonuniv.citecheck.pipeline;

import com.goormthonuniv.citecheck.cluster.ClusterResult;
import com.goormthonuniv.citecheck.exception.JobCancelledException;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.service.VerificationSummary;
import lombok.Getter;
import lombok.Setter;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * 작업 하나의 파이프라인 상태. 인용과 클러스터는 여기에만 존재하고 작업 간에 공유되지 않는다.
 */
@Getter
public class PipelineContext {

    private final String jobId;
    private final String rawText;
    private final boolean verify;
    private final BooleanSupplier cancelled;
    private final ProgressListener listener;

    @Setter private String text;
    @Setter private List<Citation> citations = List.of();
    @Setter private int runCount;
    @Setter private VerificationSummary verification;
    @Setter private ClusterResult clusters = ClusterResult.empty();

    public PipelineContext(String jobId, String rawText, boolean verify,
                           BooleanSupplier cancelled, ProgressListener listener) {
        this.jobId = jobId;
        this.rawText = rawText;
        this.verify = verify;
        this.cancelled = cancelled;
        this.listener = listener;
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean();
    }

    /** 단계 경계에서 호출. 취소 요청이 있으면 다음 단계로 넘어가지 않는다. */
    void enter(PipelineStage stage, String message) {
        if (isCancelled()) {
            throw new JobCancelledException(jobId);
        }
        listener.onStage(stage, message);
    }
}
