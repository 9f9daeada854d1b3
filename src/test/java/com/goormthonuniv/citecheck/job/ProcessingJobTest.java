package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.dto.AnalysisResult;
import com.goormthonuniv.citecheck.pipeline.PipelineStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingJobTest {

    private static final AnalysisResult EMPTY = new AnalysisResult(List.of(), List.of());

    @Test
    void startsOnlyOnce() {
        ProcessingJob job = new ProcessingJob("text", true);

        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.tryStart()).isTrue();
        assertThat(job.tryStart()).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getStartedAt()).isNotNull();
    }

    @Test
    void progressNeverMovesBackwards() {
        ProcessingJob job = new ProcessingJob("text", true);
        assertThat(job.advance(PipelineStage.INIT, "too early")).isFalse();
        job.tryStart();

        assertThat(job.advance(PipelineStage.EXTRACT_NAMES, "names")).isTrue();
        assertThat(job.advance(PipelineStage.EXTRACT, "late event")).isFalse();

        JobSnapshot snap = job.snapshot();
        assertThat(snap.currentStep()).isEqualTo(PipelineStage.EXTRACT_NAMES);
        assertThat(snap.percent()).isEqualTo(55);
        assertThat(snap.message()).isEqualTo("names");
    }

    @Test
    void completionIsTerminal() {
        ProcessingJob job = new ProcessingJob("text", false);
        job.tryStart();
        job.advance(PipelineStage.CLUSTER, "clustering");

        assertThat(job.complete(EMPTY)).isTrue();
        assertThat(job.fail("late failure")).isFalse();
        assertThat(job.advance(PipelineStage.CLUSTER, "again")).isFalse();

        JobSnapshot snap = job.snapshot();
        assertThat(snap.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(snap.percent()).isEqualTo(100);
        assertThat(snap.result()).isSameAs(EMPTY);
        assertThat(snap.error()).isNull();
        assertThat(snap.finishedAt()).isNotNull();
    }

    @Test
    void failureKeepsLastPercent() {
        ProcessingJob job = new ProcessingJob("text", false);
        job.tryStart();
        job.advance(PipelineStage.VERIFY, "verifying");

        assertThat(job.fail("upstream down")).isTrue();
        assertThat(job.complete(EMPTY)).isFalse();

        JobSnapshot snap = job.snapshot();
        assertThat(snap.status()).isEqualTo(JobStatus.FAILED);
        assertThat(snap.percent()).isEqualTo(85);
        assertThat(snap.error()).isEqualTo("upstream down");
        assertThat(snap.result()).isNull();
    }

    @Test
    void queuedJobCanFailWithoutStarting() {
        ProcessingJob job = new ProcessingJob("text", false);

        assertThat(job.fail("cancelled")).isTrue();
        assertThat(job.tryStart()).isFalse();
        assertThat(job.snapshot().startedAt()).isNull();
    }
}
