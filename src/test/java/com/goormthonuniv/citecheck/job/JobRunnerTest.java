package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.Fixtures;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.pipeline.CitationPipeline;
import com.goormthonuniv.citecheck.pipeline.PipelineStage;
import com.goormthonuniv.citecheck.service.VerificationOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JobRunnerTest {

    /** 단계 진입을 기록하는 작업 */
    static class RecordingJob extends ProcessingJob {
        final List<PipelineStage> stages = new ArrayList<>();
        final List<Integer> percents = new ArrayList<>();

        RecordingJob(String text) {
            super(text, false);
        }

        @Override
        public synchronized boolean advance(PipelineStage stage, String message) {
            boolean moved = super.advance(stage, message);
            stages.add(stage);
            percents.add(snapshot().percent());
            return moved;
        }
    }

    private final CiteCheckProperties props = new CiteCheckProperties();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final JobRunner runner = new JobRunner(
            Fixtures.pipeline(props, new VerificationOrchestrator(List.of(), executor, props)));

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void jobWalksThroughAllStagesAndCompletes() {
        RecordingJob job = new RecordingJob("Roe v. Wade, 410 U.S. 113, 93 S. Ct. 705 (1973).");

        assertThat(runner.run(job)).isTrue();

        assertThat(job.stages).containsExactly(PipelineStage.INIT, PipelineStage.EXTRACT, PipelineStage.ANALYZE,
                PipelineStage.EXTRACT_NAMES, PipelineStage.VERIFY, PipelineStage.CLUSTER);
        assertThat(job.percents).containsExactly(5, 25, 40, 55, 85, 95);
        JobSnapshot snap = job.snapshot();
        assertThat(snap.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(snap.percent()).isEqualTo(100);
        assertThat(snap.result().citations()).hasSize(2);
        assertThat(snap.result().clusters()).hasSize(1);
    }

    @Test
    void alreadyClaimedJobIsNotRunAgain() {
        ProcessingJob job = new ProcessingJob("Roe v. Wade, 410 U.S. 113 (1973).", false);
        job.tryStart();

        assertThat(runner.run(job)).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void cancelRequestStopsJobAsFailed() {
        ProcessingJob job = new ProcessingJob("Roe v. Wade, 410 U.S. 113 (1973).", false);
        job.requestCancel();

        runner.run(job);

        JobSnapshot snap = job.snapshot();
        assertThat(snap.status()).isEqualTo(JobStatus.FAILED);
        assertThat(snap.error()).isEqualTo("cancelled");
        assertThat(snap.result()).isNull();
    }

    @Test
    void pipelineFailureIsRecordedOnJob() {
        CitationPipeline broken = mock(CitationPipeline.class);
        when(broken.run(any())).thenThrow(new IllegalStateException("extractor exploded"));
        ProcessingJob job = new ProcessingJob("text", false);

        new JobRunner(broken).run(job);

        assertThat(job.snapshot().status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.snapshot().error()).isEqualTo("extractor exploded");
    }

    @Test
    void errorBeyondRuntimeExceptionStillFailsJob() {
        CitationPipeline broken = mock(CitationPipeline.class);
        when(broken.run(any())).thenThrow(new StackOverflowError());
        ProcessingJob job = new ProcessingJob("text", false);

        assertThat(new JobRunner(broken).run(job)).isTrue();

        assertThat(job.snapshot().status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.snapshot().error()).isEqualTo("StackOverflowError");
    }

    @Test
    void longNumericListAfterCitationCompletes() {
        ProcessingJob job = new ProcessingJob(
                "Brown v. Board of Education, 347 U.S. 483" + ", 1".repeat(20_000) + ".", false);

        runner.run(job);

        JobSnapshot snap = job.snapshot();
        assertThat(snap.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(snap.result().citations()).hasSize(1);
    }
}
