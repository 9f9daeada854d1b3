package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.Fixtures;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.dto.AnalyzeRequest;
import com.goormthonuniv.citecheck.exception.JobNotFinishedException;
import com.goormthonuniv.citecheck.exception.JobNotFoundException;
import com.goormthonuniv.citecheck.pipeline.PipelineStage;
import com.goormthonuniv.citecheck.service.VerificationOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class JobCoordinatorTest {

    private static final String PARAGRAPH = "In Brown v. Board of Education, 347 U.S. 483, 74 S. Ct. 686 (1954), the Court "
            + "overruled Plessy v. Ferguson, 163 U.S. 537 (1896). See also State v. Smith, 150 Wn.2d 674, 80 P.3d 598 (2004). ";

    private final CiteCheckProperties props = new CiteCheckProperties();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final JobQueue queue = new InMemoryJobQueue();
    private JobStore store;
    private JobRunner runner;
    private JobCoordinator coordinator;
    private JobWorkerPool workers;

    @BeforeEach
    void setUp() {
        props.getJobs().setQueuePollTimeout(Duration.ofMillis(20));
        props.getJobs().setWorkerCount(2);
        store = new CaffeineJobStore(props);
        runner = new JobRunner(Fixtures.pipeline(props, new VerificationOrchestrator(List.of(), executor, props)));
        coordinator = new JobCoordinator(store, queue, runner, Fixtures.extractor(), props);
        workers = new JobWorkerPool(queue, store, runner, props);
    }

    @AfterEach
    void tearDown() {
        workers.stop();
        executor.shutdownNow();
    }

    @Test
    void shortDocumentRunsInline() {
        JobCoordinator.Submission s = coordinator.submit(new AnalyzeRequest(PARAGRAPH));

        assertThat(s.mode()).isEqualTo(ExecutionMode.SYNC);
        JobSnapshot snap = coordinator.result(s.job().getId());
        assertThat(snap.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(snap.result().citations()).hasSize(5);
        assertThat(queue.size()).isZero();
    }

    @Test
    void autoModeGoesAsyncOnLengthOrCitationCount() {
        String longText = PARAGRAPH.repeat(40);
        String manyCitations = "347 U.S. 483; ".repeat(12);

        assertThat(longText.length()).isGreaterThanOrEqualTo(props.getJobs().getSyncThresholdChars());
        assertThat(coordinator.decide(longText, ExecutionMode.AUTO)).isEqualTo(ExecutionMode.ASYNC);
        assertThat(coordinator.decide(manyCitations, ExecutionMode.AUTO)).isEqualTo(ExecutionMode.ASYNC);
        assertThat(coordinator.decide(PARAGRAPH, ExecutionMode.AUTO)).isEqualTo(ExecutionMode.SYNC);
        assertThat(coordinator.decide(longText, ExecutionMode.SYNC)).isEqualTo(ExecutionMode.SYNC);
        assertThat(coordinator.decide(PARAGRAPH, ExecutionMode.ASYNC)).isEqualTo(ExecutionMode.ASYNC);
    }

    @Test
    void largeDocumentIsQueuedThenCompletedByWorkers() {
        JobCoordinator.Submission s = coordinator.submit(new AnalyzeRequest(PARAGRAPH.repeat(40)));
        String id = s.job().getId();

        assertThat(s.mode()).isEqualTo(ExecutionMode.ASYNC);
        JobSnapshot queued = coordinator.progress(id);
        assertThat(queued.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(queued.percent()).isZero();
        assertThatThrownBy(() -> coordinator.result(id)).isInstanceOf(JobNotFinishedException.class);

        List<Integer> observed = new CopyOnWriteArrayList<>();
        workers.start();
        await().atMost(Duration.ofSeconds(20)).pollInterval(Duration.ofMillis(2)).until(() -> {
            JobSnapshot snap = coordinator.progress(id);
            observed.add(snap.percent());
            return snap.status().isTerminal();
        });

        JobSnapshot done = coordinator.result(id);
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.percent()).isEqualTo(100);
        assertThat(done.currentStep()).isEqualTo(PipelineStage.CLUSTER);
        assertThat(done.result().citations()).hasSize(5 * 40);
        assertThat(observed).isSorted();
    }

    @Test
    void cancellingQueuedJobFailsItBeforeAnyWorkerStarts() {
        JobCoordinator.Submission s = coordinator.submit(new AnalyzeRequest(PARAGRAPH, "async", false));
        String id = s.job().getId();

        JobSnapshot cancelled = coordinator.cancel(id);
        assertThat(cancelled.status()).isEqualTo(JobStatus.FAILED);
        assertThat(cancelled.error()).isEqualTo("cancelled");

        workers.process(id);
        assertThat(coordinator.result(id).status()).isEqualTo(JobStatus.FAILED);
        assertThat(coordinator.result(id).startedAt()).isNull();
    }

    @Test
    void unknownJobIsReported() {
        assertThatThrownBy(() -> coordinator.progress("nope")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> coordinator.cancel("nope")).isInstanceOf(JobNotFoundException.class);
    }
}
