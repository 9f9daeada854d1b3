package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.dto.AnalyzeRequest;
import com.goormthonuniv.citecheck.exception.JobNotFinishedException;
import com.goormthonuniv.citecheck.exception.JobNotFoundException;
import com.goormthonuniv.citecheck.extract.CitationExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 동기/비동기 결정과 작업 조회/취소.
 *
 * <ul>
 *   <li>SYNC: 요청 스레드에서 바로 실행. 그래도 작업 기록은 남겨 진행률 조회가 된다.</li>
 *   <li>ASYNC: QUEUED 로 저장하고 큐에 넣는다. 워커가 가져간다.</li>
 *   <li>AUTO: 텍스트 길이 또는 추정 인용 수가 임계값 이상이면 ASYNC.</li>
 * </ul>
 */
@Slf4j
@Service
public class JobCoordinator {

    private final JobStore store;
    private final JobQueue queue;
    private final JobRunner runner;
    private final CitationExtractor extractor;
    private final int syncThresholdChars;
    private final int syncThresholdCitations;

    public JobCoordinator(JobStore store, JobQueue queue, JobRunner runner,
                          CitationExtractor extractor, CiteCheckProperties props) {
        this.store = store;
        this.queue = queue;
        this.runner = runner;
        this.extractor = extractor;
        this.syncThresholdChars = props.getJobs().getSyncThresholdChars();
        this.syncThresholdCitations = props.getJobs().getSyncThresholdCitations();
    }

    public record Submission(ProcessingJob job, ExecutionMode mode) {}

    /** 메인 엔트리 */
    public Submission submit(AnalyzeRequest request) {
        ProcessingJob job = new ProcessingJob(request.text(), request.verifyOrDefault());
        store.save(job);

        ExecutionMode mode = decide(request.text(), ExecutionMode.from(request.mode()));
        if (mode == ExecutionMode.SYNC) {
            log.info("job={} running inline chars={}", job.getId(), request.text().length());
            runner.run(job);
        } else {
            queue.offer(job.getId());
            log.info("job={} queued chars={} queueSize={}", job.getId(), request.text().length(), queue.size());
        }
        return new Submission(job, mode);
    }

    /** AUTO 를 SYNC/ASYNC 로 확정 */
    public ExecutionMode decide(String text, ExecutionMode requested) {
        if (requested != ExecutionMode.AUTO) return requested;
        int length = text == null ? 0 : text.length();
        if (length >= syncThresholdChars) return ExecutionMode.ASYNC;
        if (extractor.estimateCount(text) >= syncThresholdCitations) return ExecutionMode.ASYNC;
        return ExecutionMode.SYNC;
    }

    public JobSnapshot progress(String jobId) {
        return find(jobId).snapshot();
    }

    /** 종료된 작업만. 아직 대기/실행 중이면 {@link JobNotFinishedException}. */
    public JobSnapshot result(String jobId) {
        JobSnapshot snap = find(jobId).snapshot();
        if (!snap.status().isTerminal()) {
            throw new JobNotFinishedException(jobId, snap.status().wireName());
        }
        return snap;
    }

    /** 대기 중이면 즉시 실패 처리, 실행 중이면 다음 단계 경계에서 멈추도록 플래그만 세운다. */
    public JobSnapshot cancel(String jobId) {
        ProcessingJob job = find(jobId);
        job.requestCancel();
        if (job.getStatus() == JobStatus.QUEUED && job.fail("cancelled")) {
            log.info("job={} cancelled while queued", jobId);
        } else {
            log.info("job={} cancellation requested (status={})", jobId, job.getStatus().wireName());
        }
        return job.snapshot();
    }

    private ProcessingJob find(String jobId) {
        return store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
