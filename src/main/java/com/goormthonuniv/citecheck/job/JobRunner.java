package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.dto.AnalysisResult;
import com.goormthonuniv.citecheck.exception.JobCancelledException;
import com.goormthonuniv.citecheck.pipeline.CitationPipeline;
import com.goormthonuniv.citecheck.pipeline.PipelineContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 작업 하나를 끝까지 실행한다. 동기 경로와 워커가 같이 쓴다.
 * 어떤 예외도 호출자에게 나가지 않고 작업 상태(FAILED)로 남는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobRunner {

    private final CitationPipeline pipeline;

    /** @return 이 호출이 작업을 실제로 실행했는지 (이미 시작/종료된 작업이면 false) */
    public boolean run(ProcessingJob job) {
        if (!job.tryStart()) {
            log.debug("job={} not claimable (status={})", job.getId(), job.getStatus());
            return false;
        }
        log.info("job={} started chars={} verify={}", job.getId(), job.getText().length(), job.isVerify());
        try {
            PipelineContext ctx = new PipelineContext(job.getId(), job.getText(), job.isVerify(),
                    job::isCancelRequested, job::advance);
            AnalysisResult result = pipeline.run(ctx);
            if (job.complete(result)) {
                log.info("job={} completed citations={} clusters={}",
                        job.getId(), result.citations().size(), result.clusters().size());
            } else {
                log.warn("job={} finished after it was already {}", job.getId(), job.getStatus());
            }
        } catch (JobCancelledException e) {
            job.fail(e.getMessage());
            log.info("job={} cancelled at step={}", job.getId(), job.snapshot().currentStep().wireName());
        } catch (RuntimeException | StackOverflowError e) {
            // 깊은 재귀로 스택이 넘친 경우도 RUNNING 으로 남기지 않는다
            job.fail(Objects.toString(e.getMessage(), e.getClass().getSimpleName()));
            log.error("job={} failed", job.getId(), e);
        }
        return true;
    }
}
