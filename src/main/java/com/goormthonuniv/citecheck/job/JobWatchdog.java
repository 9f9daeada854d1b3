package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * 오래 도는 작업을 끊는다. 실행 중인 호출을 중단하지는 않고,
 * 작업을 FAILED 로 만들고 취소 플래그를 세워 다음 단계 경계에서 멈추게 한다.
 */
@Slf4j
@Component
public class JobWatchdog {

    private final JobStore store;
    private final Duration maxProcessingTime;

    public JobWatchdog(JobStore store, CiteCheckProperties props) {
        this.store = store;
        this.maxProcessingTime = props.getJobs().getMaxProcessingTime();
    }

    @Scheduled(fixedDelayString = "#{@citeCheckProperties.jobs.watchdogInterval.toMillis()}")
    public void run() {
        sweep(Instant.now());
    }

    /** @return 이번에 실패 처리한 작업 수 */
    public int sweep(Instant now) {
        int timedOut = 0;
        for (ProcessingJob job : store.all()) {
            if (job.getStatus() != JobStatus.RUNNING) continue;
            Instant started = job.getStartedAt();
            if (started == null || Duration.between(started, now).compareTo(maxProcessingTime) <= 0) continue;

            job.requestCancel();
            if (job.fail("timed out after " + maxProcessingTime.toSeconds() + "s")) {
                timedOut++;
                log.warn("job={} exceeded max processing time {}, marked failed", job.getId(), maxProcessingTime);
            }
        }
        return timedOut;
    }
}
