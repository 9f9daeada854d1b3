package com.goormthonuniv.citecheck.job;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 공유 큐를 소비하는 고정 개수 워커 스레드.
 * 작업 선점은 {@link ProcessingJob#tryStart()} 의 원자적 QUEUED → RUNNING 전이로 한 번만 일어난다.
 */
@Slf4j
@Component
public class JobWorkerPool {

    private final JobQueue queue;
    private final JobStore store;
    private final JobRunner runner;
    private final int workerCount;
    private final Duration pollTimeout;
    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean running;

    public JobWorkerPool(JobQueue queue, JobStore store, JobRunner runner, CiteCheckProperties props) {
        this.queue = queue;
        this.store = store;
        this.runner = runner;
        this.workerCount = Math.max(1, props.getJobs().getWorkerCount());
        this.pollTimeout = props.getJobs().getQueuePollTimeout();
    }

    @PostConstruct
    public void start() {
        running = true;
        for (int i = 1; i <= workerCount; i++) {
            Thread t = new Thread(this::loop, "job-worker-" + i);
            t.setDaemon(true);
            t.start();
            workers.add(t);
        }
        log.info("job worker pool started workers={}", workerCount);
    }

    @PreDestroy
    public void stop() {
        running = false;
        workers.forEach(Thread::interrupt);
        for (Thread t : workers) {
            try {
                t.join(pollTimeout.toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        workers.clear();
        log.info("job worker pool stopped");
    }

    private void loop() {
        while (running) {
            Optional<String> next;
            try {
                next = queue.poll(pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            next.ifPresent(this::process);
        }
    }

    void process(String jobId) {
        Optional<ProcessingJob> job = store.find(jobId);
        if (job.isEmpty()) {
            log.warn("job={} dequeued but no longer in store", jobId);
            return;
        }
        try {
            runner.run(job.get());
        } catch (Throwable t) {
            // 워커 스레드는 살아 남아 다음 작업을 받는다
            log.error("worker crashed on job={}", jobId, t);
            job.get().fail(Objects.toString(t.getMessage(), t.getClass().getSimpleName()));
            if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
                throw (VirtualMachineError) t;
            }
        }
    }
}
