package com.goormthonuniv.citecheck.job;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** 프로세스 내 큐. 재시작하면 대기 중인 작업은 사라진다. */
@Component
public class InMemoryJobQueue implements JobQueue {

    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();

    @Override
    public void offer(String jobId) {
        queue.offer(jobId);
    }

    @Override
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public int size() {
        return queue.size();
    }
}
