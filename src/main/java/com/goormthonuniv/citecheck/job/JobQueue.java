package com.goormthonuniv.citecheck.job;

import java.time.Duration;
import java.util.Optional;

/**
 * 백그라운드 작업 id 의 FIFO 큐. 워커들이 공유한다.
 * 같은 id 가 두 번 꺼내져도 실행은 {@link ProcessingJob#tryStart()} 가 한 번으로 막는다.
 */
public interface JobQueue {

    void offer(String jobId);

    /**
     * 다음 작업 id. 비어 있으면 최대 {@code timeout} 동안 기다리고, 그래도 없으면 empty.
     */
    Optional<String> poll(Duration timeout) throws InterruptedException;

    int size();
}
