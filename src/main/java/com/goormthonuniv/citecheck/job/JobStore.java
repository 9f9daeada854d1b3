package com.goormthonuniv.citecheck.job;

import java.util.Collection;
import java.util.Optional;

public interface JobStore {

    void save(ProcessingJob job);

    Optional<ProcessingJob> find(String jobId);

    /** 만료되지 않은 모든 작업 (watchdog 용) */
    Collection<ProcessingJob> all();
}
