package com.goormthonuniv.citecheck.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** 작업 기록을 job-ttl 동안 보관한다 (기본 24h). */
@Component
public class CaffeineJobStore implements JobStore {

    private final Cache<String, ProcessingJob> jobs;

    public CaffeineJobStore(CiteCheckProperties props) {
        this.jobs = Caffeine.newBuilder()
                .expireAfterWrite(props.getJobs().getTtl())
                .maximumSize(10_000)
                .build();
    }

    @Override
    public void save(ProcessingJob job) {
        jobs.put(job.getId(), job);
    }

    @Override
    public Optional<ProcessingJob> find(String jobId) {
        if (jobId == null) return Optional.empty();
        return Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    @Override
    public Collection<ProcessingJob> all() {
        return List.copyOf(jobs.asMap().values());
    }
}
