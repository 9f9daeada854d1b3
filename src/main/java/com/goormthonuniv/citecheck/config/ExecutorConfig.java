package com.goormthonuniv.citecheck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /**
     * 인용 검증용 고정 풀. 모든 작업이 공유하므로 외부 호출 동시성의 상한이 된다.
     */
    @Bean(name = "verificationExecutor", destroyMethod = "shutdown")
    public ExecutorService verificationExecutor(CiteCheckProperties props) {
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "verify-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, props.getVerification().getMaxConcurrentCalls()), tf);
    }
}
