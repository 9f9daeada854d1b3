package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.google.common.util.concurrent.RateLimiter;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 외부 호출 보호막.
 * - 소스별 토큰 버킷(Guava RateLimiter)으로 클라이언트 측 속도 제한. 작업 동시성과 무관하게 적용된다.
 * - 일시 장애(타임아웃/IO, 5xx, 429)만 지수 백오프로 재시도 (resilience4j Retry)
 * 재시도가 끝나도 실패하면 마지막 예외를 그대로 던진다. 티어 구현체가 ERROR 시도로 바꾼다.
 */
@Slf4j
@Component
public class HttpCallGuard {

    public static final String COURTLISTENER = "courtlistener";
    public static final String SEARCH = "search";
    public static final String PAGE_FETCH = "page-fetch";

    private final RetryRegistry retries;
    private final Map<String, Double> permitsPerSecond;
    private final Map<String, RateLimiter> limiters = new ConcurrentHashMap<>();

    public HttpCallGuard(CiteCheckProperties props) {
        CiteCheckProperties.Retry r = props.getVerification().getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, r.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(r.getInitialBackoff(), r.getMultiplier()))
                .retryOnException(HttpCallGuard::isTransient)
                .build();
        this.retries = RetryRegistry.of(config);
        this.retries.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onRetry(ev -> log.debug("retry source={} attempt={} wait={} cause={}",
                        ev.getName(), ev.getNumberOfRetryAttempts(), ev.getWaitInterval(),
                        String.valueOf(ev.getLastThrowable()))));

        CiteCheckProperties.RateLimits rl = props.getVerification().getRateLimits();
        this.permitsPerSecond = Map.of(
                COURTLISTENER, rl.getCourtlistener(),
                SEARCH, rl.getSearch(),
                PAGE_FETCH, rl.getPageFetch());
    }

    public <T> T call(String sourceKey, Supplier<T> call) {
        RateLimiter limiter = limiters.computeIfAbsent(sourceKey,
                k -> RateLimiter.create(permitsPerSecond.getOrDefault(k, 1.0)));
        Retry retry = retries.retry(sourceKey);
        Supplier<T> guarded = Retry.decorateSupplier(retry, () -> {
            limiter.acquire();
            return call.get();
        });
        return guarded.get();
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof ResourceAccessException) return true;
        if (t instanceof HttpServerErrorException) return true;
        if (t instanceof HttpStatusCodeException e) {
            return e.getStatusCode().value() == 429;
        }
        return false;
    }
}
