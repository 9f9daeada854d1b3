package com.goormthonuniv.citecheck.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 파이프라인 튜닝 값. application.yml 의 citecheck.* 에 바인딩된다.
 * 외부 API 키/엔드포인트는 각 어댑터에서 @Value 로 직접 주입받는다.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "citecheck")
public class CiteCheckProperties {

    private Resolver resolver = new Resolver();
    private Clustering clustering = new Clustering();
    private Verification verification = new Verification();
    private Jobs jobs = new Jobs();
    private Http http = new Http();

    // ============================================================
    // 사건명/연도 해석
    // ============================================================
    @Data
    public static class Resolver {
        private int nameWindowChars = 300;
        private int yearWindowChars = 120;
    }

    // ============================================================
    // 클러스터링 게이트
    // ============================================================
    @Data
    public static class Clustering {
        private int proximityChars = 200;
        private double nameSimilarityThreshold = 0.8;
        private int yearTolerance = 1;
    }

    // ============================================================
    // 검증 오케스트레이터
    // ============================================================
    @Data
    public static class Verification {
        private boolean enabled = true;
        private double acceptanceThreshold = 0.7;
        private int maxConcurrentCalls = 4;
        private int webSearchMaxCandidates = 5;
        private Retry retry = new Retry();
        private RateLimits rateLimits = new RateLimits();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(300);
        private double multiplier = 2.0;
    }

    /** 초당 허용 호출 수 (토큰 버킷) */
    @Data
    public static class RateLimits {
        private double courtlistener = 3.0;
        private double search = 1.0;
        private double pageFetch = 2.0;
    }

    // ============================================================
    // 작업(job) 조정
    // ============================================================
    @Data
    public static class Jobs {
        private int syncThresholdChars = 5 * 1024;
        private int syncThresholdCitations = 10;
        private int workerCount = 2;
        private Duration queuePollTimeout = Duration.ofSeconds(1);
        private Duration maxProcessingTime = Duration.ofMinutes(10);
        private Duration ttl = Duration.ofHours(24);
        private Duration watchdogInterval = Duration.ofSeconds(30);
    }

    // ============================================================
    // 외부 HTTP
    // ============================================================
    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
        private String userAgent = "CiteCheck/0.1 (+citation verification)";
    }
}
