package com.goormthonuniv.citecheck.extract;

import java.util.EnumMap;
import java.util.Map;

/**
 * 추출 전략과 리포터 분류별 정밀도.
 * 길이가 같은 스팬이 겹치면 이 표의 값이 큰 전략이 이긴다.
 */
public enum MatchStrategy {

    PATTERN(0.8, Map.of(
            ReporterClass.SUPREME_COURT, 0.90,
            ReporterClass.FEDERAL, 0.85,
            ReporterClass.REGIONAL, 0.92,
            ReporterClass.STATE_OFFICIAL, 0.90,
            ReporterClass.STATE_UNOFFICIAL, 0.88,
            ReporterClass.DATABASE, 0.80)),

    GRAMMAR(0.9, Map.of(
            ReporterClass.SUPREME_COURT, 0.95,
            ReporterClass.FEDERAL, 0.93,
            ReporterClass.REGIONAL, 0.88,
            ReporterClass.STATE_OFFICIAL, 0.86,
            ReporterClass.STATE_UNOFFICIAL, 0.85,
            ReporterClass.DATABASE, 0.90));

    private final double baseConfidence;
    private final Map<ReporterClass, Double> precision;

    MatchStrategy(double baseConfidence, Map<ReporterClass, Double> precision) {
        this.baseConfidence = baseConfidence;
        this.precision = new EnumMap<>(precision);
    }

    public double baseConfidence() {
        return baseConfidence;
    }

    public double precisionFor(ReporterClass cls) {
        return precision.getOrDefault(cls, 0.5);
    }
}
