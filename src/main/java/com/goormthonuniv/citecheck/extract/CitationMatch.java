package com.goormthonuniv.citecheck.extract;

import java.util.List;

/**
 * 한 전략이 찾은 후보 스팬. 중재를 통과한 것만 {@link Citation}이 된다.
 */
public record CitationMatch(
        int start,
        int end,
        String text,
        Reporter reporter,
        String volume,
        String page,
        List<String> pinpoints,
        MatchStrategy strategy
) {
    public int length() {
        return end - start;
    }

    public boolean overlaps(CitationMatch other) {
        return start < other.end && other.start < end;
    }

    public double precision() {
        return strategy.precisionFor(reporter.reporterClass());
    }
}
