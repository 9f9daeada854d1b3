package com.goormthonuniv.citecheck.verify;

/**
 * 한 티어의 1회 시도 결과. 실행 중에만 존재하고, 채택된 것만 Citation에 남는다.
 *
 * @param confidence weight × validation signal (0.0~1.0)
 */
public record VerificationAttempt(
        String source,
        int tier,
        AttemptOutcome outcome,
        double confidence,
        String canonicalName,
        String canonicalDate,
        String canonicalUrl,
        String detail
) {

    public static VerificationAttempt match(String source, int tier, double weight, double signal,
                                            String name, String date, String url, String detail) {
        double c = Math.max(0.0, Math.min(1.0, weight * signal));
        return new VerificationAttempt(source, tier, AttemptOutcome.MATCH, c, name, date, url, detail);
    }

    public static VerificationAttempt noMatch(String source, int tier, String detail) {
        return new VerificationAttempt(source, tier, AttemptOutcome.NO_MATCH, 0.0, null, null, null, detail);
    }

    public static VerificationAttempt notApplicable(String source, int tier, String detail) {
        return new VerificationAttempt(source, tier, AttemptOutcome.NOT_APPLICABLE, 0.0, null, null, null, detail);
    }

    public static VerificationAttempt error(String source, int tier, String detail) {
        return new VerificationAttempt(source, tier, AttemptOutcome.ERROR, 0.0, null, null, null, detail);
    }

    public boolean acceptable(double threshold) {
        return outcome == AttemptOutcome.MATCH
                && confidence > threshold
                && canonicalName != null && !canonicalName.isBlank()
                && canonicalUrl != null && !canonicalUrl.isBlank();
    }
}
