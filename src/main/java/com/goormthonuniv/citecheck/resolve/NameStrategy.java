package com.goormthonuniv.citecheck.resolve;

/**
 * 사건명 해석 전략. 선언 순서(구체적인 것부터)대로 시도한다.
 */
public enum NameStrategy {
    ADJACENT_ADVERSARIAL(0.9), // "A v. B," 바로 뒤에 인용
    PROCEDURAL(0.8),           // "In re X", "Ex parte X", "Estate of X"
    NEAREST_ADVERSARIAL(0.6),  // 같은 절 안의 가장 가까운 "A v. B"
    CAPTION_FRAGMENT(0.4);     // "v." 없는 부분 표제

    private final double confidence;

    NameStrategy(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }
}
