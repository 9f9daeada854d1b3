package com.goormthonuniv.citecheck.pipeline;

/** 파이프라인 단계와 각 단계 진입 시 진행률 */
public enum PipelineStage {
    INIT("init", 5),
    EXTRACT("extract", 25),
    ANALYZE("analyze", 40),
    EXTRACT_NAMES("extract_names", 55),
    VERIFY("verify", 85),
    CLUSTER("cluster", 95);

    private final String wireName;
    private final int percent;

    PipelineStage(String wireName, int percent) {
        this.wireName = wireName;
        this.percent = percent;
    }

    public String wireName() { return wireName; }

    public int percent() { return percent; }
}
