package com.goormthonuniv.citecheck.pipeline;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (stage, message) -> {};

    void onStage(PipelineStage stage, String message);
}
