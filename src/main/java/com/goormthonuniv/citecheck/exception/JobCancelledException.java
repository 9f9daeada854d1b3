package com.goormthonuniv.citecheck.exception;

import lombok.Getter;

/** 단계 경계에서 취소 플래그를 본 파이프라인이 던진다. 작업은 "cancelled" 로 실패 처리된다. */
@Getter
public class JobCancelledException extends CiteCheckException {

    private final String jobId;

    public JobCancelledException(String jobId) {
        super("cancelled");
        this.jobId = jobId;
    }
}
