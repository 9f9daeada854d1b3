package com.goormthonuniv.citecheck.job;

import java.util.Locale;

/**
 * 작업 상태. QUEUED → RUNNING → COMPLETED | FAILED, 대기 중 취소는 QUEUED → FAILED.
 * 종료 상태는 되돌아가지 않는다.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
