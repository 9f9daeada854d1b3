package com.goormthonuniv.citecheck.job;

import java.util.Locale;

public enum ExecutionMode {
    AUTO,
    SYNC,
    ASYNC;

    public static ExecutionMode from(String value) {
        if (value == null || value.isBlank()) return AUTO;
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
