package com.goormthonuniv.citecheck.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record AnalyzeRequest(
        @NotBlank String text,                              // 추출된 문서 텍스트
        @Pattern(regexp = "auto|sync|async") String mode,   // 선택, 기본 auto
        Boolean verify                                      // 선택, 기본 true
) {
    public AnalyzeRequest(String text) {
        this(text, null, null);
    }

    public boolean verifyOrDefault() {
        return verify == null || verify;
    }
}
