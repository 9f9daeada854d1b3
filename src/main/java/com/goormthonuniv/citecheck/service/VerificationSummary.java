package com.goormthonuniv.citecheck.service;

/**
 * 한 문서의 검증 결과 집계.
 *
 * @param distinct 정규 인용 기준으로 중복을 뺀 조회 대상 수
 * @param skipped  취소 등으로 시도하지 못해 UNVERIFIED 로 남은 인용 수
 */
public record VerificationSummary(int requested, int distinct, int verified, int exhausted, int skipped) {

    public static VerificationSummary disabled(int requested) {
        return new VerificationSummary(requested, 0, 0, 0, requested);
    }
}
