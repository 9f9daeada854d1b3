package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.extract.Citation;

import java.util.List;

/**
 * 검증 체인의 한 티어. 오케스트레이터가 {@link #tier()} 오름차순으로 하나씩 시도한다.
 * 구현체는 예외를 던지지 않고 ERROR 시도로 돌려준다.
 */
public interface VerificationSource {
    String name();
    int tier();
    VerificationAttempt attempt(Citation citation);

    /** 문서 단위 일괄 조회가 가능한 소스만 구현한다 */
    default void prepare(List<Citation> citations) {}
}
