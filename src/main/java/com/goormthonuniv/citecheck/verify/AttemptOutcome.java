package com.goormthonuniv.citecheck.verify;

public enum AttemptOutcome {
    MATCH,          // 후보를 찾음 (채택 여부는 confidence로 결정)
    NO_MATCH,       // 조회는 됐지만 맞는 판결 없음
    NOT_APPLICABLE, // 이 인용 형식/설정으로는 시도 불가
    ERROR           // 재시도 후에도 네트워크/응답 오류
}
