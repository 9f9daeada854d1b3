package com.goormthonuniv.citecheck.extract;

/**
 * 리포터 분류. 병렬 인용 판정과 추출 전략 간 타이브레이크에 쓰인다.
 */
public enum ReporterClass {
    SUPREME_COURT,    // U.S., S. Ct., L. Ed.
    FEDERAL,          // F., F. Supp., F. App'x ...
    REGIONAL,         // P., A., N.E., N.W., S.E., S.W., So.
    STATE_OFFICIAL,   // Wash. 2d, Cal. 4th ...
    STATE_UNOFFICIAL, // Cal. Rptr., N.Y.S., Ill. Dec.
    DATABASE          // WL, LEXIS
}
