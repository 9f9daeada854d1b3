package com.goormthonuniv.citecheck.extract;

import java.util.List;
import java.util.Set;

/**
 * 정규화된 리포터 기술자.
 *
 * @param canonical     정규 표기 (예: "Wash. 2d")
 * @param family        시리즈 계열 (예: "Wash."). 같은 계열의 다른 시리즈는 병렬 인용이 될 수 없다.
 * @param reporterClass 분류
 * @param jurisdictions 관할 코드 (주 약어, "US", "FED")
 * @param variants      원문에서 허용되는 표기 (정규 표기 포함)
 */
public record Reporter(
        String canonical,
        String family,
        ReporterClass reporterClass,
        Set<String> jurisdictions,
        List<String> variants
) {
    public boolean isDatabase() {
        return reporterClass == ReporterClass.DATABASE;
    }
}
