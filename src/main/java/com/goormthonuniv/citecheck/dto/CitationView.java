package com.goormthonuniv.citecheck.dto;

import com.goormthonuniv.citecheck.extract.Citation;

import java.util.List;
import java.util.Locale;

public record CitationView(
        String citation,             // 원문 그대로
        String normalizedCitation,   // "150 Wash. 2d 674"
        String reporter,
        String volume,
        String page,
        List<String> pinpoints,
        String extractedCaseName,
        String extractedDate,
        int startIndex,
        int endIndex,
        boolean verified,
        String verificationStatus,   // unverified | pending | verified | unverified_exhausted
        String source,               // 채택된 검증 소스
        double confidence,           // 추출 신뢰도 0.0~1.0
        String canonicalName,
        String canonicalDate,
        String canonicalUrl,
        String clusterId
) {
    public static CitationView of(Citation c, String clusterId) {
        return new CitationView(
                c.getText(),
                c.normalized(),
                c.getReporter().canonical(),
                c.getVolume(),
                c.getPage(),
                c.getPinpoints(),
                c.getExtractedCaseName(),
                c.getExtractedDate(),
                c.getStart(),
                c.getEnd(),
                c.isVerified(),
                c.getVerificationStatus().name().toLowerCase(Locale.ROOT),
                c.getSource(),
                c.getConfidence(),
                c.getCanonicalName(),
                c.getCanonicalDate(),
                c.getCanonicalUrl(),
                clusterId
        );
    }
}
