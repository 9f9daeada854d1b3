package com.goormthonuniv.citecheck.verify;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;

/**
 * 웹 검색 티어가 받아들이는 법률 자료 도메인(allow-list)과 도메인별 신뢰 가중치.
 * - 정확 매핑(exact)과 서픽스 매핑(suffix) 지원, 가장 긴 서픽스 우선
 * - "www.", "m." 프리픽스 제거
 * - 목록에 없는 호스트는 가중치 없음 → 후보에서 제외
 *
 * 가중치 범위
 * - 0.90+: 법원/정부 공식, 판결 원문 DB (CourtListener, Justia 연방대법원)
 * - 0.80~0.89: 판례 전문을 싣는 상용/비영리 사이트
 */
@Component
public class LegalDomainPolicy {

    private final Map<String, Double> exactScores = new HashMap<>();
    private final Map<String, Double> suffixScores = new HashMap<>();
    private final List<String> searchDomains = new ArrayList<>();

    public LegalDomainPolicy() {
        // ===== 판결 원문 DB / 공식 =====
        putSuffix(".courtlistener.com", 0.95);
        putSuffix(".supremecourt.gov", 0.95);
        putSuffix(".govinfo.gov", 0.92);
        putExact("supreme.justia.com", 0.92);
        putExact("law.justia.com", 0.90);
        putSuffix(".justia.com", 0.88);
        putSuffix(".law.cornell.edu", 0.90);
        putSuffix(".courts.wa.gov", 0.90);

        // ===== 판례 전문 제공 사이트 =====
        putExact("caselaw.findlaw.com", 0.88);
        putSuffix(".findlaw.com", 0.82);
        putSuffix(".leagle.com", 0.82);
        putSuffix(".casetext.com", 0.80);
        putSuffix(".law.resource.org", 0.85);

        searchDomains.addAll(List.of(
                "courtlistener.com", "justia.com", "law.cornell.edu", "caselaw.findlaw.com",
                "leagle.com", "casetext.com"));
    }

    /** 허용 도메인이면 가중치, 아니면 empty */
    public OptionalDouble trustPrior(String urlOrHost) {
        String host = normalizeHost(urlOrHost);
        if (host == null || host.isEmpty()) return OptionalDouble.empty();

        Double ex = exactScores.get(host);
        if (ex != null) return OptionalDouble.of(ex);

        Double suf = matchLongestSuffix(host, suffixScores);
        return suf == null ? OptionalDouble.empty() : OptionalDouble.of(suf);
    }

    public boolean allowed(String urlOrHost) {
        return trustPrior(urlOrHost).isPresent();
    }

    /** 검색 쿼리의 site: 필터로 쓰는 대표 도메인 */
    public List<String> searchDomains() {
        return Collections.unmodifiableList(searchDomains);
    }

    /** 입력이 URL이든 호스트든 받아서 정규화된 host를 반환 */
    public String normalizeHost(String urlOrHost) {
        if (urlOrHost == null || urlOrHost.isBlank()) return null;
        String raw = urlOrHost.trim().toLowerCase(Locale.ROOT);

        String host = raw;
        if (raw.contains("://")) {
            host = parseHost(raw);
        } else if (raw.contains("/")) {
            host = parseHost("https://" + raw);
        }
        return stripCommonSubdomainPrefix(host);
    }

    // ------------------------ 내부 유틸 ------------------------

    private static String parseHost(String url) {
        try {
            URI uri = new URI(url);
            return uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private void putExact(String host, double score) {
        exactScores.put(stripCommonSubdomainPrefix(host.toLowerCase(Locale.ROOT)), score);
    }

    private void putSuffix(String suffix, double score) {
        // suffix는 ".example.com" 형태로 관리
        String sfx = suffix.toLowerCase(Locale.ROOT);
        if (!sfx.startsWith(".")) sfx = "." + sfx;
        suffixScores.put(sfx, score);
    }

    private static String stripCommonSubdomainPrefix(String host) {
        if (host == null) return null;
        for (String pref : List.of("www.", "m.")) {
            if (host.startsWith(pref)) {
                return host.substring(pref.length());
            }
        }
        return host;
    }

    private static Double matchLongestSuffix(String host, Map<String, Double> table) {
        // ".law.justia.com" > ".justia.com"
        Double best = null;
        int bestLen = -1;
        for (Map.Entry<String, Double> e : table.entrySet()) {
            String sfx = e.getKey();
            if (host.endsWith(sfx) || host.equals(sfx.substring(1))) {
                if (sfx.length() > bestLen) {
                    bestLen = sfx.length();
                    best = e.getValue();
                }
            }
        }
        return best;
    }
}
