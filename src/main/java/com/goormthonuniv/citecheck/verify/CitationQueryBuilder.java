package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.util.TextUtils;

import java.util.*;

/**
 * 웹 검색 티어용 쿼리 생성.
 *
 * 설계 포인트
 * - 인용 문자열과 사건명을 따옴표로 고정 (순서: 둘 다 → 인용만 → 사건명+연도)
 * - site: 필터로 법률 자료 도메인만 (검색 엔진이 무시해도 결과는 allow-list로 다시 거른다)
 * - 중복 제거, 길이 제한
 * - 출력은 원문 문자열(인코딩 X). URL 조립 시점에서 어댑터가 인코딩한다.
 */
public final class CitationQueryBuilder {

    private static final int MAX_QUERY_LEN = 320;

    private CitationQueryBuilder() {}

    static List<String> buildQueries(Citation c, List<String> domains) {
        String cite = quote(c.normalized());
        String name = c.getExtractedCaseName();
        String year = c.getExtractedDate();
        String sites = siteFilter(domains);

        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (name != null && !name.isBlank()) {
            add(out, cite + " " + quote(name), sites);
        }
        add(out, cite, sites);
        String asWritten = TextUtils.collapseWhitespace(c.getText());
        if (c.getPinpoints().isEmpty() && !asWritten.equals(c.normalized())) {
            // 원문 표기("Wn.2d")로도 한 번
            add(out, quote(asWritten), sites);
        }
        if (name != null && !name.isBlank() && year != null) {
            add(out, quote(name) + " " + year, sites);
        }
        return List.copyOf(out);
    }

    private static void add(Set<String> out, String core, String sites) {
        String q = sites.isEmpty() ? core : core + " " + sites;
        if (q.length() > MAX_QUERY_LEN) q = core;
        if (q.length() > MAX_QUERY_LEN) q = q.substring(0, MAX_QUERY_LEN);
        out.add(q.strip());
    }

    private static String siteFilter(List<String> domains) {
        if (domains == null || domains.isEmpty()) return "";
        StringJoiner j = new StringJoiner(" OR ", "(", ")");
        for (String d : domains) j.add("site:" + d);
        return j.toString();
    }

    private static String quote(String s) {
        return "\"" + s.replace("\"", "").strip() + "\"";
    }
}
