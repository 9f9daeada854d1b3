package com.goormthonuniv.citecheck.service;

import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 사건명 유사도.
 * 토큰 단위 비교(Jaccard, 포함 관계)에 오탈자 1자 허용(Levenshtein)을 더한다.
 * 문자열 전체 편집거리는 "Smith v. Jones" / "Smith v. Johnson" 같은 다른 사건을 붙여버리므로 쓰지 않는다.
 */
@Service
public class SimilarityService {

    private static final LevenshteinDistance TYPO = new LevenshteinDistance(1);
    private static final Pattern PARTY_SPLIT = Pattern.compile("\\s+vs?\\.?\\s+", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> EXPANSIONS = Map.ofEntries(
            Map.entry("educ", "education"), Map.entry("bd", "board"), Map.entry("dept", "department"),
            Map.entry("dep't", "department"), Map.entry("nat'l", "national"), Map.entry("int'l", "international"),
            Map.entry("ass'n", "association"), Map.entry("comm'n", "commission"), Map.entry("gov't", "government"),
            Map.entry("univ", "university"), Map.entry("dist", "district"), Map.entry("cnty", "county"),
            Map.entry("sch", "school"), Map.entry("hosp", "hospital"), Map.entry("ins", "insurance"),
            Map.entry("mfg", "manufacturing"), Map.entry("servs", "services"), Map.entry("sys", "systems"),
            Map.entry("tel", "telephone"), Map.entry("transp", "transportation"), Map.entry("elec", "electric"),
            Map.entry("med", "medical"), Map.entry("ctr", "center"), Map.entry("auth", "authority"),
            Map.entry("st", "state"), Map.entry("us", "united states"));

    private static final Set<String> NOISE = Set.of(
            "v", "vs", "the", "of", "a", "an", "and", "in", "re", "ex", "rel", "et", "al",
            "inc", "co", "corp", "llc", "ltd", "company", "corporation", "incorporated");

    /**
     * 0.0~1.0. 어느 한쪽이 비어 있으면 0.
     * 양쪽 모두 "A v. B" 형태면 당사자별로 비교해 낮은 쪽을 쓴다. 원고가 같아도 피고가 다르면 다른 사건.
     */
    public double caseNameSimilarity(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) return 0.0;
        String[] pa = PARTY_SPLIT.split(a.strip(), 2);
        String[] pb = PARTY_SPLIT.split(b.strip(), 2);
        if (pa.length == 2 && pb.length == 2) {
            return Math.min(partySimilarity(pa[0], pb[0]), partySimilarity(pa[1], pb[1]));
        }
        return tokenSimilarity(tokens(a), tokens(b), 2);
    }

    private static double partySimilarity(String a, String b) {
        List<String> ta = tokens(a);
        List<String> tb = tokens(b);
        if (ta.isEmpty() && tb.isEmpty()) return 1.0;
        return tokenSimilarity(ta, tb, 1);
    }

    /**
     * Jaccard. 한쪽 토큰이 다른 쪽에 전부 들어 있으면(축약형 사건명) 0.9.
     * 부분 겹침에는 overlap 계수를 쓰지 않는다.
     */
    private static double tokenSimilarity(List<String> ta, List<String> tb, int minContained) {
        if (ta.isEmpty() || tb.isEmpty()) return 0.0;
        if (ta.equals(tb)) return 1.0;

        int shared = fuzzyIntersection(ta, tb);
        Set<String> union = new HashSet<>(ta);
        union.addAll(tb);
        int unionSize = Math.max(union.size() - (shared - exactIntersection(ta, tb)), 1);
        double jaccard = (double) shared / unionSize;

        int smaller = Math.min(new HashSet<>(ta).size(), new HashSet<>(tb).size());
        double contained = smaller >= minContained && shared == smaller ? 0.9 : 0.0;

        return Math.min(1.0, Math.max(jaccard, contained));
    }

    /** 정규화된 사건명 (비교·다수결 키) */
    public String normalizeCaseName(String name) {
        if (name == null) return "";
        return String.join(" ", tokens(name));
    }

    // ------------------------ 내부 유틸 ------------------------

    private static List<String> tokens(String name) {
        String s = name.toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace("&", " and ");
        List<String> out = new ArrayList<>();
        for (String raw : s.split("[\\s,;:()\\-/]+")) {
            String t = raw.replaceAll("[^a-z0-9']", "");
            if (t.endsWith("'s")) t = t.substring(0, t.length() - 2);
            String key = raw.replaceAll("\\.$", "");
            String expanded = EXPANSIONS.getOrDefault(key, EXPANSIONS.get(t));
            if (expanded != null) {
                for (String e : expanded.split(" ")) {
                    if (!NOISE.contains(e)) out.add(e);
                }
                continue;
            }
            t = t.replace("'", "");
            if (t.isEmpty() || NOISE.contains(t)) continue;
            out.add(t);
        }
        return out;
    }

    private static int exactIntersection(List<String> a, List<String> b) {
        Set<String> s = new HashSet<>(a);
        s.retainAll(new HashSet<>(b));
        return s.size();
    }

    /** 길이 5 이상 토큰은 편집거리 1까지 같은 토큰으로 본다 */
    private static int fuzzyIntersection(List<String> a, List<String> b) {
        Set<String> left = new LinkedHashSet<>(a);
        Set<String> right = new LinkedHashSet<>(b);
        int count = 0;
        for (String x : left) {
            String hit = null;
            if (right.contains(x)) {
                hit = x;
            } else if (x.length() >= 5) {
                for (String y : right) {
                    if (y.length() >= 5 && TYPO.apply(x, y) >= 0) {
                        hit = y;
                        break;
                    }
                }
            }
            if (hit != null) {
                right.remove(hit);
                count++;
            }
        }
        return count;
    }
}
