package com.goormthonuniv.citecheck.extract;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 여러 매처의 결과를 합쳐 겹치지 않는 인용 목록을 만든다.
 *
 * <p>겹침 중재 규칙</p>
 * <ol>
 *   <li>더 긴 스팬이 이긴다</li>
 *   <li>길이가 같으면 해당 리포터 분류에서 정밀도가 높은 전략이 이긴다 ({@link MatchStrategy#precisionFor})</li>
 *   <li>그래도 같으면 앞선 스팬, 그 다음 PATTERN</li>
 * </ol>
 * 잘못된 입력이나 내부 오류는 빈 목록으로 돌아간다.
 */
@Slf4j
@Component
public class CitationExtractor {

    // 비동기 전환 판단용 대략치 (숫자 + 대문자 약어 + 숫자)
    private static final Pattern ROUGH_CITATION = Pattern.compile("\\b\\d{1,4}\\s+[A-Z][A-Za-z0-9.'\\s]{0,20}?\\s\\d{1,7}\\b");

    private final List<CitationMatcher> matchers;

    public CitationExtractor(List<CitationMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public List<Citation> extract(String text) {
        if (text == null || text.isBlank()) return List.of();
        try {
            List<CitationMatch> all = new ArrayList<>();
            for (CitationMatcher m : matchers) {
                try {
                    all.addAll(m.match(text));
                } catch (RuntimeException | StackOverflowError e) {
                    log.warn("matcher={} failed, continuing without it: {}", m.strategy(), e.toString());
                }
            }
            List<CitationMatch> chosen = arbitrate(all);

            List<Citation> out = new ArrayList<>(chosen.size());
            for (CitationMatch m : chosen) {
                out.add(new Citation(out.size(), m));
            }
            log.debug("extracted {} citations from {} candidates", out.size(), all.size());
            return out;
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("citation extraction failed, returning no citations: {}", e.toString());
            return List.of();
        }
    }

    /** 문서 규모 추정. 실제 추출보다 훨씬 싸다. */
    public int estimateCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return (int) ROUGH_CITATION.matcher(text).results().count();
    }

    static List<CitationMatch> arbitrate(List<CitationMatch> candidates) {
        List<CitationMatch> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator
                .comparingInt(CitationMatch::length).reversed()
                .thenComparing(Comparator.comparingDouble(CitationMatch::precision).reversed())
                .thenComparingInt(CitationMatch::start)
                .thenComparing(CitationMatch::strategy));

        List<CitationMatch> accepted = new ArrayList<>();
        for (CitationMatch c : ranked) {
            boolean clash = false;
            for (CitationMatch a : accepted) {
                if (a.overlaps(c)) {
                    clash = true;
                    break;
                }
            }
            if (!clash) accepted.add(c);
        }
        accepted.sort(Comparator.comparingInt(CitationMatch::start));
        return accepted;
    }
}
