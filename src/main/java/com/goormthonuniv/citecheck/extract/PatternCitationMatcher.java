package com.goormthonuniv.citecheck.extract;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 정규식 기반 매처. 리포터 사전의 표기를 그대로 이어 붙인 엄격한 패턴이라
 * 공백 한 칸 규칙을 벗어난 표기("F.  3d", 줄바꿈 두 번 등)는 문법 매처가 맡는다.
 */
@Component
public class PatternCitationMatcher implements CitationMatcher {

    private static final Pattern PIN_SPLIT = Pattern.compile("\\s*,\\s*");

    private final ReporterCatalog catalog;
    private final Pattern pattern;

    public PatternCitationMatcher(ReporterCatalog catalog) {
        this.catalog = catalog;
        this.pattern = compile(catalog);
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.PATTERN;
    }

    @Override
    public List<CitationMatch> match(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<CitationMatch> out = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            Optional<Reporter> reporter = catalog.lookup(m.group("rep"));
            if (reporter.isEmpty()) continue;

            String volume = m.group("vol");
            String page = m.group("page");
            if (!CitationGuards.plausible(reporter.get(), volume, page)) continue;
            if (CitationGuards.pageRunsIntoWord(text, m.end("page"))) continue;

            List<String> pins = new ArrayList<>();
            String rawPins = m.group("pins");
            if (rawPins != null && !rawPins.isBlank()) {
                for (String p : PIN_SPLIT.split(rawPins.strip())) {
                    if (!p.isBlank()) pins.add(p.strip());
                }
            }
            out.add(new CitationMatch(m.start(), m.end(), m.group(), reporter.get(),
                    volume, page, pins, strategy()));
        }
        return out;
    }

    private static Pattern compile(ReporterCatalog catalog) {
        List<String> spellings = new ArrayList<>();
        for (Reporter r : catalog.reporters()) {
            spellings.addAll(r.variants());
        }
        // 긴 표기 우선 ("F. Supp. 2d" > "F. Supp." > "F.")
        spellings.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));

        StringJoiner alt = new StringJoiner("|");
        for (String s : new LinkedHashSet<>(spellings)) {
            StringJoiner parts = new StringJoiner("\\s");
            for (String part : s.split(" ")) {
                parts.add(Pattern.quote(part));
            }
            alt.add(parts.toString());
        }

        String regex = "(?<![\\w.§$])"
                + "(?<vol>\\d{1,4})\\s"
                + "(?<rep>" + alt + ")(?![A-Za-z'’])\\s"
                + "(?<page>\\d{1,9})(?![\\w])"
                + "(?<pins>(?:,\\s?\\d{1,5}(?:[-–]\\d{1,5})?(?=\\s*(?:[,;.)(\\[]|$))){0," + CitationGuards.MAX_PINS + "})";
        return Pattern.compile(regex);
    }
}
