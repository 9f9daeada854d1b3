package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.service.SimilarityService;
import org.springframework.stereotype.Component;

import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 페이지가 "그 인용에 실린 판결 자체"인지 판정한다.
 *
 * <p>인용하는 쪽(뒤에 나온 판결)의 페이지도 본문에 같은 인용 문자열을 담고 있다. 그래서
 * 제목이 그 사건명을 가리키는지, 인용이 머리 영역(제목/헤딩/본문 앞부분)에 나오는지를 따로 본다.</p>
 */
@Component
public class OpinionPageValidator {

    static final double TITLE_NAME_SIGNAL = 0.6;
    static final double HEADER_CITATION_SIGNAL = 0.4;

    private static final Pattern TITLE_SPLIT = Pattern.compile("\\s+(?:\\||::|–|—|-)\\s+");
    private static final Pattern NAME_END = Pattern.compile(",\\s*\\d|\\s\\(\\d|,\\s*No\\.|\\s+\\d{1,4}\\s+[A-Z]");
    private static final Pattern PAREN_YEAR = Pattern.compile("\\((?:[^()]*?\\s)?(1[7-9]\\d{2}|20\\d{2})\\)");
    private static final Pattern CASE_SHAPE = Pattern.compile("\\sv\\.?\\s|^(?:In re|Ex parte|Matter of|Estate of)\\s", Pattern.CASE_INSENSITIVE);

    private final SimilarityService similarity;
    private final double nameThreshold;

    public OpinionPageValidator(SimilarityService similarity, CiteCheckProperties props) {
        this.similarity = similarity;
        this.nameThreshold = props.getClustering().getNameSimilarityThreshold();
    }

    public record PageVerdict(
            String caseNameFromTitle,
            String year,
            boolean titleNamesCase,
            boolean citationInHeader,
            boolean citationInBody
    ) {
        /** 웹 검색 티어용 신호 */
        public double signal() {
            return (titleNamesCase ? TITLE_NAME_SIGNAL : 0.0) + (citationInHeader ? HEADER_CITATION_SIGNAL : 0.0);
        }

        public boolean citingRatherThanCited() {
            return citationInBody && !titleNamesCase;
        }
    }

    public PageVerdict validate(Citation citation, OpinionPage page) {
        String titleName = caseNameFromTitle(page);
        Pattern cite = citationPattern(citation);
        boolean inHeader = cite.matcher(page.headerText()).find();
        boolean inBody = inHeader || cite.matcher(page.bodyText()).find();

        boolean titleNames;
        String expected = citation.getExtractedCaseName();
        if (expected != null && !expected.isBlank()) {
            titleNames = titleName != null && namesMatch(expected, titleName);
        } else {
            // 이름을 모르면 제목 자체에 인용이 찍혀 있어야 한다
            titleNames = titleName != null && cite.matcher(page.title()).find();
        }
        return new PageVerdict(titleName, yearFrom(page), titleNames, inHeader, inBody);
    }

    /** 직접 링크 티어: 기대 사건명이 제목에 있으면 1.0, 본문에만 있으면 0.85, 없으면 0 */
    public double nameSignal(String expectedName, OpinionPage page) {
        if (expectedName == null || expectedName.isBlank()) return 0.0;
        String titleName = caseNameFromTitle(page);
        if (titleName != null && namesMatch(expectedName, titleName)) return 1.0;
        if (containsNormalized(page.title(), expectedName)) return 1.0;
        if (containsNormalized(page.headerText(), expectedName) || containsNormalized(page.bodyText(), expectedName)) {
            return 0.85;
        }
        return 0.0;
    }

    /** "Brown v. Board of Education, 347 U.S. 483 (1954) :: Justia" → "Brown v. Board of Education" */
    public String caseNameFromTitle(OpinionPage page) {
        String fromTitle = caseNameIn(page.title());
        if (fromTitle != null) return fromTitle;
        for (String h : page.headings()) {
            String fromHeading = caseNameIn(h);
            if (fromHeading != null) return fromHeading;
        }
        return null;
    }

    public String yearFrom(OpinionPage page) {
        Matcher m = PAREN_YEAR.matcher(page.title());
        if (m.find()) return m.group(1);
        for (String h : page.headings()) {
            Matcher hm = PAREN_YEAR.matcher(h);
            if (hm.find()) return hm.group(1);
        }
        return null;
    }

    // ------------------------ 내부 유틸 ------------------------

    private boolean namesMatch(String expected, String actual) {
        return similarity.caseNameSimilarity(expected, actual) >= nameThreshold;
    }

    private boolean containsNormalized(String haystack, String name) {
        if (haystack == null || haystack.isBlank()) return false;
        String n = similarity.normalizeCaseName(name);
        if (n.isBlank()) return false;
        return (" " + similarity.normalizeCaseName(haystack) + " ").contains(" " + n + " ");
    }

    private static String caseNameIn(String text) {
        if (text == null || text.isBlank()) return null;
        for (String part : TITLE_SPLIT.split(text)) {
            String p = part.strip();
            if (!CASE_SHAPE.matcher(" " + p).find() && !CASE_SHAPE.matcher(p).find()) continue;
            Matcher end = NAME_END.matcher(p);
            String name = end.find() ? p.substring(0, end.start()) : p;
            name = name.strip();
            if (name.length() >= 4) return name;
        }
        return null;
    }

    /** 권/리포터(모든 표기)/면을 공백·마침표 변형에 관대하게 찾는 패턴 */
    static Pattern citationPattern(Citation c) {
        StringJoiner alt = new StringJoiner("|");
        for (String variant : c.getReporter().variants()) {
            StringBuilder sb = new StringBuilder();
            for (char ch : variant.toCharArray()) {
                if (Character.isWhitespace(ch)) continue;
                sb.append(Pattern.quote(String.valueOf(ch)));
                if (ch == '.') sb.append("\\s*");
            }
            alt.add(sb.toString());
        }
        String regex = "(?<!\\d)" + Pattern.quote(c.getVolume()) + "\\s*(?:" + alt + ")\\s*"
                + Pattern.quote(c.getPage()) + "(?!\\d)";
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
