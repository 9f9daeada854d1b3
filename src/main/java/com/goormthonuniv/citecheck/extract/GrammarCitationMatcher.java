package com.goormthonuniv.citecheck.extract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 토큰 단위 인용 문법 매처.
 *
 * <pre>
 *   VOLUME  REPORTER-TOKEN{1..5}  PAGE  ( "," PIN ( "-" PIN )? ){0..10}
 * </pre>
 *
 * 리포터 토큰은 공백을 무시한 키로 사전에서 찾기 때문에 "F. 3d", "L.Ed.2d", 줄바꿈으로 끊긴 리포터도 인식한다.
 * 가장 긴 토큰 조합을 우선한다 ("U.S. Dist. LEXIS" > "U.S.").
 */
@Component
public class GrammarCitationMatcher implements CitationMatcher {

    private static final int MAX_REPORTER_TOKENS = 5;

    private final ReporterCatalog catalog;

    public GrammarCitationMatcher(ReporterCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.GRAMMAR;
    }

    @Override
    public List<CitationMatch> match(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<Token> tokens = tokenize(text);
        List<CitationMatch> out = new ArrayList<>();

        int i = 0;
        while (i < tokens.size()) {
            Token vol = tokens.get(i);
            if (vol.kind() != Kind.NUM || vol.text().length() > 4 || !leftBoundaryOk(text, vol.start())) {
                i++;
                continue;
            }
            Optional<ReporterRun> rep = reporterAt(tokens, i + 1);
            if (rep.isEmpty()) {
                i++;
                continue;
            }
            int pageIdx = i + 1 + rep.get().tokenCount();
            if (pageIdx >= tokens.size() || tokens.get(pageIdx).kind() != Kind.NUM) {
                i++;
                continue;
            }
            Token page = tokens.get(pageIdx);
            Reporter reporter = rep.get().reporter();
            if (!CitationGuards.plausible(reporter, vol.text(), page.text())
                    || CitationGuards.pageRunsIntoWord(text, page.end())) {
                i++;
                continue;
            }

            // 핀포인트: ", 495" / ", 497-98". 다음 인용의 권호(", 74 S. Ct.")는 제외
            List<String> pins = new ArrayList<>();
            int last = pageIdx;
            int j = pageIdx + 1;
            while (j + 1 < tokens.size()
                    && pins.size() < CitationGuards.MAX_PINS
                    && tokens.get(j).kind() == Kind.COMMA
                    && tokens.get(j + 1).kind() == Kind.NUM
                    && tokens.get(j + 1).text().length() <= 5
                    && reporterAt(tokens, j + 2).isEmpty()) {
                String pin = tokens.get(j + 1).text();
                last = j + 1;
                j += 2;
                if (j + 1 < tokens.size()
                        && tokens.get(j).kind() == Kind.DASH
                        && tokens.get(j + 1).kind() == Kind.NUM
                        && tokens.get(j).start() == tokens.get(j - 1).end()) {
                    pin = pin + "-" + tokens.get(j + 1).text();
                    last = j + 1;
                    j += 2;
                }
                pins.add(pin);
            }

            int start = vol.start();
            int end = tokens.get(last).end();
            out.add(new CitationMatch(start, end, text.substring(start, end), reporter,
                    vol.text(), page.text(), pins, strategy()));
            i = last + 1;
        }
        return out;
    }

    private Optional<ReporterRun> reporterAt(List<Token> tokens, int from) {
        int maxRun = 0;
        while (maxRun < MAX_REPORTER_TOKENS
                && from + maxRun < tokens.size()
                && tokens.get(from + maxRun).kind() == Kind.WORD) {
            maxRun++;
        }
        for (int k = maxRun; k >= 1; k--) {
            StringBuilder key = new StringBuilder();
            for (int t = from; t < from + k; t++) {
                key.append(tokens.get(t).text());
            }
            Optional<Reporter> r = catalog.lookup(key.toString());
            if (r.isPresent()) {
                return Optional.of(new ReporterRun(r.get(), k));
            }
        }
        return Optional.empty();
    }

    private static boolean leftBoundaryOk(String text, int start) {
        if (start == 0) return true;
        char prev = text.charAt(start - 1);
        return !(Character.isLetterOrDigit(prev) || prev == '.' || prev == '§' || prev == '$');
    }

    // ------------------------ 토크나이저 ------------------------

    enum Kind { NUM, WORD, COMMA, DASH, OTHER }

    record Token(Kind kind, int start, int end, String text) {}

    private record ReporterRun(Reporter reporter, int tokenCount) {}

    static List<Token> tokenize(String text) {
        List<Token> out = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            int s = i;
            if (Character.isDigit(ch)) {
                while (i < n && Character.isDigit(text.charAt(i))) i++;
                if (i < n && Character.isLetter(text.charAt(i))) {
                    // "2d", "4th" 같은 시리즈 표기
                    while (i < n && isWordChar(text.charAt(i))) i++;
                    out.add(new Token(Kind.WORD, s, i, text.substring(s, i)));
                } else {
                    out.add(new Token(Kind.NUM, s, i, text.substring(s, i)));
                }
            } else if (Character.isLetter(ch)) {
                while (i < n && isWordChar(text.charAt(i))) i++;
                out.add(new Token(Kind.WORD, s, i, text.substring(s, i)));
            } else if (ch == ',') {
                i++;
                out.add(new Token(Kind.COMMA, s, i, ","));
            } else if (ch == '-' || ch == '–') {
                i++;
                out.add(new Token(Kind.DASH, s, i, "-"));
            } else {
                i++;
                out.add(new Token(Kind.OTHER, s, i, String.valueOf(ch)));
            }
        }
        return out;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '.' || c == '\'' || c == '’';
    }
}
