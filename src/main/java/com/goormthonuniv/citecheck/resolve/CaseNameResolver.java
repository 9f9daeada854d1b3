package com.goormthonuniv.citecheck.resolve;

import com.goormthonuniv.citecheck.util.TextUtils;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 인용 바로 앞 텍스트(윈도)에서 사건명을 찾는다.
 *
 * <p>윈도 끝에서 거꾸로 훑어 마지막 절(clause)만 남긴 뒤, {@link NameStrategy} 순서대로 시도한다.
 * 절 경계: 문장 끝 마침표, ; : ( ) [ ] 따옴표, 빈 줄.</p>
 */
class CaseNameResolver {

    private static final Set<String> V_TOKENS = Set.of("v.", "v", "vs.", "vs");

    // 사건명 내부에 올 수 있는 소문자 연결어
    private static final Set<String> CONNECTIVES = Set.of(
            "of", "the", "and", "&", "for", "de", "del", "la", "ex", "rel.", "on", "behalf", "re", "et", "al.",
            "a", "an", "to", "at", "in");

    private static final Set<String> FRAGMENT_EXCLUDED = Set.of(
            "court", "id.", "id", "see", "the", "this", "that", "supreme", "appeals", "here", "we", "it");

    private static final Pattern TRAILING_YEAR = Pattern.compile("\\(\\s*\\d{4}\\s*\\)\\s*$");
    private static final Pattern CITATION_INSIDE = Pattern.compile("\\d+\\s+[A-Z][A-Za-z.]*\\s*\\d*[a-z]*\\s+\\d+");

    private static final int MIN_LEN = 4;
    private static final int MAX_LEN = 200;

    /**
     * @param window 인용 직전까지의 텍스트 (run의 첫 인용 앞)
     */
    Optional<ResolvedName> resolve(String window) {
        if (window == null || window.isBlank()) return Optional.empty();
        String clause = lastClause(trimTail(window));
        if (clause.isBlank()) return Optional.empty();

        List<String> tokens = new ArrayList<>(Arrays.asList(TextUtils.collapseWhitespace(clause).split(" ")));
        if (tokens.isEmpty()) return Optional.empty();

        for (NameStrategy strategy : NameStrategy.values()) {
            Optional<String> name = switch (strategy) {
                case ADJACENT_ADVERSARIAL -> adversarial(tokens, true);
                case PROCEDURAL -> procedural(tokens);
                case NEAREST_ADVERSARIAL -> adversarial(tokens, false);
                case CAPTION_FRAGMENT -> fragment(tokens);
            };
            Optional<String> clean = name.map(CaseNameResolver::cleanup).filter(CaseNameResolver::valid);
            if (clean.isPresent()) {
                return Optional.of(new ResolvedName(clean.get(), strategy));
            }
        }
        return Optional.empty();
    }

    // ===================== 절 분리 =====================

    /** 끝의 쉼표/공백과 캘리포니아식 "(2004)"를 떼어낸다 */
    static String trimTail(String window) {
        String w = window.stripTrailing();
        while (w.endsWith(",")) w = w.substring(0, w.length() - 1).stripTrailing();
        w = TRAILING_YEAR.matcher(w).replaceFirst("").stripTrailing();
        while (w.endsWith(",")) w = w.substring(0, w.length() - 1).stripTrailing();
        return w;
    }

    static String lastClause(String w) {
        for (int i = w.length() - 1; i >= 0; i--) {
            char c = w.charAt(i);
            switch (c) {
                case ';', ':', '(', ')', '[', ']', '"', '“', '”', '?', '!' -> {
                    return w.substring(i + 1);
                }
                case '\n' -> {
                    int j = i - 1;
                    while (j >= 0 && w.charAt(j) != '\n' && Character.isWhitespace(w.charAt(j))) j--;
                    if (j >= 0 && w.charAt(j) == '\n') return w.substring(i + 1);
                }
                case '.' -> {
                    boolean followedBySpace = i + 1 < w.length() && Character.isWhitespace(w.charAt(i + 1));
                    if (followedBySpace && LegalAbbreviations.endsSentence(wordEndingAt(w, i))) {
                        return w.substring(i + 1);
                    }
                }
                default -> { }
            }
        }
        return w;
    }

    private static String wordEndingAt(String w, int dotIdx) {
        int s = dotIdx;
        while (s > 0 && !Character.isWhitespace(w.charAt(s - 1))) s--;
        return w.substring(s, dotIdx + 1);
    }

    // ===================== 전략 =====================

    /**
     * @param adjacent true면 "v." 뒤 토큰이 모두 표제어여야 한다 (인용과 바로 붙은 사건명)
     */
    private static Optional<String> adversarial(List<String> tokens, boolean adjacent) {
        for (int k = tokens.size() - 1; k > 0; k--) {
            if (!V_TOKENS.contains(tokens.get(k))) continue;

            List<String> defendant = new ArrayList<>();
            boolean allCaption = true;
            for (int j = k + 1; j < tokens.size(); j++) {
                String t = tokens.get(j);
                if (!captionLike(t)) {
                    allCaption = false;
                    break;
                }
                if (t.endsWith(",") && j < tokens.size() - 1) {
                    defendant.add(t.substring(0, t.length() - 1));
                    allCaption = false;
                    break;
                }
                defendant.add(t);
            }
            if (adjacent && !allCaption) return Optional.empty();
            if (defendant.isEmpty() || !hasCapitalized(defendant)) {
                if (adjacent) return Optional.empty();
                continue;
            }

            List<String> plaintiff = walkBack(tokens, k - 1);
            if (plaintiff.isEmpty()) {
                if (adjacent) return Optional.empty();
                continue;
            }
            return Optional.of(String.join(" ", plaintiff) + " v. " + String.join(" ", defendant));
        }
        return Optional.empty();
    }

    private static Optional<String> procedural(List<String> tokens) {
        for (int p = tokens.size() - 2; p >= 0; p--) {
            String a = tokens.get(p).toLowerCase(Locale.ROOT);
            String b = tokens.get(p + 1).toLowerCase(Locale.ROOT);
            boolean prefix = (a.equals("in") && b.equals("re"))
                    || (a.equals("ex") && b.equals("parte"))
                    || (a.equals("matter") && b.equals("of"))
                    || (a.equals("estate") && b.equals("of"));
            if (!prefix) continue;

            List<String> rest = tokens.subList(p + 2, tokens.size());
            if (rest.isEmpty() || !hasCapitalized(rest)) return Optional.empty();
            for (String t : rest) {
                if (!captionLike(t)) return Optional.empty();
            }
            int from = p;
            // "In the Matter of X"
            if (a.equals("matter") && p >= 2
                    && tokens.get(p - 1).equalsIgnoreCase("the") && tokens.get(p - 2).equalsIgnoreCase("in")) {
                from = p - 2;
            }
            List<String> name = new ArrayList<>(tokens.subList(from, tokens.size()));
            name.set(0, capitalize(name.get(0)));
            return Optional.of(String.join(" ", name));
        }
        return Optional.empty();
    }

    private static Optional<String> fragment(List<String> tokens) {
        List<String> out = new ArrayList<>();
        for (int j = tokens.size() - 1; j >= 0; j--) {
            String t = tokens.get(j);
            boolean cap = Character.isUpperCase(t.charAt(0));
            boolean link = t.equals("of") || t.equals("&") || t.equals("and");
            if (!(cap || link)) break;
            if (t.endsWith(",") && j < tokens.size() - 1) break;
            out.add(0, t);
        }
        while (!out.isEmpty() && !Character.isUpperCase(out.get(0).charAt(0))) out.remove(0);
        out = trimLeadingStopwords(out);
        if (out.isEmpty()) return Optional.empty();
        if (out.size() == 1 && FRAGMENT_EXCLUDED.contains(stripPunct(out.get(0)).toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        boolean substantive = out.stream()
                .map(CaseNameResolver::stripPunct)
                .anyMatch(t -> t.length() >= 3 && !FRAGMENT_EXCLUDED.contains(t.toLowerCase(Locale.ROOT)));
        return substantive ? Optional.of(String.join(" ", out)) : Optional.empty();
    }

    // ===================== 보조 =====================

    /** v. 앞쪽으로 표제어가 이어지는 동안 거슬러 올라간 뒤 앞쪽 기능어를 잘라낸다 */
    private static List<String> walkBack(List<String> tokens, int from) {
        List<String> out = new ArrayList<>();
        for (int j = from; j >= 0; j--) {
            String t = tokens.get(j);
            if (!captionLike(t) || t.endsWith(",")) break;
            out.add(0, t);
        }
        out = trimLeadingStopwords(out);
        return hasCapitalized(out) ? out : List.of();
    }

    private static List<String> trimLeadingStopwords(List<String> in) {
        Set<String> stop = TextUtils.stopwords();
        int s = 0;
        while (s < in.size()) {
            String t = in.get(s);
            String lower = stripPunct(t).toLowerCase(Locale.ROOT);
            boolean inRe = lower.equals("in") && s + 1 < in.size() && in.get(s + 1).equalsIgnoreCase("re");
            if (inRe) break;
            if (stop.contains(lower) || stop.contains(t.toLowerCase(Locale.ROOT))
                    || (Character.isLowerCase(t.charAt(0)) && CONNECTIVES.contains(t))) {
                s++;
                continue;
            }
            break;
        }
        return new ArrayList<>(in.subList(s, in.size()));
    }

    private static boolean captionLike(String t) {
        if (t.isEmpty()) return false;
        char c = t.charAt(0);
        if (Character.isUpperCase(c)) return true;
        if (c == '&') return true;
        return CONNECTIVES.contains(t) || CONNECTIVES.contains(stripPunct(t));
    }

    private static boolean hasCapitalized(List<String> ts) {
        for (String t : ts) {
            if (!t.isEmpty() && Character.isUpperCase(t.charAt(0))) return true;
        }
        return false;
    }

    private static String stripPunct(String t) {
        int s = 0;
        int e = t.length();
        while (s < e && !Character.isLetterOrDigit(t.charAt(s))) s++;
        while (e > s && !Character.isLetterOrDigit(t.charAt(e - 1))) e--;
        return t.substring(s, e);
    }

    private static String capitalize(String t) {
        return t.isEmpty() ? t : Character.toUpperCase(t.charAt(0)) + t.substring(1);
    }

    static String cleanup(String name) {
        String n = TextUtils.collapseWhitespace(name);
        while (!n.isEmpty() && ",;:".indexOf(n.charAt(n.length() - 1)) >= 0) {
            n = n.substring(0, n.length() - 1).stripTrailing();
        }
        if (n.endsWith(".")) {
            String last = n.substring(n.lastIndexOf(' ') + 1);
            if (!LegalAbbreviations.isAbbreviation(last)) {
                n = n.substring(0, n.length() - 1);
            }
        }
        return n;
    }

    static boolean valid(String name) {
        if (name == null) return false;
        if (name.length() < MIN_LEN || name.length() > MAX_LEN) return false;
        if (!Character.isLetter(name.charAt(0))) return false;
        for (char c : name.toCharArray()) {
            if ("();[]\"".indexOf(c) >= 0) return false;
        }
        return !CITATION_INSIDE.matcher(name).find();
    }
}
