package com.goormthonuniv.citecheck.util;

import java.util.*;
import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern WS = Pattern.compile("\\s+");

    private TextUtils() {}

    /**
     * 길이를 보존하는 정리. 인용 오프셋이 원문과 일치해야 하므로 문자 1:1 치환만 한다.
     * - 제어문자/NBSP/좁은 공백 → ' '
     * - 둥근 따옴표 → 곧은 따옴표, en/em dash → '-'는 하지 않음(핀포인트 범위 "497–98" 보존)
     */
    public static String sanitize(String text) {
        if (text == null) return "";
        char[] cs = text.toCharArray();
        for (int i = 0; i < cs.length; i++) {
            char c = cs[i];
            if (c == ' ' || c == ' ' || c == ' ' || c == '\t' || c == '\f' || c == '\u000B') {
                cs[i] = ' ';
            } else if (c == '\r') {
                // "\r\n" 은 줄바꿈 하나로 ("\n\n" 이면 빈 줄로 읽힌다)
                cs[i] = i + 1 < cs.length && cs[i + 1] == '\n' ? ' ' : '\n';
            } else if (c == '‘' || c == '’') {
                cs[i] = '\'';
            } else if (c == '“' || c == '”') {
                cs[i] = '"';
            } else if (Character.isISOControl(c) && c != '\n') {
                cs[i] = ' ';
            }
        }
        return new String(cs);
    }

    public static String collapseWhitespace(String text) {
        if (text == null) return "";
        return WS.matcher(text).replaceAll(" ").strip();
    }

    /** 사건명 앞뒤에서 잘라낼 인용 신호어/기능어 */
    public static Set<String> stopwords() {
        return Set.of(
                "see", "also", "cf.", "cf", "accord", "but", "compare", "with", "contra", "e.g.", "e.g.,",
                "in", "the", "and", "or", "of", "for", "to", "at", "on", "under", "per", "by", "as",
                "quoting", "citing", "cited", "holding", "following", "overruling", "overruled", "discussing",
                "affirmed", "aff'd", "rev'd", "reversed", "then", "that", "which", "was", "is", "a", "an"
        );
    }
}
