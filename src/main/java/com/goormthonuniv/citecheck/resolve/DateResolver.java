package com.goormthonuniv.citecheck.resolve;

import com.goormthonuniv.citecheck.extract.Citation;

import java.time.Year;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 인용에 붙은 선고 연도 해석.
 * 우선순위: 이 인용 바로 뒤 괄호 → 같은 run을 닫는 괄호 → 바로 앞 "(2004)" → WL/LEXIS 내장 연도
 */
class DateResolver {

    // 핀포인트(", 495", ", at *3") 다음에 오는 "(9th Cir. 2004)" 류 괄호
    private static final Pattern BOUND_PAREN = Pattern.compile(
            "^(?:\\s*,\\s*(?:at\\s+)?\\*?\\d{1,5}(?:[-–]\\d{1,5})?)*\\s*\\(([^()]{0,60}?)\\b(\\d{4})\\)");
    private static final Pattern PRECEDING_PAREN = Pattern.compile("\\((\\d{4})\\)\\s*$");

    private final int windowChars;

    DateResolver(int windowChars) {
        this.windowChars = windowChars;
    }

    /**
     * @param runMembers 같은 run에 속한 인용들 (문서 순서, self 포함)
     */
    Optional<String> resolve(String text, Citation self, List<Citation> runMembers) {
        Optional<String> bound = boundAfter(text, self.getEnd());
        if (bound.isPresent()) return bound;

        // 병렬 인용: run의 마지막 인용 뒤 괄호를 공유
        Citation last = runMembers.isEmpty() ? self : runMembers.get(runMembers.size() - 1);
        if (last != self) {
            Optional<String> shared = boundAfter(text, last.getEnd());
            if (shared.isPresent()) return shared;
        }

        Citation first = runMembers.isEmpty() ? self : runMembers.get(0);
        int from = Math.max(0, first.getStart() - windowChars);
        Matcher pre = PRECEDING_PAREN.matcher(text.substring(from, first.getStart()));
        if (pre.find() && plausible(pre.group(1))) {
            return Optional.of(pre.group(1));
        }

        OptionalInt embedded = self.embeddedYear();
        if (embedded.isPresent() && plausible(String.valueOf(embedded.getAsInt()))) {
            return Optional.of(String.valueOf(embedded.getAsInt()));
        }
        return Optional.empty();
    }

    private Optional<String> boundAfter(String text, int end) {
        int to = Math.min(text.length(), end + windowChars);
        Matcher m = BOUND_PAREN.matcher(text.substring(end, to));
        if (m.find() && plausible(m.group(2))) {
            return Optional.of(m.group(2));
        }
        return Optional.empty();
    }

    static boolean plausible(String year) {
        try {
            int y = Integer.parseInt(year);
            return y >= 1700 && y <= Year.now().getValue() + 1;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
