package com.goormthonuniv.citecheck.extract;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 쉼표로 이어진 인용 묶음(citation run)을 찾는다.
 * "347 U.S. 483, 74 S. Ct. 686, 98 L. Ed. 873" → 하나의 run.
 */
public final class CitationRuns {

    // 인용 사이에 쉼표/공백/대괄호만 있으면 같은 run
    private static final Pattern RUN_GAP = Pattern.compile("[\\s,\\[]*");

    private CitationRuns() {}

    /** @return run 개수 */
    public static int assign(String text, List<Citation> citations) {
        int runId = -1;
        Citation prev = null;
        for (Citation c : citations) {
            if (prev == null || !sameRun(text, prev, c)) {
                runId++;
            }
            c.assignRun(runId);
            prev = c;
        }
        return runId + 1;
    }

    public static boolean sameRun(String text, Citation a, Citation b) {
        if (a.getEnd() > b.getStart()) return false;
        String gap = text.substring(a.getEnd(), b.getStart());
        boolean separated = gap.indexOf(',') >= 0 || gap.indexOf('[') >= 0;
        return separated && RUN_GAP.matcher(gap).matches();
    }
}
