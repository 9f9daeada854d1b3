package com.goormthonuniv.citecheck.resolve;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 인용마다 사건명과 연도를 채운다.
 *
 * <p>사건명 윈도는 인용이 속한 run의 첫 인용 앞에서 끝나고, 그 앞 인용의 끝을 넘어가지 않는다.
 * 그래서 "Brown v. Board, 347 U.S. 483, 74 S. Ct. 686"의 두 인용은 같은 이름을 받고,
 * 앞 문장의 다른 사건명이 섞여 들어오지 않는다.</p>
 */
@Slf4j
@Component
public class CaseNameDateResolver {

    private final int nameWindowChars;
    private final CaseNameResolver names = new CaseNameResolver();
    private final DateResolver dates;

    public CaseNameDateResolver(CiteCheckProperties props) {
        this.nameWindowChars = props.getResolver().getNameWindowChars();
        this.dates = new DateResolver(props.getResolver().getYearWindowChars());
    }

    /** citations는 문서 순서. run 배정(analyze 단계)이 끝난 상태여야 한다. */
    public void resolve(String text, List<Citation> citations) {
        if (text == null || citations.isEmpty()) return;

        Map<Integer, List<Citation>> runs = groupRuns(citations);
        int named = 0;
        for (Citation c : citations) {
            List<Citation> run = runs.getOrDefault(c.getRunId(), List.of(c));
            Citation first = run.get(0);

            int floor = previousEnd(citations, first);
            int from = Math.max(floor, first.getStart() - nameWindowChars);
            String window = text.substring(from, first.getStart());

            Optional<ResolvedName> name;
            try {
                name = names.resolve(window);
            } catch (RuntimeException e) {
                log.warn("case name resolution failed for {}: {}", c.getText(), e.toString());
                name = Optional.empty();
            }
            String year = dates.resolve(text, c, run).orElse(null);

            c.applyResolution(name.map(ResolvedName::name).orElse(null),
                    name.map(ResolvedName::confidence).orElse(0.0),
                    year);
            if (name.isPresent()) named++;
        }
        log.debug("resolved case names for {}/{} citations", named, citations.size());
    }

    private static Map<Integer, List<Citation>> groupRuns(List<Citation> citations) {
        Map<Integer, List<Citation>> runs = new HashMap<>();
        for (Citation c : citations) {
            if (c.getRunId() == null) continue;
            runs.computeIfAbsent(c.getRunId(), k -> new ArrayList<>()).add(c);
        }
        return runs;
    }

    private static int previousEnd(List<Citation> citations, Citation first) {
        int end = 0;
        for (Citation c : citations) {
            if (c.getStart() >= first.getStart()) break;
            end = Math.max(end, c.getEnd());
        }
        return end;
    }
}
