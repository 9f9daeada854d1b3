package com.goormthonuniv.citecheck.cluster;

import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.service.SimilarityService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;

/**
 * 클러스터 대표 사건명/날짜 선택.
 * 1) 검증된 멤버 (검증 신뢰도 높은 순, 동률이면 문서 순) 의 canonical 값을 그대로
 * 2) 없으면 추출값 중 신뢰도 최고, 동률이면 다수결, 그래도 동률이면 문서 순
 */
@Component
@RequiredArgsConstructor
public class CanonicalDataSelector {

    private final SimilarityService similarity;

    public record Canonical(String name, String date, boolean verified) {}

    public Canonical select(List<Citation> members) {
        Optional<Citation> verified = members.stream()
                .filter(Citation::isVerified)
                .max(Comparator.comparingDouble(Citation::getVerificationConfidence)
                        .thenComparing(Comparator.comparingInt(Citation::getIndex).reversed()));
        if (verified.isPresent()) {
            Citation v = verified.get();
            return new Canonical(v.getCanonicalName(), v.getCanonicalDate(), true);
        }

        String name = pick(members, Citation::getExtractedCaseName, Citation::getNameConfidence,
                similarity::normalizeCaseName);
        String date = pick(members, Citation::getExtractedDate, Citation::getConfidence, Function.identity());
        return new Canonical(name, date, false);
    }

    private static String pick(List<Citation> members,
                               Function<Citation, String> value,
                               Function<Citation, Double> confidence,
                               Function<String, String> voteKey) {
        List<Citation> candidates = members.stream()
                .filter(c -> value.apply(c) != null && !value.apply(c).isBlank())
                .toList();
        if (candidates.isEmpty()) return null;

        double best = candidates.stream().mapToDouble(confidence::apply).max().orElse(0.0);
        List<Citation> top = candidates.stream()
                .filter(c -> Double.compare(confidence.apply(c), best) == 0)
                .toList();
        if (top.size() == 1) return value.apply(top.get(0));

        // 다수결: 전체 후보 중 같은 값(정규화 키)을 가진 수
        Map<String, Integer> votes = new HashMap<>();
        for (Citation c : candidates) {
            votes.merge(voteKey.apply(value.apply(c)), 1, Integer::sum);
        }
        Citation winner = top.get(0);
        int winnerVotes = votes.getOrDefault(voteKey.apply(value.apply(winner)), 0);
        for (Citation c : top) {
            int v = votes.getOrDefault(voteKey.apply(value.apply(c)), 0);
            if (v > winnerVotes) {
                winner = c;
                winnerVotes = v;
            }
        }
        return value.apply(winner);
    }
}
