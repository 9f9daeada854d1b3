package com.goormthonuniv.citecheck.dto;

import com.goormthonuniv.citecheck.cluster.CitationCluster;
import com.goormthonuniv.citecheck.extract.Citation;

import java.util.List;

public record ClusterView(
        String clusterId,
        List<String> citations,         // 멤버 인용의 정규 문자열
        List<Integer> citationIndices,  // result.citations 내 위치
        String canonicalName,
        String canonicalDate,
        int size,
        boolean verified
) {
    public static ClusterView of(CitationCluster cluster, List<Citation> arena) {
        List<String> texts = cluster.memberIndices().stream()
                .map(i -> arena.get(i).normalized())
                .toList();
        return new ClusterView(cluster.id(), texts, cluster.memberIndices(),
                cluster.canonicalName(), cluster.canonicalDate(), cluster.size(), cluster.verified());
    }
}
