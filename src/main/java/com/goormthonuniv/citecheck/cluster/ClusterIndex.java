package com.goormthonuniv.citecheck.cluster;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** 인용 인덱스 → 클러스터 id. 인용이 클러스터를 직접 참조하지 않도록 두는 옆 테이블. */
public final class ClusterIndex {

    private final Map<Integer, String> byCitation = new HashMap<>();

    void put(int citationIndex, String clusterId) {
        String prev = byCitation.putIfAbsent(citationIndex, clusterId);
        if (prev != null && !prev.equals(clusterId)) {
            throw new IllegalStateException("citation " + citationIndex + " already in " + prev);
        }
    }

    public Optional<String> clusterOf(int citationIndex) {
        return Optional.ofNullable(byCitation.get(citationIndex));
    }

    public Map<Integer, String> asMap() {
        return Collections.unmodifiableMap(byCitation);
    }
}
