package com.goormthonuniv.citecheck.cluster;

import java.util.List;

public record ClusterResult(List<CitationCluster> clusters, ClusterIndex index) {

    public static ClusterResult empty() {
        return new ClusterResult(List.of(), new ClusterIndex());
    }
}
