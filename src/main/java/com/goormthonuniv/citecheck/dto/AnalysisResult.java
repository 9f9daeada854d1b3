package com.goormthonuniv.citecheck.dto;

import java.util.List;

public record AnalysisResult(
        List<CitationView> citations,
        List<ClusterView> clusters
) {}
