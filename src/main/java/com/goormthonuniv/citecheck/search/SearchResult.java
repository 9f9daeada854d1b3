package com.goormthonuniv.citecheck.search;

public record SearchResult(
        String source,      // 어댑터명
        String title,
        String url,
        String snippet,
        int rank            // 어댑터 내 순위 (0부터)
) {}
