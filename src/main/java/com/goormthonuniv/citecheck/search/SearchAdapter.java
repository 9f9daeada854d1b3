package com.goormthonuniv.citecheck.search;

import java.util.List;

public interface SearchAdapter {
    String name(); // "google_cse", "bing_web"
    boolean enabled(); // API 키 등 설정이 갖춰졌는지
    /** 전송 실패는 예외로 던진다. 빈 목록은 "결과 없음"만 뜻한다. */
    List<SearchResult> search(String query, int limit);
}
