package com.goormthonuniv.citecheck.verify;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;

/**
 * 판결 페이지 GET + jsoup 파싱. 속도 제한/재시도는 {@link HttpCallGuard}.
 */
@Component
@RequiredArgsConstructor
public class OpinionPageFetcher {

    private final RestClient rest;
    private final HttpCallGuard guard;

    /** 4xx(429 제외)는 재시도 없이 그대로 던진다 */
    public OpinionPage fetch(String url) {
        String html = guard.call(HttpCallGuard.PAGE_FETCH, () -> rest.get()
                .uri(URI.create(url))
                .accept(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL)
                .retrieve()
                .body(String.class));
        return OpinionPage.parse(url, html);
    }
}
