package com.goormthonuniv.citecheck.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.goormthonuniv.citecheck.verify.HttpCallGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/** Google Programmable Search. 한 번에 최대 10건, 영어권 결과만. */
@Slf4j
@Component
public class GoogleCseAdapter implements SearchAdapter {

    private static final int MAX_PER_CALL = 10;

    private final RestClient rest;
    private final HttpCallGuard guard;
    private final String endpoint;
    private final String apiKey;
    private final String cx;

    public GoogleCseAdapter(RestClient rest,
                            HttpCallGuard guard,
                            @Value("${citecheck.adapters.google.endpoint:https://www.googleapis.com/customsearch/v1}") String endpoint,
                            @Value("${citecheck.adapters.google.api-key:}") String apiKey,
                            @Value("${citecheck.adapters.google.cx:}") String cx) {
        this.rest = rest;
        this.guard = guard;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.cx = cx;
    }

    @Override public String name() { return "google_cse"; }

    @Override
    public boolean enabled() {
        return apiKey != null && !apiKey.isBlank() && cx != null && !cx.isBlank();
    }

    @Override
    public List<SearchResult> search(String query, int limit) {
        if (!enabled()) {
            log.debug("google cse skipped: api-key or cx missing");
            return List.of();
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(endpoint)
                .queryParam("key", apiKey)
                .queryParam("cx", cx)
                .queryParam("q", query)
                .queryParam("num", Math.max(1, Math.min(limit, MAX_PER_CALL)))
                .queryParam("gl", "us")
                .queryParam("lr", "lang_en")
                .encode()
                .build()
                .toUri();
        JsonNode body = guard.call(HttpCallGuard.SEARCH, () -> rest.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class));
        List<SearchResult> out = parse(body);
        log.debug("google cse query=\"{}\" results={}", query, out.size());
        return out;
    }

    private List<SearchResult> parse(JsonNode body) {
        List<SearchResult> out = new ArrayList<>();
        if (body == null) return out;
        for (JsonNode item : body.path("items")) {
            String link = item.path("link").asText("").strip();
            if (link.isEmpty()) continue;
            out.add(new SearchResult(name(), item.path("title").asText(""), link,
                    item.path("snippet").asText(""), out.size()));
        }
        return out;
    }
}
