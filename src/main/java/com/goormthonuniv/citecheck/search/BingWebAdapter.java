package com.goormthonuniv.citecheck.search;

import com.goormthonuniv.citecheck.verify.HttpCallGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

@Slf4j
@Component
public class BingWebAdapter implements SearchAdapter {

    private final RestClient rest;
    private final HttpCallGuard guard;
    private final String endpoint;
    private final String apiKey;

    public BingWebAdapter(RestClient rest,
                          HttpCallGuard guard,
                          @Value("${citecheck.adapters.bing.endpoint:https://api.bing.microsoft.com/v7.0/search}") String endpoint,
                          @Value("${citecheck.adapters.bing.api-key:}") String apiKey) {
        this.rest = rest;
        this.guard = guard;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override public String name() { return "bing_web"; }

    @Override
    public boolean enabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<SearchResult> search(String query, int limit) {
        if (!enabled()) return List.of();
        URI uri = URI.create(endpoint + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&count=" + limit + "&mkt=en-US&responseFilter=Webpages");

        Map<String, Object> res = guard.call(HttpCallGuard.SEARCH, () -> rest.get().uri(uri)
                .header("Ocp-Apim-Subscription-Key", apiKey)
                .retrieve()
                .body(new ParameterizedTypeReference<Map<String, Object>>() {}));

        if (res == null) return List.of();

        Object pages = res.get("webPages");
        Object raw = (pages instanceof Map<?, ?> wp) ? wp.get("value") : null;
        List<?> value = (raw instanceof List<?> l) ? l : Collections.emptyList();

        List<SearchResult> out = new ArrayList<>();
        for (Object o : value) {
            if (!(o instanceof Map<?, ?> v)) continue;
            String name = Objects.toString(v.get("name"), "");
            String url  = Objects.toString(v.get("url"), "");
            String desc = Objects.toString(v.get("snippet"), "");
            if (url.isBlank()) continue;
            out.add(new SearchResult(name(), name, url, desc, out.size()));
        }
        log.debug("bing query=\"{}\" results={}", query, out.size());
        return out;
    }
}
