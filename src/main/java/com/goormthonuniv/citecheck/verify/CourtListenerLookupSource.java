package com.goormthonuniv.citecheck.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.extract.Reporter;
import com.goormthonuniv.citecheck.extract.ReporterCatalog;
import com.goormthonuniv.citecheck.service.SimilarityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.*;

/**
 * Tier 1: CourtListener citation-lookup API.
 *
 * <p>{@code POST /api/rest/v4/citation-lookup/} 에 {@code text=<인용>} 을 보내면 인용마다
 * status(200/300/404...)와 후보 판결 클러스터 목록이 돌아온다. 클러스터가 정확히 하나이고,
 * 사건명과 URL이 있고, 그 클러스터의 인용 목록에 조회한 인용이 들어 있을 때만 MATCH.</p>
 */
@Slf4j
@Component
public class CourtListenerLookupSource implements VerificationSource {

    static final String NAME = "courtlistener_lookup";
    static final double WEIGHT = 0.95;
    private static final int BATCH_SIZE = 100;

    private final RestClient rest;
    private final HttpCallGuard guard;
    private final ReporterCatalog catalog;
    private final SimilarityService similarity;
    private final String endpoint;
    private final String baseUrl;
    private final String apiKey;

    // ===== 캐시 (정규 인용 키 → 조회 결과) =====
    private final Cache<String, LookupEntry> lookupCache = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(6))
            .maximumSize(20_000)
            .build();

    public CourtListenerLookupSource(RestClient rest,
                                     HttpCallGuard guard,
                                     ReporterCatalog catalog,
                                     SimilarityService similarity,
                                     @Value("${citecheck.adapters.courtlistener.endpoint:https://www.courtlistener.com/api/rest/v4/citation-lookup/}") String endpoint,
                                     @Value("${citecheck.adapters.courtlistener.base-url:https://www.courtlistener.com}") String baseUrl,
                                     @Value("${citecheck.adapters.courtlistener.api-key:}") String apiKey) {
        this.rest = rest;
        this.guard = guard;
        this.catalog = catalog;
        this.similarity = similarity;
        this.endpoint = endpoint;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    @Override public String name() { return NAME; }

    @Override public int tier() { return 1; }

    /** 문서 내 인용을 한 번에 조회해 캐시를 채운다. 실패하면 개별 조회로 넘어간다. */
    @Override
    public void prepare(List<Citation> citations) {
        if (!enabled() || citations.isEmpty()) return;
        List<String> pending = citations.stream()
                .map(Citation::normalized)
                .distinct()
                .filter(n -> lookupCache.getIfPresent(ReporterCatalog.key(n)) == null)
                .toList();
        for (int i = 0; i < pending.size(); i += BATCH_SIZE) {
            List<String> batch = pending.subList(i, Math.min(pending.size(), i + BATCH_SIZE));
            try {
                Map<String, LookupEntry> found = lookup(String.join("; ", batch));
                found.forEach(lookupCache::put);
                log.debug("courtlistener batch lookup size={} entries={}", batch.size(), found.size());
            } catch (RuntimeException e) {
                log.warn("courtlistener batch lookup failed (size={}), falling back to single lookups: {}",
                        batch.size(), e.toString());
            }
        }
    }

    @Override
    public VerificationAttempt attempt(Citation citation) {
        if (!enabled()) {
            return VerificationAttempt.notApplicable(NAME, tier(), "api key not configured");
        }
        String key = ReporterCatalog.key(citation.normalized());
        LookupEntry entry = lookupCache.getIfPresent(key);
        if (entry == null) {
            try {
                Map<String, LookupEntry> found = lookup(citation.normalized());
                found.forEach(lookupCache::put);
                entry = found.get(key);
                if (entry == null && found.size() == 1) {
                    entry = found.values().iterator().next();
                }
            } catch (RuntimeException e) {
                log.warn("courtlistener lookup failed citation=\"{}\": {}", citation.normalized(), e.toString());
                return VerificationAttempt.error(NAME, tier(), e.toString());
            }
        }
        if (entry == null) {
            return VerificationAttempt.noMatch(NAME, tier(), "citation not recognized");
        }
        return judge(citation, key, entry);
    }

    private VerificationAttempt judge(Citation citation, String key, LookupEntry entry) {
        if (entry.status() != 200) {
            return VerificationAttempt.noMatch(NAME, tier(), "status " + entry.status()
                    + (entry.errorMessage().isBlank() ? "" : " " + entry.errorMessage()));
        }
        if (entry.clusters().size() != 1) {
            return VerificationAttempt.noMatch(NAME, tier(), "ambiguous: " + entry.clusters().size() + " clusters");
        }
        ClusterHit hit = entry.clusters().get(0);
        if (hit.caseName().isBlank() || hit.absoluteUrl().isBlank()) {
            return VerificationAttempt.noMatch(NAME, tier(), "cluster without case name or url");
        }
        if (!hit.citationKeys().isEmpty() && !hit.citationKeys().contains(key)) {
            return VerificationAttempt.noMatch(NAME, tier(), "cluster does not carry " + citation.normalized());
        }

        double signal = 1.0;
        String extracted = citation.getExtractedCaseName();
        if (extracted != null && !extracted.isBlank()
                && similarity.caseNameSimilarity(extracted, hit.caseName()) < 0.5) {
            signal = 0.8;
        }
        OptionalInt extractedYear = citation.extractedYear();
        if (extractedYear.isPresent() && hit.dateFiled().length() >= 4) {
            try {
                int filed = Integer.parseInt(hit.dateFiled().substring(0, 4));
                if (Math.abs(filed - extractedYear.getAsInt()) > 1) signal -= 0.1;
            } catch (NumberFormatException ignored) {
                // date_filed 형식이 다르면 연도 신호 없이 판단
            }
        }
        String url = hit.absoluteUrl().startsWith("http") ? hit.absoluteUrl() : baseUrl + hit.absoluteUrl();
        return VerificationAttempt.match(NAME, tier(), WEIGHT, signal,
                hit.caseName(), emptyToNull(hit.dateFiled()), url, "single cluster match");
    }

    // ===================== HTTP =====================

    private boolean enabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    private Map<String, LookupEntry> lookup(String text) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("text", text);

        JsonNode body = guard.call(HttpCallGuard.COURTLISTENER, () -> rest.post()
                .uri(endpoint)
                .header("Authorization", "Token " + apiKey)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(JsonNode.class));

        Map<String, LookupEntry> out = new LinkedHashMap<>();
        if (body == null || !body.isArray()) return out;
        for (JsonNode item : body) {
            LookupEntry entry = parseEntry(item);
            List<String> keys = new ArrayList<>();
            for (JsonNode n : item.path("normalized_citations")) {
                keys.add(ReporterCatalog.key(n.asText()));
            }
            if (keys.isEmpty()) keys.add(ReporterCatalog.key(item.path("citation").asText("")));
            for (String k : keys) {
                out.putIfAbsent(k, entry);
            }
        }
        return out;
    }

    private LookupEntry parseEntry(JsonNode item) {
        List<ClusterHit> clusters = new ArrayList<>();
        for (JsonNode c : item.path("clusters")) {
            Set<String> keys = new HashSet<>();
            for (JsonNode ci : c.path("citations")) {
                String reporter = ci.path("reporter").asText("");
                String canonical = catalog.lookup(reporter).map(Reporter::canonical).orElse(reporter);
                keys.add(ReporterCatalog.key(ci.path("volume").asText("") + canonical + ci.path("page").asText("")));
            }
            String caseName = c.path("case_name").asText("");
            if (caseName.isBlank()) caseName = c.path("case_name_full").asText("");
            clusters.add(new ClusterHit(caseName.strip(), c.path("date_filed").asText("").strip(),
                    c.path("absolute_url").asText("").strip(), keys));
        }
        return new LookupEntry(item.path("status").asInt(0), item.path("error_message").asText(""), clusters);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    record LookupEntry(int status, String errorMessage, List<ClusterHit> clusters) {}

    record ClusterHit(String caseName, String dateFiled, String absoluteUrl, Set<String> citationKeys) {}
}
