package com.goormthonuniv.citecheck.verify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.search.SearchAdapter;
import com.goormthonuniv.citecheck.search.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

import java.time.Duration;
import java.util.*;

/**
 * Tier 3: 법률 자료 도메인으로 제한한 웹 검색.
 *
 * <p>검색 결과 중 allow-list 도메인만 후보로 남기고(신뢰 가중치 → 검색 순위 순), 후보 페이지를 열어
 * "그 인용의 판결 페이지"인지 본다. 인용하는 쪽 판결의 페이지(본문에만 인용이 있고 제목은 다른 사건)는 버린다.</p>
 *
 * <p>confidence = 도메인 가중치 × (제목이 사건을 가리킴 0.6 + 머리 영역에 인용 0.4)</p>
 */
@Slf4j
@Component
public class RestrictedWebSearchSource implements VerificationSource {

    static final String NAME_PREFIX = "web_search:";
    private static final int RESULTS_PER_QUERY = 8;

    private final List<SearchAdapter> adapters;
    private final LegalDomainPolicy domains;
    private final OpinionPageFetcher fetcher;
    private final OpinionPageValidator validator;
    private final int maxCandidates;
    private final double threshold;

    // ===== 캐시 =====
    private final Cache<String, List<SearchResult>> searchCache = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofMinutes(15))
            .maximumSize(2000)
            .build();

    public RestrictedWebSearchSource(List<SearchAdapter> adapters,
                                     LegalDomainPolicy domains,
                                     OpinionPageFetcher fetcher,
                                     OpinionPageValidator validator,
                                     CiteCheckProperties props) {
        this.adapters = adapters;
        this.domains = domains;
        this.fetcher = fetcher;
        this.validator = validator;
        this.maxCandidates = Math.max(1, props.getVerification().getWebSearchMaxCandidates());
        this.threshold = props.getVerification().getAcceptanceThreshold();
    }

    @Override public String name() { return "web_search"; }

    @Override public int tier() { return 3; }

    @Override
    public VerificationAttempt attempt(Citation citation) {
        if (adapters.stream().noneMatch(SearchAdapter::enabled)) {
            return VerificationAttempt.notApplicable(name(), tier(), "no search adapter configured");
        }

        CandidateSet collected = collectCandidates(citation);
        List<Candidate> candidates = collected.candidates();
        if (candidates.isEmpty()) {
            if (collected.failedSearches() > 0) {
                return VerificationAttempt.error(name(), tier(),
                        collected.failedSearches() + " search call(s) failed, no results on allowed domains");
            }
            return VerificationAttempt.noMatch(name(), tier(), "no results on allowed domains");
        }

        VerificationAttempt best = null;
        String lastReason = "no candidate validated";
        for (Candidate cand : candidates) {
            String source = NAME_PREFIX + domains.normalizeHost(cand.result().url());
            OpinionPage page;
            try {
                page = fetcher.fetch(cand.result().url());
            } catch (HttpClientErrorException e) {
                lastReason = e.getStatusCode().value() + " " + cand.result().url();
                continue;
            } catch (RuntimeException e) {
                log.warn("web search candidate fetch failed url={}: {}", cand.result().url(), e.toString());
                lastReason = e.toString();
                continue;
            }

            OpinionPageValidator.PageVerdict verdict = validator.validate(citation, page);
            if (verdict.citingRatherThanCited()) {
                log.debug("skip citing page url={} title=\"{}\"", page.url(), page.title());
                lastReason = "citing page " + page.url();
                continue;
            }
            if (verdict.caseNameFromTitle() == null || verdict.signal() <= 0.0) {
                lastReason = "page does not identify the case " + page.url();
                continue;
            }

            VerificationAttempt attempt = VerificationAttempt.match(source, tier(), cand.prior(), verdict.signal(),
                    verdict.caseNameFromTitle(), verdict.year(), page.url(),
                    "title=" + verdict.titleNamesCase() + " header=" + verdict.citationInHeader());
            if (attempt.acceptable(threshold)) return attempt;
            if (best == null || attempt.confidence() > best.confidence()) best = attempt;
        }
        return best != null ? best : VerificationAttempt.noMatch(name(), tier(), lastReason);
    }

    // ===================== 내부 유틸 =====================

    private CandidateSet collectCandidates(Citation citation) {
        Map<String, Candidate> byUrl = new LinkedHashMap<>();
        int failed = 0;
        for (String query : CitationQueryBuilder.buildQueries(citation, domains.searchDomains())) {
            List<SearchResult> hits = searchCache.getIfPresent(query);
            if (hits == null) {
                SearchBatch batch = runSearch(query, RESULTS_PER_QUERY);
                hits = batch.results();
                failed += batch.failures();
                // 어댑터가 하나라도 실패한 응답은 캐시하지 않는다
                if (batch.failures() == 0) searchCache.put(query, hits);
            }
            log.debug("web search query=\"{}\" hits={}", query, hits.size());
            for (SearchResult r : hits) {
                OptionalDouble prior = domains.trustPrior(r.url());
                if (prior.isEmpty()) continue;
                byUrl.putIfAbsent(r.url(), new Candidate(r, prior.getAsDouble()));
            }
            if (byUrl.size() >= maxCandidates) break;
        }
        List<Candidate> ranked = byUrl.values().stream()
                .sorted(Comparator.comparingDouble(Candidate::prior).reversed()
                        .thenComparingInt(c -> c.result().rank()))
                .limit(maxCandidates)
                .toList();
        return new CandidateSet(ranked, failed);
    }

    /** 다중 어댑터 검색 + URL dedupe */
    private SearchBatch runSearch(String query, int limit) {
        if (query == null || query.isBlank()) return new SearchBatch(List.of(), 0);
        List<SearchResult> all = new ArrayList<>();
        int failures = 0;
        for (SearchAdapter a : adapters) {
            if (!a.enabled()) continue;
            try {
                all.addAll(a.search(query, limit));
            } catch (RuntimeException e) {
                failures++;
                log.warn("adapter={} search failed query=\"{}\": {}", a.name(), query, e.toString());
            }
        }
        Map<String, SearchResult> map = new LinkedHashMap<>();
        for (SearchResult r : all) {
            if (r.url() == null || r.url().isBlank()) continue;
            map.putIfAbsent(r.url(), r);
        }
        return new SearchBatch(List.copyOf(map.values()), failures);
    }

    private record SearchBatch(List<SearchResult> results, int failures) {}

    private record CandidateSet(List<Candidate> candidates, int failedSearches) {}

    private record Candidate(SearchResult result, double prior) {}
}
