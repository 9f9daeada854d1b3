package com.goormthonuniv.citecheck;

import com.goormthonuniv.citecheck.cluster.CanonicalDataSelector;
import com.goormthonuniv.citecheck.cluster.ClusterBuilder;
import com.goormthonuniv.citecheck.cluster.ClusterGates;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.*;
import com.goormthonuniv.citecheck.pipeline.CitationPipeline;
import com.goormthonuniv.citecheck.resolve.CaseNameDateResolver;
import com.goormthonuniv.citecheck.service.SimilarityService;
import com.goormthonuniv.citecheck.service.VerificationOrchestrator;

import java.time.Duration;
import java.util.List;

/** 테스트 공용 조립 도우미 */
public final class Fixtures {

    public static final ReporterCatalog CATALOG = new ReporterCatalog();

    private Fixtures() {}

    /** 재시도 대기와 속도 제한을 사실상 없앤 설정 */
    public static CiteCheckProperties fastProps() {
        CiteCheckProperties props = new CiteCheckProperties();
        props.getVerification().getRetry().setInitialBackoff(Duration.ofMillis(1));
        props.getVerification().getRateLimits().setCourtlistener(1000);
        props.getVerification().getRateLimits().setSearch(1000);
        props.getVerification().getRateLimits().setPageFetch(1000);
        return props;
    }

    public static CitationExtractor extractor() {
        return new CitationExtractor(List.of(
                new PatternCitationMatcher(CATALOG),
                new GrammarCitationMatcher(CATALOG)));
    }

    public static ClusterBuilder clusterBuilder(CiteCheckProperties props) {
        SimilarityService similarity = new SimilarityService();
        return new ClusterBuilder(new ClusterGates(CATALOG, similarity, props), new CanonicalDataSelector(similarity));
    }

    /** 주어진 검증기로 파이프라인 전체를 조립 */
    public static CitationPipeline pipeline(CiteCheckProperties props, VerificationOrchestrator verifier) {
        return new CitationPipeline(extractor(), new CaseNameDateResolver(props), verifier, clusterBuilder(props));
    }

    /** 문서 없이 인용 하나를 직접 만든다 */
    public static Citation citation(int index, String reporter, String volume, String page, int start) {
        Reporter r = CATALOG.lookup(reporter).orElseThrow();
        String text = volume + " " + reporter + " " + page;
        return new Citation(index, new CitationMatch(start, start + text.length(), text, r,
                volume, page, List.of(), MatchStrategy.PATTERN));
    }

    public static Citation resolved(int index, String reporter, String volume, String page, int start,
                                    String caseName, String year) {
        Citation c = citation(index, reporter, volume, page, start);
        c.applyResolution(caseName, caseName == null ? 0.0 : 0.9, year);
        return c;
    }
}
