package com.goormthonuniv.citecheck.cluster;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.extract.ReporterCatalog;
import com.goormthonuniv.citecheck.service.SimilarityService;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 두 인용을 간선으로 이을지 판정한다. 모든 게이트가 AND로 묶인다.
 * (a) 근접 또는 같은 run, (b) 병렬 리포터 계열, (c) 사건명 유사도, (d) 연도 일치, (e) 검증된 사건명 일치
 */
@Component
public class ClusterGates {

    public enum Rejection {
        SAME_CITATION,
        TOO_FAR,
        REPORTERS_NOT_PARALLEL,
        NAMES_DIFFER,
        YEARS_DIFFER,
        CANONICAL_NAMES_DIFFER
    }

    private final ReporterCatalog catalog;
    private final SimilarityService similarity;
    private final int proximityChars;
    private final double nameThreshold;
    private final int yearTolerance;

    public ClusterGates(ReporterCatalog catalog, SimilarityService similarity, CiteCheckProperties props) {
        this.catalog = catalog;
        this.similarity = similarity;
        this.proximityChars = props.getClustering().getProximityChars();
        this.nameThreshold = props.getClustering().getNameSimilarityThreshold();
        this.yearTolerance = props.getClustering().getYearTolerance();
    }

    /** @return 비어 있으면 연결 가능 */
    public Optional<Rejection> check(Citation a, Citation b) {
        if (a.getIndex() == b.getIndex()) return Optional.of(Rejection.SAME_CITATION);

        // (a) 근접
        Citation first = a.getStart() <= b.getStart() ? a : b;
        Citation second = first == a ? b : a;
        int distance = Math.max(0, second.getStart() - first.getEnd());
        boolean sameRun = a.getRunId() != null && Objects.equals(a.getRunId(), b.getRunId());
        if (!sameRun && distance > proximityChars) return Optional.of(Rejection.TOO_FAR);

        // (b) 병렬 리포터
        if (!catalog.areParallel(a.getReporter(), b.getReporter())) {
            return Optional.of(Rejection.REPORTERS_NOT_PARALLEL);
        }

        // (c) 추출 사건명 (빈 이름은 위반 아님)
        if (!namesCompatible(a.getExtractedCaseName(), b.getExtractedCaseName())) {
            return Optional.of(Rejection.NAMES_DIFFER);
        }

        // (d) 연도
        if (!yearsCompatible(a, b)) return Optional.of(Rejection.YEARS_DIFFER);

        // (e) 둘 다 검증됐으면 canonical 사건명도 맞아야 한다
        if (a.isVerified() && b.isVerified()
                && !namesCompatible(a.getCanonicalName(), b.getCanonicalName())) {
            return Optional.of(Rejection.CANONICAL_NAMES_DIFFER);
        }
        return Optional.empty();
    }

    public boolean linked(Citation a, Citation b) {
        return check(a, b).isEmpty();
    }

    private boolean namesCompatible(String x, String y) {
        if (x == null || y == null || x.isBlank() || y.isBlank()) return true;
        return similarity.caseNameSimilarity(x, y) >= nameThreshold;
    }

    private boolean yearsCompatible(Citation a, Citation b) {
        OptionalInt ya = a.extractedYear();
        OptionalInt yb = b.extractedYear();
        boolean extractedOk = ya.isEmpty() || yb.isEmpty()
                || Math.abs(ya.getAsInt() - yb.getAsInt()) <= yearTolerance;

        OptionalInt ca = a.canonicalYear();
        OptionalInt cb = b.canonicalYear();
        if (a.isVerified() && b.isVerified() && ca.isPresent() && cb.isPresent()) {
            // 독립적으로 검증된 날짜가 서로 맞으면 추출 연도 차이를 덮는다
            return ca.getAsInt() == cb.getAsInt();
        }
        return extractedOk;
    }
}
