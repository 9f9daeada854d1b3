package com.goormthonuniv.citecheck.pipeline;

import com.goormthonuniv.citecheck.cluster.ClusterBuilder;
import com.goormthonuniv.citecheck.cluster.ClusterResult;
import com.goormthonuniv.citecheck.dto.AnalysisResult;
import com.goormthonuniv.citecheck.dto.CitationView;
import com.goormthonuniv.citecheck.dto.ClusterView;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.extract.CitationExtractor;
import com.goormthonuniv.citecheck.extract.CitationRuns;
import com.goormthonuniv.citecheck.resolve.CaseNameDateResolver;
import com.goormthonuniv.citecheck.service.VerificationOrchestrator;
import com.goormthonuniv.citecheck.service.VerificationSummary;
import com.goormthonuniv.citecheck.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 6단계 파이프라인. 단계 순서는 고정이고 각 단계 진입 시 진행률을 알린다.
 *
 * <pre>
 * init → extract → analyze → extract_names → verify → cluster
 * </pre>
 *
 * 검증이 클러스터링보다 먼저 돈다. 검증된 판결일이 있어야 연도 게이트를 풀 수 있다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CitationPipeline {

    private final CitationExtractor extractor;
    private final CaseNameDateResolver resolver;
    private final VerificationOrchestrator verifier;
    private final ClusterBuilder clusterBuilder;

    /** 메인 엔트리 */
    public AnalysisResult run(PipelineContext ctx) {
        // 1) 입력 정리 (길이 보존: 오프셋이 원문과 일치해야 한다)
        ctx.enter(PipelineStage.INIT, "normalizing input");
        ctx.setText(TextUtils.sanitize(ctx.getRawText()));

        // 2) 인용 추출
        ctx.enter(PipelineStage.EXTRACT, "extracting citations");
        List<Citation> citations = extractor.extract(ctx.getText());
        ctx.setCitations(citations);

        // 3) 인용 run 분석
        ctx.enter(PipelineStage.ANALYZE, "found " + citations.size() + " citations");
        ctx.setRunCount(CitationRuns.assign(ctx.getText(), citations));

        // 4) 사건명/연도
        ctx.enter(PipelineStage.EXTRACT_NAMES, "resolving case names across " + ctx.getRunCount() + " runs");
        resolver.resolve(ctx.getText(), citations);

        // 5) 검증
        if (ctx.isVerify() && verifier.isEnabled()) {
            ctx.enter(PipelineStage.VERIFY, "verifying " + citations.size() + " citations");
            ctx.setVerification(verifier.verify(citations, ctx::isCancelled));
        } else {
            ctx.enter(PipelineStage.VERIFY, "verification skipped");
            ctx.setVerification(VerificationSummary.disabled(citations.size()));
        }

        // 6) 클러스터링
        ctx.enter(PipelineStage.CLUSTER, "clustering parallel citations");
        ClusterResult clusters = clusterBuilder.build(citations);
        ctx.setClusters(clusters);

        log.info("pipeline done job={} citations={} clusters={} verified={}",
                ctx.getJobId(), citations.size(), clusters.clusters().size(), ctx.getVerification().verified());
        return assemble(citations, clusters);
    }

    static AnalysisResult assemble(List<Citation> citations, ClusterResult clusters) {
        List<CitationView> views = citations.stream()
                .map(c -> CitationView.of(c, clusters.index().clusterOf(c.getIndex()).orElse(null)))
                .toList();
        List<ClusterView> clusterViews = clusters.clusters().stream()
                .map(cl -> ClusterView.of(cl, citations))
                .toList();
        return new AnalysisResult(views, clusterViews);
    }
}
