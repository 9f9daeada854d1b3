package com.goormthonuniv.citecheck.service;

import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.verify.VerificationAttempt;
import com.goormthonuniv.citecheck.verify.VerificationSource;
import com.goormthonuniv.citecheck.verify.VerificationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * 인용별 티어 에스컬레이션.
 *
 * <pre>
 * UNVERIFIED → PENDING → VERIFIED            (티어 하나가 임계값을 넘는 MATCH)
 *                      → UNVERIFIED_EXHAUSTED (모든 티어 소진)
 * </pre>
 *
 * - 티어는 tier() 오름차순, 한 인용 안에서는 순차
 * - 서로 다른 인용은 공유 풀(max-concurrent-calls)에서 병렬
 * - 채택은 시도 하나를 통째로. 소스 간 필드 혼합 없음
 * - 같은 정규 인용이 문서에 여러 번 나오면 한 번만 조회하고 결과를 모두에 적용
 */
@Slf4j
@Service
public class VerificationOrchestrator {

    private final List<VerificationSource> sources;
    private final ExecutorService executor;
    private final boolean enabled;
    private final double threshold;

    public VerificationOrchestrator(List<VerificationSource> sources,
                                    @Qualifier("verificationExecutor") ExecutorService executor,
                                    CiteCheckProperties props) {
        this.sources = sources.stream()
                .sorted(Comparator.comparingInt(VerificationSource::tier).thenComparing(VerificationSource::name))
                .toList();
        this.executor = executor;
        this.enabled = props.getVerification().isEnabled();
        this.threshold = props.getVerification().getAcceptanceThreshold();
    }

    public boolean isEnabled() {
        return enabled && !sources.isEmpty();
    }

    /** 메인 엔트리. cancelled 가 true 가 되면 아직 시작하지 않은 인용은 건너뛴다. */
    public VerificationSummary verify(List<Citation> citations, BooleanSupplier cancelled) {
        if (!isEnabled() || citations.isEmpty()) {
            return VerificationSummary.disabled(citations.size());
        }

        // 1) 정규 인용 기준 그룹핑 (문서 순서 유지)
        Map<String, List<Citation>> groups = new LinkedHashMap<>();
        for (Citation c : citations) {
            if (c.getVerificationStatus() != VerificationStatus.UNVERIFIED) continue;
            groups.computeIfAbsent(c.normalized(), k -> new ArrayList<>()).add(c);
        }
        List<Citation> representatives = groups.values().stream().map(g -> g.get(0)).toList();

        // 2) 일괄 조회가 되는 소스 준비
        for (VerificationSource s : sources) {
            try {
                s.prepare(representatives);
            } catch (RuntimeException e) {
                log.warn("source={} prepare failed: {}", s.name(), e.toString());
            }
        }

        // 3) 인용 그룹별 병렬 실행
        CommitGate gate = new CommitGate();
        List<Future<VerificationStatus>> futures = new ArrayList<>();
        for (List<Citation> group : groups.values()) {
            futures.add(executor.submit(() -> verifyGroup(group, cancelled, gate)));
        }

        int verified = 0;
        int exhausted = 0;
        int skipped = 0;
        Iterator<List<Citation>> groupIt = groups.values().iterator();
        for (Future<VerificationStatus> f : futures) {
            int size = groupIt.next().size();
            VerificationStatus st;
            try {
                st = gate.isOpen() ? f.get() : VerificationStatus.UNVERIFIED;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(gate, futures, groups.values());
                st = VerificationStatus.UNVERIFIED;
            } catch (ExecutionException e) {
                log.warn("verification task failed: {}", String.valueOf(e.getCause()));
                st = VerificationStatus.UNVERIFIED;
            }
            if (st == VerificationStatus.VERIFIED) verified += size;
            else if (st == VerificationStatus.UNVERIFIED_EXHAUSTED) exhausted += size;
            else skipped += size;
        }
        // 이미 상태가 정해져 있던 인용은 skipped
        int untouched = citations.size() - groups.values().stream().mapToInt(List::size).sum();

        VerificationSummary summary = new VerificationSummary(citations.size(), groups.size(),
                verified, exhausted, skipped + untouched);
        log.info("verification done citations={} distinct={} verified={} exhausted={} skipped={}",
                summary.requested(), summary.distinct(), summary.verified(), summary.exhausted(), summary.skipped());
        return summary;
    }

    /** 한 인용의 티어 체인. 첫 번째로 채택 가능한 시도를 고르고 나머지 티어는 시도하지 않는다. */
    public Optional<VerificationAttempt> escalate(Citation citation) {
        for (VerificationSource source : sources) {
            VerificationAttempt attempt;
            try {
                attempt = source.attempt(citation);
            } catch (RuntimeException e) {
                log.warn("source={} threw for citation=\"{}\": {}", source.name(), citation.normalized(), e.toString());
                attempt = VerificationAttempt.error(source.name(), source.tier(), e.toString());
            }
            log.debug("tier={} source={} citation=\"{}\" outcome={} confidence={} detail={}",
                    attempt.tier(), attempt.source(), citation.normalized(),
                    attempt.outcome(), attempt.confidence(), attempt.detail());
            if (attempt.acceptable(threshold)) {
                return Optional.of(attempt);
            }
        }
        return Optional.empty();
    }

    // ===================== 내부 =====================

    private VerificationStatus verifyGroup(List<Citation> group, BooleanSupplier cancelled, CommitGate gate) {
        if (cancelled.getAsBoolean()) return VerificationStatus.UNVERIFIED;
        if (!gate.apply(() -> group.forEach(Citation::markPending))) return VerificationStatus.UNVERIFIED;

        Citation head = group.get(0);
        Optional<VerificationAttempt> accepted;
        try {
            accepted = escalate(head);
        } catch (RuntimeException e) {
            log.warn("verification failed citation=\"{}\": {}", head.normalized(), e.toString());
            accepted = Optional.empty();
        }

        if (accepted.isPresent()) {
            VerificationAttempt a = accepted.get();
            if (!gate.apply(() -> group.forEach(c -> c.accept(a)))) return VerificationStatus.UNVERIFIED;
            log.info("verified citation=\"{}\" source={} confidence={} name=\"{}\"",
                    head.normalized(), a.source(), a.confidence(), a.canonicalName());
            return VerificationStatus.VERIFIED;
        }
        if (!gate.apply(() -> group.forEach(Citation::markExhausted))) return VerificationStatus.UNVERIFIED;
        return VerificationStatus.UNVERIFIED_EXHAUSTED;
    }

    /** 대기 중 인터럽트: 남은 작업을 취소하고, 이후 어떤 작업도 인용을 바꾸지 못하게 닫는다 */
    private static void abandon(CommitGate gate, List<Future<VerificationStatus>> futures,
                                Collection<List<Citation>> groups) {
        gate.close();
        futures.forEach(f -> f.cancel(true));
        groups.forEach(g -> g.forEach(Citation::revertPending));
        log.warn("verification interrupted, {} task(s) cancelled", futures.size());
    }

    /** 인용 상태 변경은 모두 이 게이트를 거친다. 닫힌 뒤에는 아무것도 적용되지 않는다. */
    private static final class CommitGate {
        private boolean open = true;

        synchronized boolean apply(Runnable change) {
            if (!open) return false;
            change.run();
            return true;
        }

        synchronized void close() {
            open = false;
        }

        synchronized boolean isOpen() {
            return open;
        }
    }
}
