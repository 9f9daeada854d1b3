package com.goormthonuniv.citecheck.extract;

import com.goormthonuniv.citecheck.verify.AttemptOutcome;
import com.goormthonuniv.citecheck.verify.VerificationAttempt;
import com.goormthonuniv.citecheck.verify.VerificationStatus;
import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * 한 작업(job) 안에서만 쓰이는 인용 레코드. 추출 → 이름/연도 해석 → 검증 → 클러스터링이 모두 이 객체를 읽고 쓴다.
 *
 * <p>추출 필드는 생성 시 고정된다. 해석 결과와 검증 필드는 각각 한 번만 기록할 수 있고,
 * 두 번째 기록은 {@link IllegalStateException}.</p>
 */
@Getter
public class Citation {

    private final int index;
    private final String text;
    private final Reporter reporter;
    private final String volume;
    private final String page;
    private final List<String> pinpoints;
    private final int start;
    private final int end;
    private final MatchStrategy strategy;

    // ===== analyze / extract_names 단계 =====
    private Integer runId;
    private String extractedCaseName;
    private String extractedDate;
    private double nameConfidence;
    private double confidence;
    private boolean resolved;

    // ===== verify 단계 (write-once) =====
    private VerificationStatus verificationStatus = VerificationStatus.UNVERIFIED;
    private String source;
    private String canonicalName;
    private String canonicalDate;
    private String canonicalUrl;
    private double verificationConfidence;

    public Citation(int index, CitationMatch match) {
        this.index = index;
        this.text = match.text();
        this.reporter = match.reporter();
        this.volume = match.volume();
        this.page = match.page();
        this.pinpoints = List.copyOf(match.pinpoints());
        this.start = match.start();
        this.end = match.end();
        this.strategy = match.strategy();
        this.confidence = match.strategy().baseConfidence();
    }

    /** "150 Wash. 2d 674" 형태의 정규 인용 문자열 */
    public String normalized() {
        return volume + " " + reporter.canonical() + " " + page;
    }

    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }

    /** WL/LEXIS 인용은 권호 자리가 연도다 */
    public OptionalInt embeddedYear() {
        if (!reporter.isDatabase()) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(volume));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public OptionalInt extractedYear() {
        return parseYear(extractedDate);
    }

    public OptionalInt canonicalYear() {
        return parseYear(canonicalDate);
    }

    public void assignRun(int runId) {
        if (this.runId != null) {
            throw new IllegalStateException("run already assigned for citation " + index);
        }
        this.runId = runId;
    }

    public void applyResolution(String caseName, double nameConfidence, String date) {
        if (resolved) {
            throw new IllegalStateException("case name/date already resolved for citation " + index);
        }
        this.resolved = true;
        this.extractedCaseName = caseName;
        this.extractedDate = date;
        this.nameConfidence = caseName == null ? 0.0 : nameConfidence;
        double blended = strategy.baseConfidence() * (0.7 + 0.3 * this.nameConfidence);
        this.confidence = Math.round(blended * 1000.0) / 1000.0;
    }

    // ===== 검증 상태 전이 =====

    public synchronized void markPending() {
        if (verificationStatus != VerificationStatus.UNVERIFIED) {
            throw new IllegalStateException("citation " + index + " is " + verificationStatus + ", expected UNVERIFIED");
        }
        verificationStatus = VerificationStatus.PENDING;
    }

    /** 한 소스의 결과를 그대로 채택한다. 소스 간 필드 혼합 없음. */
    public synchronized void accept(VerificationAttempt attempt) {
        Objects.requireNonNull(attempt, "attempt");
        if (verificationStatus != VerificationStatus.PENDING) {
            throw new IllegalStateException("citation " + index + " is " + verificationStatus + ", expected PENDING");
        }
        if (attempt.outcome() != AttemptOutcome.MATCH) {
            throw new IllegalArgumentException("only MATCH attempts can be accepted: " + attempt.outcome());
        }
        this.source = attempt.source();
        this.canonicalName = attempt.canonicalName();
        this.canonicalDate = attempt.canonicalDate();
        this.canonicalUrl = attempt.canonicalUrl();
        this.verificationConfidence = attempt.confidence();
        this.verificationStatus = VerificationStatus.VERIFIED;
    }

    public synchronized void markExhausted() {
        if (verificationStatus != VerificationStatus.PENDING) {
            throw new IllegalStateException("citation " + index + " is " + verificationStatus + ", expected PENDING");
        }
        verificationStatus = VerificationStatus.UNVERIFIED_EXHAUSTED;
    }

    /** 검증이 중단되면 PENDING 을 되돌린다. 다른 상태는 그대로. */
    public synchronized void revertPending() {
        if (verificationStatus == VerificationStatus.PENDING) {
            verificationStatus = VerificationStatus.UNVERIFIED;
        }
    }

    public synchronized VerificationStatus getVerificationStatus() {
        return verificationStatus;
    }

    private static OptionalInt parseYear(String date) {
        if (date == null || date.length() < 4) return OptionalInt.empty();
        String head = date.substring(0, 4);
        for (int i = 0; i < 4; i++) {
            if (!Character.isDigit(head.charAt(i))) return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(head));
    }

    @Override
    public String toString() {
        return "Citation[" + index + ": " + text + " @" + start + "-" + end + "]";
    }
}
