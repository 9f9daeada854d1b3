package com.goormthonuniv.citecheck.controller;

import com.goormthonuniv.citecheck.dto.*;
import com.goormthonuniv.citecheck.job.ExecutionMode;
import com.goormthonuniv.citecheck.job.JobCoordinator;
import com.goormthonuniv.citecheck.job.JobSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Citations")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CitationController {

    private final JobCoordinator coordinator;

    @Operation(summary = "인용 분석 요청", description = "문서 텍스트를 받아 인용 추출/검증/클러스터링을 수행합니다. 큰 문서는 비동기 작업으로 전환됩니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "동기 처리 완료"),
            @ApiResponse(responseCode = "202", description = "비동기 작업 접수"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping("/citations/analyze")
    public ResponseEntity<?> analyze(@Valid @RequestBody AnalyzeRequest req) {
        JobCoordinator.Submission submission = coordinator.submit(req);
        JobSnapshot snap = submission.job().snapshot();
        if (submission.mode() == ExecutionMode.ASYNC) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmissionResponse(
                    snap.id(), snap.status().wireName(), "/api/v1/progress/" + snap.id()));
        }
        return ResponseEntity.ok(toResult(snap));
    }

    @Operation(summary = "작업 진행률", description = "status, current_step, percent(감소하지 않음), message")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "작업 없음(만료 포함)")
    })
    @GetMapping("/progress/{jobId}")
    public ResponseEntity<ProgressResponse> progress(@PathVariable String jobId) {
        return ResponseEntity.ok(toProgress(coordinator.progress(jobId)));
    }

    @Operation(summary = "작업 결과")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "완료 또는 실패한 작업"),
            @ApiResponse(responseCode = "404", description = "작업 없음"),
            @ApiResponse(responseCode = "409", description = "아직 끝나지 않음")
    })
    @GetMapping("/results/{jobId}")
    public ResponseEntity<ResultResponse> result(@PathVariable String jobId) {
        return ResponseEntity.ok(toResult(coordinator.result(jobId)));
    }

    @Operation(summary = "작업 취소", description = "대기 중이면 즉시 실패 처리, 실행 중이면 다음 단계 경계에서 멈춥니다.")
    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<ProgressResponse> cancel(@PathVariable String jobId) {
        return ResponseEntity.ok(toProgress(coordinator.cancel(jobId)));
    }

    private static ProgressResponse toProgress(JobSnapshot s) {
        return new ProgressResponse(s.id(), s.status().wireName(), s.currentStep().wireName(), s.percent(), s.message());
    }

    private static ResultResponse toResult(JobSnapshot s) {
        return new ResultResponse(s.id(), s.status().wireName(), s.result(), s.error());
    }
}
