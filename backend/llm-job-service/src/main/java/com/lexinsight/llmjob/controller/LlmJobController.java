package com.lexinsight.llmjob.controller;

import com.lexinsight.llmjob.dto.llm.InvocationRequest;
import com.lexinsight.llmjob.dto.llm.InvocationResult;
import com.lexinsight.llmjob.dto.llm.LlmJobDto;
import com.lexinsight.llmjob.service.llm.LlmJobCommandService;
import com.lexinsight.llmjob.service.llm.LlmJobPollerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * LLM 작업 API.
 * poller 수동 호출과 작업 취소 요청을 제공합니다. 모든 처리는 blocking이므로 boundedElastic에서 실행합니다.
 */
@RestController
@RequestMapping("/api/v1/llm-jobs")
@RequiredArgsConstructor
@Slf4j
public class LlmJobController {

    private final LlmJobPollerService pollerService;
    private final LlmJobCommandService commandService;

    /**
     * poller 1회 실행. 응답 상태 코드는 실행 결과의 statusCode를 따릅니다.
     */
    @PostMapping("/poller/invocations")
    public Mono<ResponseEntity<InvocationResult.Body>> invokePoller(
            @Valid @RequestBody(required = false) InvocationRequest request) {
        InvocationRequest effective = request != null ? request : InvocationRequest.scheduled();
        log.info("Manual poller invocation requested: chainDepth={}", effective.depth());

        return Mono.fromCallable(() -> pollerService.invoke(effective))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.status(result.statusCode()).body(result.body()));
    }

    @GetMapping("/{jobId}")
    public Mono<LlmJobDto> getJob(@PathVariable Long jobId) {
        return Mono.fromCallable(() -> commandService.getJob(jobId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 작업 취소 요청. 제공자 측 취소는 다음 poller 실행에서 처리됩니다.
     */
    @PostMapping("/{jobId}/cancel")
    public Mono<LlmJobDto> cancelJob(@PathVariable Long jobId) {
        log.info("Cancellation requested for LLM job {}", jobId);
        return Mono.fromCallable(() -> commandService.requestCancellation(jobId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
