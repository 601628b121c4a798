package com.lexinsight.llmjob.scheduler;

import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.InvocationRequest;
import com.lexinsight.llmjob.dto.llm.InvocationResult;
import com.lexinsight.llmjob.service.llm.LlmJobPollerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * LLM 작업 poller 정기 실행 스케줄러.
 * 매 실행은 chain depth 0에서 시작하며, 남은 작업이 있으면 poller가 스스로 후속 호출을 예약합니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmJobPollScheduler {

    private final LlmJobPollerService pollerService;
    private final LlmJobProperties properties;

    @Scheduled(fixedDelayString = "${llm-jobs.scheduler.fixed-delay-millis:30000}",
               initialDelayString = "${llm-jobs.scheduler.initial-delay-millis:10000}")
    public void scheduledPoll() {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Scheduled LLM job polling is disabled");
            return;
        }

        try {
            InvocationResult result = pollerService.invoke(InvocationRequest.scheduled());
            if (!result.isSuccess()) {
                log.warn("Scheduled LLM job poll returned {}: {}", result.statusCode(), result.body().error());
            }
        } catch (Exception e) {
            log.error("Scheduled LLM job poll failed: {}", e.getMessage(), e);
        }
    }
}
