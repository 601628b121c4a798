package com.lexinsight.llmjob.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexinsight.llmjob.dto.llm.InvocationRequest;
import com.lexinsight.llmjob.dto.llm.InvocationResult;
import com.lexinsight.llmjob.entity.lexical.Verb;
import com.lexinsight.llmjob.entity.llm.EntityReference;
import com.lexinsight.llmjob.entity.llm.LexicalEntityKind;
import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import com.lexinsight.llmjob.entity.llm.LlmJobItemStatus;
import com.lexinsight.llmjob.entity.llm.LlmJobStatus;
import com.lexinsight.llmjob.exception.ProviderApiException;
import com.lexinsight.llmjob.support.LlmJobIntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * poller 전체 흐름 테스트 (H2, 제공자 목)
 */
class LlmJobEngineScenarioTest extends LlmJobIntegrationTestSupport {

    @Autowired
    private LlmJobPollerService pollerService;

    @Autowired
    private RecoverySweeper recoverySweeper;

    @Autowired
    private JobAggregationService aggregationService;

    private void providerAcceptsEverything() {
        AtomicInteger sequence = new AtomicInteger();
        when(client.createResponse(any(JsonNode.class)))
                .thenAnswer(inv -> providerTask("resp_" + sequence.incrementAndGet(), "queued"));
    }

    @Test
    @DisplayName("한 번의 실행으로 제출부터 결과 반영까지 완료")
    void happyPath() {
        // given
        LlmJob job = saveJob("profanity-sweep", LlmJobStatus.QUEUED);
        for (long id = 1; id <= 3; id++) {
            saveVerb(id);
            saveItem(job, id);
        }
        providerAcceptsEverything();
        when(client.retrieveResponse("resp_1")).thenReturn(completedTask("resp_1",
                "{\"flagged\":true,\"flagged_reason\":\"slur\",\"confidence\":0.93,\"notes\":\"\"}"));
        when(client.retrieveResponse("resp_2")).thenReturn(completedTask("resp_2",
                "{\"flagged\":false,\"flagged_reason\":\"\",\"confidence\":0.8,\"notes\":\"\"}"));
        when(client.retrieveResponse("resp_3")).thenReturn(completedTask("resp_3",
                "{\"flagged\":false,\"flagged_reason\":\"\",\"confidence\":0.7,\"notes\":\"\"}"));

        // when
        InvocationResult result = pollerService.invoke(InvocationRequest.scheduled());

        // then
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.body().stats().getItemsSubmitted()).isEqualTo(3);
        assertThat(result.body().pendingRemaining()).isZero();

        LlmJob reloaded = reload(job);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobStatus.COMPLETED);
        assertThat(reloaded.getTotalItems()).isEqualTo(3);
        assertThat(reloaded.getSubmittedItems()).isEqualTo(3);
        assertThat(reloaded.getProcessedItems()).isEqualTo(3);
        assertThat(reloaded.getSucceededItems()).isEqualTo(3);
        assertThat(reloaded.getFlaggedItems()).isEqualTo(1);
        assertThat(reloaded.getInputTokens()).isEqualTo(360L);
        assertThat(reloaded.getOutputTokens()).isEqualTo(90L);
        assertThat(reloaded.getCostMicrounits()).isNotNull();
        assertThat(reloaded.getStartedAt()).isNotNull();
        assertThat(reloaded.getCompletedAt()).isNotNull();

        // 한 항목만 flag 처리됨
        Verb flagged = findEntry(Verb.class, 1L);
        assertThat(flagged.getFlagged()).isTrue();
        assertThat(flagged.getFlaggedReason()).isEqualTo("profanity-sweep: slur");
        Verb clean = findEntry(Verb.class, 2L);
        assertThat(clean.getFlagged()).isFalse();
        assertThat(clean.getFlaggedReason()).isNull();

        verify(chainTrigger, never()).trigger(anyInt());
    }

    @Test
    @DisplayName("제출 중 멈춘 항목은 같은 실행에서 복구 후 다시 제출됨")
    void stuckSubmissionIsRecovered() {
        // given
        LlmJob job = saveJob("recovery", LlmJobStatus.RUNNING);
        LlmJobItem stuck = LlmJobItem.create(job.getId(),
                new EntityReference(LexicalEntityKind.VERB, 1L), PROMPT_PAYLOAD);
        stuck.setStatus(LlmJobItemStatus.SUBMITTING);
        stuck.setClaimToken("crashed-invocation");
        stuck.setStartedAt(LocalDateTime.now().minusMinutes(10));
        stuck = itemRepository.save(stuck);

        providerAcceptsEverything();
        when(client.retrieveResponse(anyString())).thenAnswer(inv -> providerTask(inv.getArgument(0), "in_progress"));

        // when
        InvocationResult result = pollerService.invoke(InvocationRequest.scheduled());

        // then
        assertThat(result.body().stats().getItemsReset()).isEqualTo(1);
        assertThat(result.body().stats().getItemsSubmitted()).isEqualTo(1);
        LlmJobItem reloaded = reload(stuck);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobItemStatus.PROCESSING);
        assertThat(reloaded.getProviderTaskId()).isEqualTo("resp_1");
        assertThat(reloaded.getClaimToken()).isNotEqualTo("crashed-invocation");
    }

    @Test
    @DisplayName("삭제된 작업의 오래된 제출 중 항목은 큐로 되돌리지 않음")
    void stuckSubmissionOfDeletedJobIsLeftAlone() {
        LlmJob job = saveJob("deleted", LlmJobStatus.RUNNING);
        LlmJobItem stuck = saveItem(job, 1L);
        stuck.setStatus(LlmJobItemStatus.SUBMITTING);
        stuck.setClaimToken("crashed-invocation");
        stuck.setStartedAt(LocalDateTime.now().minusMinutes(10));
        itemRepository.save(stuck);
        job = reload(job);
        job.setDeleted(true);
        jobRepository.save(job);

        int reset = recoverySweeper.resetStuckSubmissions();

        assertThat(reset).isZero();
        LlmJobItem reloaded = reload(stuck);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobItemStatus.SUBMITTING);
        assertThat(reloaded.getClaimToken()).isEqualTo("crashed-invocation");
    }

    @Test
    @DisplayName("최대 실행 시간을 넘긴 작업은 항목과 함께 실패하고 이후 집계로 다시 열리지 않음")
    void runawayJobStaysFailedAfterAggregation() {
        // given
        LlmJob job = jobRepository.save(LlmJob.builder()
                .label("runaway")
                .status(LlmJobStatus.RUNNING)
                .config("{\"model\":\"gpt-5-nano\",\"serviceTier\":\"flex\"}")
                .createdAt(LocalDateTime.now().minusHours(72))
                .build());
        LlmJobItem open = saveItem(job, 1L);

        // when
        recoverySweeper.failStuckJobs();
        aggregationService.aggregate(job.getId());

        // then
        LlmJob reloaded = reload(job);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobStatus.FAILED);
        assertThat(reloaded.getCompletedAt()).isNotNull();
        assertThat(reloaded.getFailedItems()).isEqualTo(1);
        assertThat(reload(open).getStatus()).isEqualTo(LlmJobItemStatus.FAILED);
        assertThat(reload(open).getLastError()).isEqualTo(RecoverySweeper.JOB_RUNTIME_EXCEEDED);
    }

    @Test
    @DisplayName("최근에 제출 중으로 바뀐 항목은 복구 대상이 아님")
    void recentSubmissionIsLeftAlone() {
        LlmJob job = saveJob("recent", LlmJobStatus.RUNNING);
        LlmJobItem inFlight = saveItem(job, 1L);
        inFlight.setStatus(LlmJobItemStatus.SUBMITTING);
        inFlight.setClaimToken("live-invocation");
        inFlight.setStartedAt(LocalDateTime.now().minusMinutes(1));
        itemRepository.save(inFlight);

        InvocationResult result = pollerService.invoke(InvocationRequest.scheduled());

        assertThat(result.body().stats().getItemsReset()).isZero();
        assertThat(reload(inFlight).getStatus()).isEqualTo(LlmJobItemStatus.SUBMITTING);
        verify(client, never()).createResponse(any(JsonNode.class));
    }

    @Test
    @DisplayName("처리량 상한을 넘는 대기 항목이 있으면 다음 실행을 트리거")
    void largeBacklogChains() {
        // given
        LlmJob job = saveJob("backlog", LlmJobStatus.QUEUED);
        saveItems(job, 1500);
        providerAcceptsEverything();
        when(client.retrieveResponse(anyString())).thenAnswer(inv -> providerTask(inv.getArgument(0), "in_progress"));

        // when
        InvocationResult result = pollerService.invoke(InvocationRequest.scheduled());

        // then
        assertThat(result.body().stats().getItemsSubmitted()).isEqualTo(1000);
        assertThat(itemRepository.countByJobIdAndStatus(job.getId(), LlmJobItemStatus.QUEUED)).isEqualTo(500);
        assertThat(itemRepository.countByJobIdAndStatus(job.getId(), LlmJobItemStatus.PROCESSING)).isEqualTo(1000);
        assertThat(result.body().pendingRemaining()).isEqualTo(1500L);
        assertThat(result.body().stats().isRetriggered()).isTrue();
        verify(chainTrigger).trigger(1);

        LlmJob reloaded = reload(job);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobStatus.RUNNING);
        assertThat(reloaded.getSubmittedItems()).isEqualTo(1000);
    }

    @Test
    @DisplayName("제출 실패는 재시도 불가 오류면 즉시 실패 처리")
    void nonRetryableSubmissionFailure() {
        LlmJob job = saveJob("bad-request", LlmJobStatus.QUEUED);
        LlmJobItem item = saveItem(job, 1L);
        when(client.createResponse(any(JsonNode.class)))
                .thenThrow(new ProviderApiException(400, "invalid_request_error",
                        "Unsupported parameter"));

        InvocationResult result = pollerService.invoke(InvocationRequest.scheduled());

        assertThat(result.body().stats().getItemsFailed()).isEqualTo(1);
        LlmJobItem reloaded = reload(item);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobItemStatus.FAILED);
        assertThat(reloaded.getLastError()).isEqualTo("Invalid request: Unsupported parameter");
        assertThat(reloaded.getAttemptCount()).isEqualTo(1);
        verify(client, times(1)).createResponse(any(JsonNode.class));
        assertThat(reload(job).getStatus()).isEqualTo(LlmJobStatus.FAILED);
    }

    @Test
    @DisplayName("종료 상태 항목은 이후 갱신에 영향을 받지 않음")
    void terminalItemsStayTerminal() {
        // given
        LlmJob job = saveJob("terminal", LlmJobStatus.RUNNING);
        LlmJobItem item = saveItem(job, 1L);
        item.setStatus(LlmJobItemStatus.SUCCEEDED);
        item.setProviderTaskId("resp_done");
        item.setFlagged(true);
        item.setCompletedAt(LocalDateTime.now());
        itemRepository.save(item);

        // when
        int failed = itemRepository.markFailed(item.getId(), "late failure", null, LocalDateTime.now());
        int processing = itemRepository.markStillProcessing(item.getId(), "{}");
        int pollError = itemRepository.recordPollError(item.getId(), "late poll error");
        int succeeded = itemRepository.markSucceeded(item.getId(), false, "{}", 1, 1, LocalDateTime.now());

        // then
        assertThat(List.of(failed, processing, pollError, succeeded)).containsOnly(0);
        LlmJobItem reloaded = reload(item);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobItemStatus.SUCCEEDED);
        assertThat(reloaded.getFlagged()).isTrue();
        assertThat(reloaded.getLastError()).isNull();
    }

    @Test
    @DisplayName("사용자 취소 후 다음 실행에서 제공자 취소와 항목 실패 처리")
    void cancellationIsPropagated() {
        // given
        LlmJob job = saveJob("cancel-me", LlmJobStatus.RUNNING);
        LlmJobItem submitted = saveItem(job, 1L);
        submitted.setStatus(LlmJobItemStatus.PROCESSING);
        submitted.setProviderTaskId("resp_live");
        itemRepository.save(submitted);
        LlmJobItem queued = saveItem(job, 2L);
        jobRepository.cancel(job.getId(), LocalDateTime.now());
        when(client.cancelResponse("resp_live")).thenReturn(providerTask("resp_live", "cancelled"));

        // when
        InvocationResult result = pollerService.invoke(InvocationRequest.scheduled());

        // then
        assertThat(result.body().stats().getJobsCancelled()).isEqualTo(1);
        assertThat(result.body().stats().getItemsCancelled()).isEqualTo(2);
        assertThat(reload(submitted).getLastError()).isEqualTo("Cancelled by user");
        assertThat(reload(queued).getStatus()).isEqualTo(LlmJobItemStatus.FAILED);
        LlmJob reloaded = reload(job);
        assertThat(reloaded.getStatus()).isEqualTo(LlmJobStatus.CANCELLED);
        assertThat(reloaded.getFailedItems()).isEqualTo(2);
        verify(client, never()).createResponse(any(JsonNode.class));
    }
}
