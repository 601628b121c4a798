package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.client.OpenAIResponsesClient;
import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.AggregationResult;
import com.lexinsight.llmjob.dto.llm.JobPollResult;
import com.lexinsight.llmjob.dto.llm.ParseOutcome;
import com.lexinsight.llmjob.dto.llm.ProviderTask;
import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Polls the provider for a job's outstanding items and records what came back.
 *
 * A failed poll is recorded on the item and retried on the next invocation, never within the same pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PollingService {

    static final String CANCELLED_AT_PROVIDER = "Cancelled at provider";
    static final String PROVIDER_ERROR = "Provider error";
    static final String PARSE_FAILURE_PREFIX = "Unable to parse JSON response from model. Output: ";

    private final OpenAIResponsesClient client;
    private final ResponseParser responseParser;
    private final ModerationResultApplier resultApplier;
    private final JobAggregationService aggregationService;
    private final LlmJobItemRepository itemRepository;
    private final BoundedFanOut fanOut;
    private final LlmJobProperties properties;

    public JobPollResult pollJob(LlmJob job) {
        Long jobId = job.getId();
        List<LlmJobItem> items = itemRepository.findNonTerminalByJobId(jobId,
                properties.getPolling().getMaxItemsPerJob());

        if (items.isEmpty()) {
            AggregationResult aggregation = aggregationService.aggregate(jobId);
            log.info("Job {} has no outstanding items, resolved as {}", jobId, aggregation.status());
            return new JobPollResult(0, 0, 0, true);
        }

        List<LlmJobItem> pollable = items.stream()
                .filter(item -> item.getProviderTaskId() != null)
                .toList();

        List<BoundedFanOut.Settled<Boolean>> settled = fanOut.run(
                pollable,
                properties.getPolling().getConcurrency(),
                item -> pollItem(item, job.getLabel()));

        int updated = 0;
        int errors = 0;
        for (BoundedFanOut.Settled<Boolean> result : settled) {
            if (!result.isSuccess()) {
                errors++;
            } else if (Boolean.TRUE.equals(result.value())) {
                updated++;
            }
        }

        updated += failTimedOutItems(jobId);

        AggregationResult aggregation = aggregationService.aggregate(jobId);
        boolean resolved = aggregation.status().isResolved();
        log.debug("Polled job {}: polled={}, updated={}, errors={}, status={}",
                jobId, pollable.size(), updated, errors, aggregation.status());
        return new JobPollResult(pollable.size(), updated, errors, resolved);
    }

    /**
     * @return true when the item row was changed
     */
    boolean pollItem(LlmJobItem item, String jobLabel) {
        try {
            ProviderTask task = client.retrieveResponse(item.getProviderTaskId());
            return applyProviderState(item, jobLabel, task);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : "Unexpected refresh error";
            log.error("Error refreshing job item {}: {}", item.getId(), message, e);
            itemRepository.recordPollError(item.getId(), message);
            throw e;
        }
    }

    private boolean applyProviderState(LlmJobItem item, String jobLabel, ProviderTask task) {
        LocalDateTime now = LocalDateTime.now();
        switch (task.status()) {
            case QUEUED, IN_PROGRESS -> {
                return itemRepository.markStillProcessing(item.getId(), task.rawJson()) > 0;
            }
            case CANCELLED -> {
                return itemRepository.markFailed(item.getId(), CANCELLED_AT_PROVIDER, task.rawJson(), now) > 0;
            }
            case FAILED -> {
                String error = task.errorMessage() != null ? task.errorMessage() : PROVIDER_ERROR;
                return itemRepository.markFailed(item.getId(), error, task.rawJson(), now) > 0;
            }
            case COMPLETED -> {
                return applyCompleted(item, jobLabel, task, now);
            }
            default -> {
                log.debug("Item {} has provider status {}, leaving as is", item.getId(), task.status());
                return false;
            }
        }
    }

    private boolean applyCompleted(LlmJobItem item, String jobLabel, ProviderTask task, LocalDateTime now) {
        ParseOutcome outcome = responseParser.parse(task.raw());
        switch (outcome.kind()) {
            case NOT_READY -> {
                log.warn("Completed response {} missing output content; will retry on next poll", task.id());
                return itemRepository.markStillProcessing(item.getId(), task.rawJson()) > 0;
            }
            case INVALID -> {
                String error = PARSE_FAILURE_PREFIX + truncate(outcome.outputText(), 100);
                return itemRepository.markFailed(item.getId(), error, task.rawJson(), now) > 0;
            }
            default -> {
                ModerationResultApplier.Outcome applied =
                        resultApplier.apply(item, jobLabel, outcome.response(), task);
                return applied != ModerationResultApplier.Outcome.ALREADY_TERMINAL;
            }
        }
    }

    private int failTimedOutItems(Long jobId) {
        LocalDateTime now = LocalDateTime.now();
        long timeoutHours = properties.getPolling().getItemTimeoutHours();
        int timedOut = itemRepository.failTimedOutItems(jobId, now.minusHours(timeoutHours),
                "Item exceeded " + timeoutHours + " hour timeout", now);
        if (timedOut > 0) {
            log.warn("Marked {} item(s) of job {} as failed after {} hour timeout", timedOut, jobId, timeoutHours);
        }
        return timedOut;
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
