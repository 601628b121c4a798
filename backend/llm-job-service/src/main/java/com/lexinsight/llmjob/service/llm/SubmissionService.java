package com.lexinsight.llmjob.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexinsight.llmjob.client.OpenAIResponsesClient;
import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.ClaimedBatch;
import com.lexinsight.llmjob.dto.llm.ItemError;
import com.lexinsight.llmjob.dto.llm.ProviderTask;
import com.lexinsight.llmjob.dto.llm.SubmissionResult;
import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import com.lexinsight.llmjob.repository.LlmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Submits claimed items to the provider.
 *
 * <p>Transient provider errors are retried with exponential backoff; everything else fails the
 * item immediately. Item updates only apply while the item is still held by this invocation's claim.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionService {

    private final ClaimedQueueService claimedQueue;
    private final OpenAIResponsesClient client;
    private final FlaggingRequestFactory requestFactory;
    private final LlmJobItemRepository itemRepository;
    private final LlmJobRepository jobRepository;
    private final JobAggregationService aggregationService;
    private final BoundedFanOut fanOut;
    private final LlmJobProperties properties;

    static final String SUBMISSION_INTERRUPTED = "Submission interrupted";

    record ItemOutcome(Long itemId, Long jobId, boolean submitted, String error) {
    }

    /**
     * Claim up to {@code maxItems} queued items and submit them
     */
    public SubmissionResult submitPending(int maxItems) {
        ClaimedBatch batch = claimedQueue.claim(maxItems);
        if (batch.isEmpty()) {
            log.debug("No queued items to submit");
            return SubmissionResult.empty();
        }
        log.info("Submitting {} claimed item(s)", batch.items().size());
        return submit(batch);
    }

    public SubmissionResult submit(ClaimedBatch batch) {
        List<LlmJobItem> items = batch.items();
        List<BoundedFanOut.Settled<ItemOutcome>> settled = fanOut.run(
                items,
                properties.getSubmission().getConcurrency(),
                item -> submitItem(item, batch.claimToken()));

        int submitted = 0;
        int failed = 0;
        List<ItemError> errors = new ArrayList<>();
        Map<Long, Integer> submittedPerJob = new LinkedHashMap<>();
        for (LlmJobItem item : items) {
            submittedPerJob.putIfAbsent(item.getJobId(), 0);
        }

        for (int i = 0; i < settled.size(); i++) {
            BoundedFanOut.Settled<ItemOutcome> result = settled.get(i);
            LlmJobItem item = items.get(i);
            if (!result.isSuccess()) {
                failed++;
                String message = result.error().getMessage() != null ? result.error().getMessage() : "Submission failed";
                errors.add(new ItemError(String.valueOf(item.getId()), message));
                log.error("Unexpected error submitting item {}: {}", item.getId(), message, result.error());
                continue;
            }
            ItemOutcome outcome = result.value();
            if (outcome.submitted()) {
                submitted++;
                submittedPerJob.merge(outcome.jobId(), 1, Integer::sum);
            } else {
                failed++;
                errors.add(new ItemError(String.valueOf(outcome.itemId()), outcome.error()));
            }
        }

        // 낙관적 증가 후 즉시 재집계로 보정
        for (Map.Entry<Long, Integer> entry : submittedPerJob.entrySet()) {
            Long jobId = entry.getKey();
            try {
                if (entry.getValue() > 0) {
                    jobRepository.incrementSubmitted(jobId, entry.getValue());
                }
                aggregationService.aggregate(jobId);
            } catch (Exception e) {
                log.error("Failed to update aggregates for job {} after submission: {}", jobId, e.getMessage(), e);
            }
        }

        log.info("Submission finished: submitted={}, failed={}", submitted, failed);
        return new SubmissionResult(submitted, failed, errors);
    }

    ItemOutcome submitItem(LlmJobItem item, String claimToken) {
        JsonNode request = requestFactory.build(item);
        AtomicInteger attempts = new AtomicInteger();

        ProviderTask task;
        try {
            task = Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return client.createResponse(request);
                    })
                    .retryWhen(retrySpec(item.getId()))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                // 항목은 SUBMITTING 으로 남겨 RecoverySweeper 가 다시 큐에 넣도록 함
                Thread.currentThread().interrupt();
                log.warn("Submission of item {} interrupted after {} attempt(s)", item.getId(), attempts.get());
                return new ItemOutcome(item.getId(), item.getJobId(), false, SUBMISSION_INTERRUPTED);
            }
            ProviderErrorClassifier.Classification classification = ProviderErrorClassifier.classify(cause);
            log.warn("Submission failed for item {} after {} attempt(s): {}",
                    item.getId(), attempts.get(), classification.message());
            return fail(item, claimToken, classification.message(), attempts.get());
        }

        if (task == null || task.id() == null || task.id().isBlank()) {
            return fail(item, claimToken, "Provider response missing id", attempts.get());
        }

        int updated = itemRepository.markSubmitted(item.getId(), claimToken, task.id(),
                attempts.get(), LocalDateTime.now());
        if (updated == 0) {
            log.warn("Item {} lost its claim before response {} was recorded", item.getId(), task.id());
            return new ItemOutcome(item.getId(), item.getJobId(), false,
                    "Claim lost before submission was recorded");
        }
        return new ItemOutcome(item.getId(), item.getJobId(), true, null);
    }

    /**
     * base * 2^n backoff without jitter, retrying only errors the classifier marks transient.
     * Delays run on boundedElastic since the provider client blocks.
     */
    RetryBackoffSpec retrySpec(Long itemId) {
        int maxRetries = properties.getSubmission().getMaxRetries();
        return Retry.backoff(maxRetries, Duration.ofMillis(properties.getSubmission().getBackoffBaseMillis()))
                .jitter(0)
                .scheduler(Schedulers.boundedElastic())
                .filter(e -> ProviderErrorClassifier.classify(e).retryable())
                .doBeforeRetry(signal -> log.info("Retrying item {} (retry {}/{}) - {}",
                        itemId, signal.totalRetries() + 1, maxRetries,
                        ProviderErrorClassifier.classify(signal.failure()).message()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private ItemOutcome fail(LlmJobItem item, String claimToken, String error, int attempts) {
        itemRepository.markSubmissionFailed(item.getId(), claimToken, error, attempts, LocalDateTime.now());
        return new ItemOutcome(item.getId(), item.getJobId(), false, error);
    }
}
