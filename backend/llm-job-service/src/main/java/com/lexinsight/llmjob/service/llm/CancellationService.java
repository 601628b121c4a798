package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.client.OpenAIResponsesClient;
import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.CancellationResult;
import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import com.lexinsight.llmjob.repository.LlmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Propagates user cancellation to the provider for jobs that still have items in flight.
 *
 * Items are failed whether or not the provider accepts the cancel request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CancellationService {

    static final String CANCELLED_BY_USER = "Cancelled by user";
    static final String CANCELLATION_FAILED_PREFIX = "Cancellation failed: ";

    private final OpenAIResponsesClient client;
    private final LlmJobRepository jobRepository;
    private final LlmJobItemRepository itemRepository;
    private final JobAggregationService aggregationService;
    private final BoundedFanOut fanOut;
    private final LlmJobProperties properties;

    public CancellationResult processCancellations() {
        List<LlmJob> jobs = jobRepository.findCancelledWithPendingItems();
        if (jobs.isEmpty()) {
            return CancellationResult.empty();
        }

        int jobsProcessed = 0;
        int itemsCancelled = 0;
        int errors = 0;
        for (LlmJob job : jobs) {
            try {
                itemsCancelled += cancelJob(job.getId());
                jobsProcessed++;
            } catch (Exception e) {
                errors++;
                log.error("Failed to process cancellation for job {}: {}", job.getId(), e.getMessage(), e);
            }
        }

        log.info("Cancellation processed: jobs={}, items={}, errors={}", jobsProcessed, itemsCancelled, errors);
        return new CancellationResult(jobsProcessed, itemsCancelled, errors);
    }

    int cancelJob(Long jobId) {
        // 제출 전 항목은 제공자 호출 없이 종료
        int cancelled = itemRepository.failUnsubmittedItems(jobId, CANCELLED_BY_USER, LocalDateTime.now());

        List<LlmJobItem> items = itemRepository.findCancellableByJobId(jobId);
        List<BoundedFanOut.Settled<Boolean>> settled = fanOut.run(
                items,
                properties.getCancellation().getConcurrency(),
                this::cancelItem);
        for (BoundedFanOut.Settled<Boolean> result : settled) {
            if (!result.isSuccess()) {
                log.error("Failed to record cancellation for an item of job {}: {}",
                        jobId, result.error().getMessage());
            } else if (Boolean.TRUE.equals(result.value())) {
                cancelled++;
            }
        }

        aggregationService.aggregate(jobId);
        log.info("Cancelled {} item(s) of job {}", cancelled, jobId);
        return cancelled;
    }

    private boolean cancelItem(LlmJobItem item) {
        String message = CANCELLED_BY_USER;
        try {
            client.cancelResponse(item.getProviderTaskId());
        } catch (RuntimeException e) {
            log.warn("Provider cancel failed for item {} ({}): {}", item.getId(), item.getProviderTaskId(), e.getMessage());
            message = CANCELLATION_FAILED_PREFIX + e.getMessage();
        }
        return itemRepository.markFailed(item.getId(), message, null, LocalDateTime.now()) > 0;
    }
}
