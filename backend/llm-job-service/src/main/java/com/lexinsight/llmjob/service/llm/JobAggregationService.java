package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.AggregationResult;
import com.lexinsight.llmjob.dto.llm.JobItemCounts;
import com.lexinsight.llmjob.dto.llm.LlmJobConfig;
import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.entity.llm.LlmJobStatus;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import com.lexinsight.llmjob.repository.LlmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Recomputes a job's counters and status from its items.
 *
 * Safe to run any number of times; the result depends only on item state.
 * Only queued or running jobs take the derived status; a resolved job keeps its status and completion time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobAggregationService {

    private final LlmJobRepository jobRepository;
    private final LlmJobItemRepository itemRepository;
    private final FlaggingRequestFactory requestFactory;
    private final LlmJobProperties properties;

    @Transactional
    public AggregationResult aggregate(Long jobId) {
        LlmJob job = jobRepository.findById(jobId).orElse(null);
        List<Object[]> rows = itemRepository.aggregateByJobId(jobId);
        JobItemCounts counts = rows.isEmpty()
                ? new JobItemCounts(0, 0, 0, 0, 0, 0, 0, 0)
                : JobItemCounts.fromRow(rows.get(0));

        jobRepository.updateCounters(jobId,
                Math.toIntExact(counts.total()),
                Math.toIntExact(counts.submitted()),
                Math.toIntExact(counts.processed()),
                Math.toIntExact(counts.succeeded()),
                Math.toIntExact(counts.failed()),
                Math.toIntExact(counts.flagged()),
                counts.inputTokens(),
                counts.outputTokens(),
                estimateCost(job, counts));

        // queued/running 작업에만 상태를 기록. 종료된 작업은 다시 열지 않음
        LlmJobStatus derived = deriveStatus(counts);
        LocalDateTime now = LocalDateTime.now();
        int updated = derived.isResolved()
                ? jobRepository.markResolved(jobId, derived, now)
                : jobRepository.markRunning(List.of(jobId), now);
        LlmJobStatus status = updated > 0 || job == null ? derived : job.getStatus();

        log.debug("Aggregated job {}: {} -> {}", jobId, counts, status);
        return new AggregationResult(jobId, counts, status);
    }

    /**
     * running while items are outstanding; failed only if every item failed; otherwise completed.
     * An empty job counts as completed.
     */
    public static LlmJobStatus deriveStatus(JobItemCounts counts) {
        if (counts.processed() < counts.total()) {
            return LlmJobStatus.RUNNING;
        }
        if (counts.succeeded() == counts.total()) {
            return LlmJobStatus.COMPLETED;
        }
        if (counts.failed() == counts.total()) {
            return LlmJobStatus.FAILED;
        }
        // succeeded/skipped/failed 혼합은 completed로 취급
        return LlmJobStatus.COMPLETED;
    }

    private Long estimateCost(LlmJob job, JobItemCounts counts) {
        if (job == null) {
            return null;
        }
        LlmJobConfig config = requestFactory.parseConfig(job.getConfig());
        String model = config.model() != null && !config.model().isBlank()
                ? config.model()
                : properties.getSubmission().getDefaultModel();
        return TokenCostEstimator.estimateMicrounits(model, config.serviceTier(),
                counts.inputTokens(), counts.outputTokens());
    }
}
