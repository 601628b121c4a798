package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.dto.llm.ClaimedBatch;
import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import com.lexinsight.llmjob.entity.llm.LlmJobStatus;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import com.lexinsight.llmjob.repository.LlmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reserves queued items for submission.
 *
 * Candidates are selected, then moved to SUBMITTING by a conditional update that stamps a fresh
 * claim token. Only rows carrying that token are returned, so concurrent claimers never share an item
 * even when their candidate lists overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimedQueueService {

    private final LlmJobItemRepository itemRepository;
    private final LlmJobRepository jobRepository;

    public ClaimedBatch claim(int limit) {
        if (limit <= 0) {
            return ClaimedBatch.empty();
        }
        List<Long> candidateIds = itemRepository.findClaimCandidateIds(limit);
        if (candidateIds.isEmpty()) {
            return ClaimedBatch.empty();
        }

        String token = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now();
        int claimed = itemRepository.claim(candidateIds, token, now);
        if (claimed == 0) {
            log.debug("All {} claim candidates were taken by another invocation", candidateIds.size());
            return ClaimedBatch.empty();
        }

        List<LlmJobItem> items = itemRepository.findClaimed(token);
        if (claimed < candidateIds.size()) {
            log.info("Claimed {} of {} candidate items (token={})", items.size(), candidateIds.size(), token);
        }

        Set<Long> startingJobIds = items.stream()
                .filter(item -> item.getJob() != null
                        && (item.getJob().getStatus() == LlmJobStatus.QUEUED || item.getJob().getStartedAt() == null))
                .map(LlmJobItem::getJobId)
                .collect(Collectors.toSet());
        if (!startingJobIds.isEmpty()) {
            int started = jobRepository.markRunning(startingJobIds, now);
            log.info("Started {} LLM job(s): {}", started, startingJobIds);
        }

        return new ClaimedBatch(token, items);
    }
}
