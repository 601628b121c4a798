package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.RecoveryResult;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import com.lexinsight.llmjob.repository.LlmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repairs state left behind by crashed or runaway invocations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecoverySweeper {

    static final String JOB_RUNTIME_EXCEEDED = "Job exceeded maximum runtime";

    private final LlmJobRepository jobRepository;
    private final LlmJobItemRepository itemRepository;
    private final LlmJobProperties properties;

    public RecoveryResult sweep() {
        int itemsReset = resetStuckSubmissions();
        RecoveryResult stuckJobs = failStuckJobs();
        return new RecoveryResult(itemsReset, stuckJobs.jobsFailed(), stuckJobs.itemsFailed());
    }

    /**
     * Items stuck in SUBMITTING past the grace period go back to the queue
     */
    public int resetStuckSubmissions() {
        long graceMinutes = properties.getRecovery().getSubmittingGraceMinutes();
        int reset = itemRepository.resetStuckSubmissions(LocalDateTime.now().minusMinutes(graceMinutes));
        if (reset > 0) {
            log.warn("Reset {} item(s) stuck in submitting for more than {} minutes", reset, graceMinutes);
        }
        return reset;
    }

    /**
     * Jobs active for longer than the maximum runtime are failed along with their open items
     */
    public RecoveryResult failStuckJobs() {
        LocalDateTime now = LocalDateTime.now();
        long maxHours = properties.getRecovery().getMaxJobRuntimeHours();
        List<Long> stuckJobIds = jobRepository.findStuckJobIds(now.minusHours(maxHours));
        if (stuckJobIds.isEmpty()) {
            return new RecoveryResult(0, 0, 0);
        }

        // 항목을 먼저 닫아야 동시 집계가 작업을 running 으로 되돌리지 않음
        int itemsFailed = itemRepository.failNonTerminalItems(stuckJobIds, JOB_RUNTIME_EXCEEDED, now);
        int jobsFailed = jobRepository.failJobs(stuckJobIds, now);
        log.warn("Failed {} job(s) running longer than {} hours ({} open items): {}",
                jobsFailed, maxHours, itemsFailed, stuckJobIds);
        return new RecoveryResult(0, jobsFailed, itemsFailed);
    }
}
