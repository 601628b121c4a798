package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.client.OpenAIResponsesClient;
import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.CancellationResult;
import com.lexinsight.llmjob.dto.llm.InvocationRequest;
import com.lexinsight.llmjob.dto.llm.InvocationResult;
import com.lexinsight.llmjob.dto.llm.JobPollResult;
import com.lexinsight.llmjob.dto.llm.PollStats;
import com.lexinsight.llmjob.dto.llm.RecoveryResult;
import com.lexinsight.llmjob.dto.llm.SubmissionResult;
import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import com.lexinsight.llmjob.repository.LlmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One poller invocation: recovery, cancellation, submission, polling, then a decision on
 * whether to chain another invocation.
 *
 * Invocations share no memory; everything they coordinate on lives in the database.
 * A failing phase is logged and counted, and the remaining phases still run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmJobPollerService {

    static final String CLIENT_NOT_CONFIGURED = "OpenAI client not configured";

    private final OpenAIResponsesClient client;
    private final RecoverySweeper recoverySweeper;
    private final CancellationService cancellationService;
    private final SubmissionService submissionService;
    private final PollingService pollingService;
    private final LlmJobRepository jobRepository;
    private final LlmJobItemRepository itemRepository;
    private final ChainTrigger chainTrigger;
    private final LlmJobProperties properties;

    public InvocationResult invoke(InvocationRequest request) {
        int chainDepth = request != null ? request.depth() : 0;
        PollStats stats = new PollStats();
        stats.setChainDepth(chainDepth);

        if (!client.isConfigured()) {
            log.error("OPENAI_API_KEY not configured, skipping invocation");
            return InvocationResult.error(CLIENT_NOT_CONFIGURED, stats);
        }

        try {
            log.info("Starting LLM job poller (chain depth: {})", chainDepth);

            runRecovery(stats);
            runCancellation(stats);
            runSubmission(stats);
            runPolling(stats);

            long pendingRemaining = itemRepository.countPending();
            log.info("Poller invocation complete: {}", stats);

            ChainDecision decision = ChainDecision.decide(pendingRemaining, chainDepth,
                    properties.getChain().getMaxDepth());
            if (decision.chain()) {
                log.info(decision.reason());
                try {
                    chainTrigger.trigger(decision.nextDepth());
                    stats.setRetriggered(true);
                } catch (Exception e) {
                    log.error("Failed to trigger next invocation: {}", e.getMessage(), e);
                }
            } else {
                log.info(decision.reason());
            }

            return InvocationResult.ok(stats, pendingRemaining);
        } catch (Exception e) {
            log.error("Fatal error in poller invocation: {}", e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : "Unknown error";
            return InvocationResult.error(message, stats);
        }
    }

    private void runRecovery(PollStats stats) {
        try {
            RecoveryResult recovery = recoverySweeper.sweep();
            stats.setItemsReset(recovery.itemsReset());
            stats.setJobsTimedOut(recovery.jobsFailed());
        } catch (Exception e) {
            log.error("Error during recovery phase: {}", e.getMessage(), e);
            stats.incrementErrors();
        }
    }

    private void runCancellation(PollStats stats) {
        try {
            CancellationResult cancellation = cancellationService.processCancellations();
            stats.setJobsCancelled(cancellation.jobsProcessed());
            stats.setItemsCancelled(cancellation.itemsCancelled());
            if (cancellation.errors() > 0) {
                log.warn("{} error(s) during cancellation", cancellation.errors());
            }
        } catch (Exception e) {
            log.error("Error during cancellation phase: {}", e.getMessage(), e);
            stats.incrementErrors();
        }
    }

    private void runSubmission(PollStats stats) {
        try {
            SubmissionResult submission = submissionService.submitPending(properties.getSubmission().getMaxItems());
            stats.setItemsSubmitted(submission.submitted());
            stats.setItemsFailed(submission.failed());
            stats.setSubmissionErrors(submission.errors().size());
            if (submission.failed() > 0) {
                log.warn("Failed to submit {} item(s)", submission.failed());
            }
        } catch (Exception e) {
            log.error("Error during submission phase: {}", e.getMessage(), e);
            stats.incrementErrors();
        }
    }

    private void runPolling(PollStats stats) {
        List<LlmJob> activeJobs;
        try {
            activeJobs = jobRepository.findActiveJobs();
        } catch (Exception e) {
            log.error("Error loading active jobs: {}", e.getMessage(), e);
            stats.incrementErrors();
            return;
        }
        log.info("Found {} active job(s) to poll", activeJobs.size());

        for (LlmJob job : activeJobs) {
            try {
                JobPollResult result = pollingService.pollJob(job);
                stats.setJobsPolled(stats.getJobsPolled() + 1);
                stats.setItemsPolled(stats.getItemsPolled() + result.itemsPolled());
                stats.setItemsUpdated(stats.getItemsUpdated() + result.itemsUpdated());
                stats.addErrors(result.errors());
                if (result.resolved()) {
                    stats.getJobsResolved().add(String.valueOf(job.getId()));
                }
            } catch (Exception e) {
                log.error("Failed to poll job {}: {}", job.getId(), e.getMessage(), e);
                stats.incrementErrors();
            }
        }
    }
}
