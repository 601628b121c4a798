package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.dto.llm.LlmJobDto;
import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.exception.LlmJobNotFoundException;
import com.lexinsight.llmjob.repository.LlmJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * User-facing job commands.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmJobCommandService {

    private final LlmJobRepository jobRepository;

    /**
     * Mark a job cancelled. Items still at the provider are cancelled by the next poller invocation.
     * A job that already finished is returned unchanged.
     */
    @Transactional
    public LlmJobDto requestCancellation(Long jobId) {
        LlmJob job = jobRepository.findByIdAndDeletedFalse(jobId)
                .orElseThrow(() -> new LlmJobNotFoundException(jobId));

        if (job.isTerminal()) {
            log.info("Job {} already {}, cancellation ignored", jobId, job.getStatus());
            return toDto(job);
        }

        int updated = jobRepository.cancel(jobId, LocalDateTime.now());
        if (updated == 0) {
            log.info("Job {} finished before it could be cancelled", jobId);
        } else {
            log.info("Cancellation requested for job {}", jobId);
        }

        LlmJob reloaded = jobRepository.findByIdAndDeletedFalse(jobId)
                .orElseThrow(() -> new LlmJobNotFoundException(jobId));
        return toDto(reloaded);
    }

    @Transactional(readOnly = true)
    public LlmJobDto getJob(Long jobId) {
        return jobRepository.findByIdAndDeletedFalse(jobId)
                .map(this::toDto)
                .orElseThrow(() -> new LlmJobNotFoundException(jobId));
    }

    private LlmJobDto toDto(LlmJob job) {
        return LlmJobDto.builder()
                .jobId(job.getId())
                .label(job.getLabel())
                .status(job.getStatus().name().toLowerCase())
                .totalItems(job.getTotalItems())
                .submittedItems(job.getSubmittedItems())
                .processedItems(job.getProcessedItems())
                .succeededItems(job.getSucceededItems())
                .failedItems(job.getFailedItems())
                .flaggedItems(job.getFlaggedItems())
                .inputTokens(job.getInputTokens())
                .outputTokens(job.getOutputTokens())
                .costMicrounits(job.getCostMicrounits())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
