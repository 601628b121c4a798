package com.lexinsight.llmjob.entity.llm;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entity representing an LLM moderation job.
 * A job owns many work items; its counters and status are recomputed from those items
 * by the poller and never trusted incrementally.
 */
@Entity
@Table(name = "llm_jobs", indexes = {
        @Index(name = "idx_llm_jobs_status", columnList = "status"),
        @Index(name = "idx_llm_jobs_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 256)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private LlmJobStatus status = LlmJobStatus.QUEUED;

    /**
     * Provider configuration as JSON: model, serviceTier, reasoning
     */
    @Column(columnDefinition = "TEXT")
    private String config;

    @Column(name = "total_items", nullable = false)
    @Builder.Default
    private Integer totalItems = 0;

    @Column(name = "submitted_items", nullable = false)
    @Builder.Default
    private Integer submittedItems = 0;

    @Column(name = "processed_items", nullable = false)
    @Builder.Default
    private Integer processedItems = 0;

    @Column(name = "succeeded_items", nullable = false)
    @Builder.Default
    private Integer succeededItems = 0;

    @Column(name = "failed_items", nullable = false)
    @Builder.Default
    private Integer failedItems = 0;

    @Column(name = "flagged_items", nullable = false)
    @Builder.Default
    private Integer flaggedItems = 0;

    @Column(name = "input_tokens", nullable = false)
    @Builder.Default
    private Long inputTokens = 0L;

    @Column(name = "output_tokens", nullable = false)
    @Builder.Default
    private Long outputTokens = 0L;

    /**
     * Estimated cost in USD millionths; null when the model has no known pricing
     */
    @Column(name = "cost_microunits")
    private Long costMicrounits;

    @Column(nullable = false)
    @Builder.Default
    private Boolean deleted = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * Check if the job is in a terminal state
     */
    public boolean isTerminal() {
        return status != null && status.isResolved();
    }
}
