package com.lexinsight.llmjob.entity.llm;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Entity representing one unit of work submitted to the completion provider.
 * Each item targets exactly one lexical entry through one of its entity reference columns.
 */
@Entity
@Table(name = "llm_job_items", indexes = {
        @Index(name = "idx_llm_job_items_job_id", columnList = "job_id"),
        @Index(name = "idx_llm_job_items_status", columnList = "status"),
        @Index(name = "idx_llm_job_items_claim_token", columnList = "claim_token")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmJobItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "job_id", insertable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private LlmJob job;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private LlmJobItemStatus status = LlmJobItemStatus.QUEUED;

    @Column(name = "provider_task_id", length = 128)
    private String providerTaskId;

    /**
     * Token of the poller invocation that claimed this item for submission
     */
    @Column(name = "claim_token", length = 64)
    private String claimToken;

    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "request_payload", columnDefinition = "TEXT")
    private String requestPayload;

    @Column(name = "response_payload", columnDefinition = "TEXT")
    private String responsePayload;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "flagged")
    private Boolean flagged;

    @Column(name = "input_tokens")
    private Long inputTokens;

    @Column(name = "output_tokens")
    private Long outputTokens;

    @Column(name = "verb_id", updatable = false)
    private Long verbId;

    @Column(name = "noun_id", updatable = false)
    private Long nounId;

    @Column(name = "adjective_id", updatable = false)
    private Long adjectiveId;

    @Column(name = "adverb_id", updatable = false)
    private Long adverbId;

    @Column(name = "frame_id", updatable = false)
    private Long frameId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    void onCreate() {
        getEntityReference();
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * The lexical entry this item's result is written to
     */
    public EntityReference getEntityReference() {
        return EntityReference.of(verbId, nounId, adjectiveId, adverbId, frameId);
    }

    /**
     * Check if the item is in a terminal state
     */
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Create a queued item for a job targeting the given entry
     */
    public static LlmJobItem create(Long jobId, EntityReference target, String requestPayload) {
        LlmJobItem item = LlmJobItem.builder()
                .jobId(jobId)
                .status(LlmJobItemStatus.QUEUED)
                .requestPayload(requestPayload)
                .build();
        switch (target.kind()) {
            case VERB -> item.setVerbId(target.id());
            case NOUN -> item.setNounId(target.id());
            case ADJECTIVE -> item.setAdjectiveId(target.id());
            case ADVERB -> item.setAdverbId(target.id());
            case FRAME -> item.setFrameId(target.id());
        }
        return item;
    }
}
