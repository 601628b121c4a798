package com.lexinsight.llmjob.entity.llm;

import java.util.List;

/**
 * Status of an LLM moderation job.
 * Derived from the statuses of the job's items, except for CANCELLED which is set by the user.
 */
public enum LlmJobStatus {
    /**
     * Job has been created but none of its items has been claimed for submission
     */
    QUEUED,

    /**
     * At least one item has been claimed and the job still has non-terminal items
     */
    RUNNING,

    /**
     * Every item reached a terminal status and not every item failed
     */
    COMPLETED,

    /**
     * Every item failed, or the job exceeded its maximum runtime
     */
    FAILED,

    /**
     * Cancelled by the user. Never overwritten by aggregation.
     */
    CANCELLED;

    public static final List<LlmJobStatus> ACTIVE = List.of(QUEUED, RUNNING);

    public boolean isResolved() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
