package com.lexinsight.llmjob.entity.llm;

import java.util.List;

/**
 * Status of an individual work item within an LLM job.
 */
public enum LlmJobItemStatus {
    /**
     * Waiting to be claimed for submission
     */
    QUEUED,

    /**
     * Claimed by one poller invocation; the provider call is in flight
     */
    SUBMITTING,

    /**
     * Accepted by the provider, waiting for the background response
     */
    PROCESSING,

    /**
     * Result applied to the target lexical entry
     */
    SUCCEEDED,

    /**
     * Failed at submission, at the provider, by timeout or by cancellation
     */
    FAILED,

    /**
     * Skipped by the job creator
     */
    SKIPPED;

    public static final List<LlmJobItemStatus> TERMINAL = List.of(SUCCEEDED, FAILED, SKIPPED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
