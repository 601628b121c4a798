package com.lexinsight.llmjob.dto.llm;

import com.lexinsight.llmjob.entity.llm.LlmJobItem;

import java.util.List;

/**
 * Items reserved for submission by one claim, identified by the claim token written on each row.
 * Items are loaded together with their owning job.
 */
public record ClaimedBatch(String claimToken, List<LlmJobItem> items) {

    public static ClaimedBatch empty() {
        return new ClaimedBatch(null, List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
