package com.lexinsight.llmjob.dto.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured output the model is instructed to return for every lexical entry.
 */
public record FlaggingResponse(
        boolean flagged,
        @JsonProperty("flagged_reason") String flaggedReason,
        Double confidence,
        String notes
) {
}
