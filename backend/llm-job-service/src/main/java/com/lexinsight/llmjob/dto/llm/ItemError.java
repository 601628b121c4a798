package com.lexinsight.llmjob.dto.llm;

/**
 * Per-item error descriptor used in invocation reporting.
 */
public record ItemError(String itemId, String error) {
}
