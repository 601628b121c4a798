package com.lexinsight.llmjob.dto.llm;

/**
 * Status of a background response at the provider.
 */
public enum ProviderTaskStatus {
    QUEUED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED,
    INCOMPLETE,
    UNKNOWN;

    public static ProviderTaskStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return ProviderTaskStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
