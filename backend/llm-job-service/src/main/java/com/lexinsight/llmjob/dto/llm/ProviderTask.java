package com.lexinsight.llmjob.dto.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A provider response object (create / retrieve / cancel) reduced to the fields the poller reads.
 * The raw JSON is kept for auditing and for output extraction.
 */
public record ProviderTask(
        String id,
        ProviderTaskStatus status,
        String errorMessage,
        long inputTokens,
        long outputTokens,
        JsonNode raw
) {
    public static ProviderTask from(JsonNode raw) {
        JsonNode error = raw.path("error");
        String errorMessage = error.hasNonNull("message") ? error.get("message").asText() : null;
        JsonNode usage = raw.path("usage");
        return new ProviderTask(
                raw.path("id").asText(null),
                ProviderTaskStatus.fromValue(raw.path("status").asText(null)),
                errorMessage,
                usage.path("input_tokens").asLong(0),
                usage.path("output_tokens").asLong(0),
                raw
        );
    }

    public String rawJson() {
        return raw != null ? raw.toString() : null;
    }
}
