package com.lexinsight.llmjob.dto.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider configuration stored on a job, passed through to the provider as-is.
 *
 * @param model       provider model identifier, e.g. gpt-5-nano
 * @param serviceTier flex | default | priority
 * @param reasoning   reasoning options object, e.g. {"effort": "low"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmJobConfig(
        String model,
        String serviceTier,
        JsonNode reasoning
) {
    public static LlmJobConfig empty() {
        return new LlmJobConfig(null, null, null);
    }
}
