package com.lexinsight.llmjob.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lexinsight.llmjob.config.LlmJobProperties;
import com.lexinsight.llmjob.dto.llm.LlmJobConfig;
import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the background create-response request for a work item.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FlaggingRequestFactory {

    public static final String SCHEMA_NAME = "lexical_flagging_response";

    private final ObjectMapper objectMapper;
    private final LlmJobProperties properties;

    public JsonNode build(LlmJobItem item) {
        LlmJob job = item.getJob();
        LlmJobConfig config = parseConfig(job != null ? job.getConfig() : null);

        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", config.model() != null && !config.model().isBlank()
                ? config.model()
                : properties.getSubmission().getDefaultModel());
        request.put("input", renderedPrompt(item));
        request.put("background", true);
        request.put("store", true);

        ObjectNode metadata = request.putObject("metadata");
        metadata.put("job_id", String.valueOf(item.getJobId()));
        metadata.put("job_item_id", String.valueOf(item.getId()));

        String serviceTier = normalizeServiceTier(config.serviceTier());
        if (serviceTier != null) {
            request.put("service_tier", serviceTier);
        }
        if (config.reasoning() != null && !config.reasoning().isNull()) {
            request.set("reasoning", config.reasoning());
        }

        ObjectNode format = request.putObject("text").putObject("format");
        format.put("type", "json_schema");
        format.put("name", SCHEMA_NAME);
        format.put("strict", true);
        format.set("schema", flaggingSchema());
        return request;
    }

    /**
     * priority is not accepted for background requests and is downgraded to auto
     */
    public static String normalizeServiceTier(String tier) {
        if (tier == null || tier.isBlank()) {
            return null;
        }
        if ("priority".equals(tier)) {
            return "auto";
        }
        return tier;
    }

    public LlmJobConfig parseConfig(String configJson) {
        if (configJson == null || configJson.isBlank()) {
            return LlmJobConfig.empty();
        }
        try {
            return objectMapper.readValue(configJson, LlmJobConfig.class);
        } catch (JsonProcessingException e) {
            log.warn("Invalid job config, using defaults: {}", e.getOriginalMessage());
            return LlmJobConfig.empty();
        }
    }

    private String renderedPrompt(LlmJobItem item) {
        String payload = item.getRequestPayload();
        if (payload == null || payload.isBlank()) {
            return "";
        }
        try {
            JsonNode prompt = objectMapper.readTree(payload).path("renderedPrompt");
            return prompt.isMissingNode() || prompt.isNull() ? "" : prompt.asText();
        } catch (JsonProcessingException e) {
            log.warn("Invalid request payload on item {}: {}", item.getId(), e.getOriginalMessage());
            return "";
        }
    }

    private ObjectNode flaggingSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        schema.put("additionalProperties", false);
        ArrayNode required = schema.putArray("required");
        required.add("flagged").add("flagged_reason").add("confidence").add("notes");

        ObjectNode props = schema.putObject("properties");
        props.putObject("flagged")
                .put("type", "boolean")
                .put("description", "Whether the entry should be marked as flagged.");
        props.putObject("flagged_reason")
                .put("type", "string")
                .put("description", "Short explanation for why the entry should be flagged. Leave empty string if not flagged.");
        props.putObject("confidence")
                .put("type", "number")
                .put("minimum", 0)
                .put("maximum", 1)
                .put("description", "Confidence score for the recommendation (0-1).");
        props.putObject("notes")
                .put("type", "string")
                .put("description", "Optional analyst notes or remediation ideas. Use empty string if none.");
        return schema;
    }
}
