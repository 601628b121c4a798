package com.lexinsight.llmjob.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexinsight.llmjob.dto.llm.FlaggingResponse;
import com.lexinsight.llmjob.dto.llm.ParseOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts the structured flagging verdict from a completed provider response.
 *
 * Output text is looked up in this order: top-level output_text, an output_json_schema
 * content part, an output_text content part.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseParser {

    private final ObjectMapper objectMapper;

    public ParseOutcome parse(JsonNode response) {
        String outputText = extractOutputText(response);
        if (outputText == null) {
            return ParseOutcome.notReady();
        }

        try {
            JsonNode node = objectMapper.readTree(outputText);
            if (node == null || !node.isObject() || !node.path("flagged").isBoolean()) {
                return ParseOutcome.invalid(outputText);
            }
            FlaggingResponse parsed = objectMapper.treeToValue(node, FlaggingResponse.class);
            return ParseOutcome.parsed(outputText, parsed);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse model output as JSON: {}", e.getOriginalMessage());
            return ParseOutcome.invalid(outputText);
        }
    }

    String extractOutputText(JsonNode response) {
        if (response == null) {
            return null;
        }
        String topLevel = textOrNull(response.get("output_text"));
        if (topLevel != null) {
            return topLevel;
        }

        JsonNode schemaPart = null;
        JsonNode textPart = null;
        for (JsonNode output : response.path("output")) {
            for (JsonNode part : output.path("content")) {
                String type = part.path("type").asText("");
                if (schemaPart == null && "output_json_schema".equals(type)) {
                    schemaPart = part;
                } else if (textPart == null && "output_text".equals(type) && part.path("text").isTextual()) {
                    textPart = part;
                }
            }
        }

        if (schemaPart != null) {
            JsonNode jsonSchema = schemaPart.get("json_schema");
            if (jsonSchema != null && !jsonSchema.isNull()) {
                String text = jsonSchema.isTextual() ? jsonSchema.asText() : jsonSchema.toString();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        if (textPart != null) {
            String text = textPart.get("text").asText();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isEmpty()) {
            return null;
        }
        return node.asText();
    }
}
