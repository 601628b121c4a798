package com.lexinsight.llmjob.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexinsight.llmjob.dto.llm.ParseOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseParser 단위 테스트
 */
class ResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseParser parser = new ResponseParser(objectMapper);

    private JsonNode json(String value) throws Exception {
        return objectMapper.readTree(value);
    }

    @Test
    @DisplayName("최상위 output_text 파싱")
    void parsesTopLevelOutputText() throws Exception {
        JsonNode response = json("""
                {"id":"resp_1","status":"completed",
                 "output_text":"{\\"flagged\\":true,\\"flagged_reason\\":\\"offensive\\",\\"confidence\\":0.9,\\"notes\\":\\"\\"}"}
                """);

        ParseOutcome outcome = parser.parse(response);

        assertThat(outcome.kind()).isEqualTo(ParseOutcome.Kind.PARSED);
        assertThat(outcome.response().flagged()).isTrue();
        assertThat(outcome.response().flaggedReason()).isEqualTo("offensive");
        assertThat(outcome.response().confidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("output_json_schema 콘텐츠는 객체여도 직렬화하여 파싱")
    void parsesJsonSchemaPartObject() throws Exception {
        JsonNode response = json("""
                {"status":"completed","output":[{"type":"message","content":[
                  {"type":"output_json_schema","json_schema":{"flagged":false,"flagged_reason":"","confidence":0.2,"notes":"ok"}}
                ]}]}
                """);

        ParseOutcome outcome = parser.parse(response);

        assertThat(outcome.kind()).isEqualTo(ParseOutcome.Kind.PARSED);
        assertThat(outcome.response().flagged()).isFalse();
        assertThat(outcome.response().notes()).isEqualTo("ok");
    }

    @Test
    @DisplayName("json_schema 파트가 output_text 파트보다 우선")
    void jsonSchemaPartTakesPrecedence() throws Exception {
        JsonNode response = json("""
                {"status":"completed","output":[{"content":[
                  {"type":"output_text","text":"not json"},
                  {"type":"output_json_schema","json_schema":"{\\"flagged\\":true}"}
                ]}]}
                """);

        ParseOutcome outcome = parser.parse(response);

        assertThat(outcome.kind()).isEqualTo(ParseOutcome.Kind.PARSED);
        assertThat(outcome.response().flagged()).isTrue();
    }

    @Test
    @DisplayName("output_text 콘텐츠 파트 파싱")
    void parsesOutputTextPart() throws Exception {
        JsonNode response = json("""
                {"status":"completed","output":[
                  {"type":"reasoning","summary":[]},
                  {"type":"message","content":[{"type":"output_text","text":"{\\"flagged\\":false}"}]}
                ]}
                """);

        ParseOutcome outcome = parser.parse(response);

        assertThat(outcome.kind()).isEqualTo(ParseOutcome.Kind.PARSED);
        assertThat(outcome.response().flagged()).isFalse();
        assertThat(outcome.response().flaggedReason()).isNull();
    }

    @Test
    @DisplayName("출력 콘텐츠가 없으면 NOT_READY")
    void missingOutput_isNotReady() throws Exception {
        ParseOutcome outcome = parser.parse(json("{\"status\":\"completed\",\"output\":[]}"));

        assertThat(outcome.kind()).isEqualTo(ParseOutcome.Kind.NOT_READY);
    }

    @Test
    @DisplayName("JSON이 아닌 출력은 INVALID")
    void nonJsonOutput_isInvalid() throws Exception {
        ParseOutcome outcome = parser.parse(json("{\"output_text\":\"I cannot answer that\"}"));

        assertThat(outcome.kind()).isEqualTo(ParseOutcome.Kind.INVALID);
        assertThat(outcome.outputText()).isEqualTo("I cannot answer that");
    }

    @Test
    @DisplayName("flagged가 boolean이 아니면 INVALID")
    void nonBooleanFlagged_isInvalid() throws Exception {
        ParseOutcome outcome = parser.parse(json("{\"output_text\":\"{\\\"flagged\\\":\\\"yes\\\"}\"}"));

        assertThat(outcome.kind()).isEqualTo(ParseOutcome.Kind.INVALID);
    }
}
