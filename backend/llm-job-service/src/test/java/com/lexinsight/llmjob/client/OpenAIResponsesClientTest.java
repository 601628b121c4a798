package com.lexinsight.llmjob.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lexinsight.llmjob.dto.llm.ProviderTask;
import com.lexinsight.llmjob.dto.llm.ProviderTaskStatus;
import com.lexinsight.llmjob.exception.ProviderApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OpenAIResponsesClient 테스트
 * 실제 HTTP 대신 ExchangeFunction으로 응답을 고정합니다.
 */
class OpenAIResponsesClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private OpenAIResponsesClient client;

    @BeforeEach
    void setUp() {
        client = new OpenAIResponsesClient(objectMapper);
        ReflectionTestUtils.setField(client, "apiKey", "sk-test");
        ReflectionTestUtils.setField(client, "timeoutSeconds", 5);
    }

    private void respondWith(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://api.openai.test/v1")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        ReflectionTestUtils.setField(client, "webClient", webClient);
    }

    @Test
    @DisplayName("API 키 유무로 설정 여부 판단")
    void isConfigured() {
        assertThat(client.isConfigured()).isTrue();
        ReflectionTestUtils.setField(client, "apiKey", " ");
        assertThat(client.isConfigured()).isFalse();
    }

    @Test
    @DisplayName("응답 생성 요청은 POST /responses로 전송되고 응답을 파싱")
    void createResponse() {
        respondWith(HttpStatus.OK, "{\"id\":\"resp_abc\",\"status\":\"queued\"}");
        ObjectNode request = objectMapper.createObjectNode().put("model", "gpt-5-nano");

        ProviderTask task = client.createResponse(request);

        assertThat(task.id()).isEqualTo("resp_abc");
        assertThat(task.status()).isEqualTo(ProviderTaskStatus.QUEUED);
        ClientRequest sent = lastRequest.get();
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().getPath()).isEqualTo("/v1/responses");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    @DisplayName("완료된 응답의 사용량을 읽음")
    void retrieveResponse() {
        respondWith(HttpStatus.OK, """
                {"id":"resp_abc","status":"completed","output_text":"{}",
                 "usage":{"input_tokens":1200,"output_tokens":300}}
                """);

        ProviderTask task = client.retrieveResponse("resp_abc");

        assertThat(task.status()).isEqualTo(ProviderTaskStatus.COMPLETED);
        assertThat(task.inputTokens()).isEqualTo(1200);
        assertThat(task.outputTokens()).isEqualTo(300);
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/v1/responses/resp_abc");
    }

    @Test
    @DisplayName("취소 요청은 POST /responses/{id}/cancel")
    void cancelResponse() {
        respondWith(HttpStatus.OK, "{\"id\":\"resp_abc\",\"status\":\"cancelled\"}");

        ProviderTask task = client.cancelResponse("resp_abc");

        assertThat(task.status()).isEqualTo(ProviderTaskStatus.CANCELLED);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/v1/responses/resp_abc/cancel");
    }

    @Test
    @DisplayName("오류 응답 본문의 message와 code를 예외로 변환")
    void mapsErrorBody() {
        respondWith(HttpStatus.TOO_MANY_REQUESTS,
                "{\"error\":{\"message\":\"You exceeded your current quota\",\"type\":\"insufficient_quota\",\"code\":\"insufficient_quota\"}}");

        assertThatThrownBy(() -> client.createResponse(objectMapper.createObjectNode()))
                .isInstanceOfSatisfying(ProviderApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(429);
                    assertThat(e.getProviderCode()).isEqualTo("insufficient_quota");
                    assertThat(e.getMessage()).isEqualTo("You exceeded your current quota");
                });
    }

    @Test
    @DisplayName("code가 없으면 type을 사용")
    void fallsBackToErrorType() {
        respondWith(HttpStatus.INTERNAL_SERVER_ERROR,
                "{\"error\":{\"message\":\"The server had an error\",\"type\":\"server_error\",\"code\":null}}");

        assertThatThrownBy(() -> client.retrieveResponse("resp_abc"))
                .isInstanceOfSatisfying(ProviderApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(500);
                    assertThat(e.getProviderCode()).isEqualTo("server_error");
                });
    }

    @Test
    @DisplayName("JSON이 아닌 오류 본문은 그대로 메시지로 사용")
    void nonJsonErrorBody() {
        respondWith(HttpStatus.BAD_GATEWAY, "upstream connect error");

        assertThatThrownBy(() -> client.retrieveResponse("resp_abc"))
                .isInstanceOfSatisfying(ProviderApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(502);
                    assertThat(e.getProviderCode()).isNull();
                    assertThat(e.getMessage()).isEqualTo("upstream connect error");
                });
    }
}
