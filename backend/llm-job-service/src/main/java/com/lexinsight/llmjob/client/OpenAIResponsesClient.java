package com.lexinsight.llmjob.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexinsight.llmjob.dto.llm.ProviderTask;
import com.lexinsight.llmjob.exception.ProviderApiException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutException;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking client for the OpenAI Responses API in background mode.
 *
 * Every call returns the provider's response object as a {@link ProviderTask}; any failure,
 * including transport errors, surfaces as {@link ProviderApiException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAIResponsesClient {

    private final ObjectMapper objectMapper;
    private WebClient webClient;

    @Value("${LLM_OPENAI_API_KEY:${OPENAI_API_KEY:}}")
    private String apiKey;

    @Value("${LLM_OPENAI_BASE_URL:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${llm-jobs.client.connect-timeout-millis:30000}")
    private int connectTimeoutMillis;

    @Value("${llm-jobs.client.timeout-seconds:60}")
    private int timeoutSeconds;

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                            .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                );

        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("User-Agent", "LexInsight-LlmJobs/1.0")
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();

        log.info("OpenAIResponsesClient initialized - baseUrl: {}, configured: {}", baseUrl, isConfigured());
    }

    /**
     * Check if an API key is available
     */
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Create a background response
     */
    public ProviderTask createResponse(JsonNode request) {
        return execute("create", webClient.post()
                .uri("/responses")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonNode.class));
    }

    /**
     * Fetch the current state of a background response
     */
    public ProviderTask retrieveResponse(String responseId) {
        return execute("retrieve", webClient.get()
                .uri("/responses/{id}", responseId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .retrieve()
                .bodyToMono(JsonNode.class));
    }

    /**
     * Ask the provider to stop a background response
     */
    public ProviderTask cancelResponse(String responseId) {
        return execute("cancel", webClient.post()
                .uri("/responses/{id}/cancel", responseId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .retrieve()
                .bodyToMono(JsonNode.class));
    }

    private ProviderTask execute(String operation, Mono<JsonNode> call) {
        try {
            JsonNode body = call
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
            if (body == null) {
                throw new ProviderApiException(null, null, "Empty response from provider on " + operation);
            }
            return ProviderTask.from(body);
        } catch (WebClientResponseException e) {
            throw toProviderException(e);
        } catch (WebClientRequestException e) {
            if (isTimeout(e)) {
                throw ProviderApiException.timeout("Request timed out: " + e.getMessage(), e);
            }
            throw ProviderApiException.connectionError("Connection failed: " + e.getMessage(), e);
        } catch (ProviderApiException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (isTimeout(cause)) {
                throw ProviderApiException.timeout("Request timed out after " + timeoutSeconds + "s", cause);
            }
            throw e;
        }
    }

    /**
     * Map an HTTP error response ({"error": {"message", "code", "type"}}) to a provider exception
     */
    ProviderApiException toProviderException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String message = e.getStatusText();
        String code = null;

        String body = e.getResponseBodyAsString();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(body).path("error");
                if (error.hasNonNull("message")) {
                    message = error.get("message").asText();
                }
                if (error.hasNonNull("code")) {
                    code = error.get("code").asText();
                } else if (error.hasNonNull("type")) {
                    code = error.get("type").asText();
                }
            } catch (Exception parseError) {
                log.debug("Provider error body is not JSON: {}", body);
                message = body;
            }
        }
        return new ProviderApiException(status, code, message, e);
    }

    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof ReadTimeoutException
                    || current instanceof WriteTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
