package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.exception.ProviderApiException;

import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a provider error is worth retrying and how it is reported on the item.
 * Pure function of HTTP status, error code and message.
 */
public final class ProviderErrorClassifier {

    private static final Set<String> RETRYABLE_CODES = Set.of(
            "internal_server_error",
            "service_unavailable",
            "bad_gateway",
            ProviderApiException.CODE_TIMEOUT,
            ProviderApiException.CODE_CONNECTION_ERROR
    );

    private ProviderErrorClassifier() {
    }

    public record Classification(boolean retryable, String message) {
    }

    public static Classification classify(Throwable error) {
        if (error instanceof ProviderApiException providerError) {
            return classify(providerError.getStatusCode(), providerError.getProviderCode(), providerError.getMessage());
        }
        // 분류할 수 없는 예외는 재시도하지 않음
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new Classification(false, message);
    }

    public static Classification classify(Integer status, String code, String message) {
        String text = message != null ? message : "Unknown provider error";
        String normalizedCode = code != null ? code.toLowerCase(Locale.ROOT) : null;

        if ("insufficient_quota".equals(normalizedCode)) {
            return new Classification(false, "Quota exceeded: " + text);
        }
        if (status != null && status == 429) {
            if (text.toLowerCase(Locale.ROOT).contains("quota")) {
                return new Classification(false, "Quota exceeded: " + text);
            }
            return new Classification(true, "Rate limited: " + text);
        }
        if (status != null && status == 401) {
            return new Classification(false, "Authentication error: " + text);
        }
        if (status != null && status == 403) {
            return new Classification(false, "Permission denied: " + text);
        }
        if ((status != null && status == 408) || ProviderApiException.CODE_TIMEOUT.equals(normalizedCode)) {
            return new Classification(true, "Timeout: " + text);
        }
        if (ProviderApiException.CODE_CONNECTION_ERROR.equals(normalizedCode)) {
            return new Classification(true, "Connection error: " + text);
        }
        if ((status != null && status >= 500) || (normalizedCode != null && RETRYABLE_CODES.contains(normalizedCode))) {
            return new Classification(true, "Server error: " + text);
        }
        if ((status != null && status == 400) || "invalid_request_error".equals(normalizedCode)) {
            return new Classification(false, "Invalid request: " + text);
        }
        return new Classification(false, text);
    }
}
