package com.lexinsight.llmjob.exception;

/**
 * Error returned by (or while reaching) the completion provider.
 *
 * <p>{@code statusCode} is the HTTP status when the provider answered, otherwise null.
 * {@code providerCode} is the provider's error code, or one of {@link #CODE_TIMEOUT} /
 * {@link #CODE_CONNECTION_ERROR} for transport failures.
 */
public class ProviderApiException extends LlmJobException {

    public static final String CODE_TIMEOUT = "timeout";
    public static final String CODE_CONNECTION_ERROR = "connection_error";

    private final Integer statusCode;
    private final String providerCode;

    public ProviderApiException(Integer statusCode, String providerCode, String message) {
        super("PROVIDER_ERROR", message, null);
        this.statusCode = statusCode;
        this.providerCode = providerCode;
    }

    public ProviderApiException(Integer statusCode, String providerCode, String message, Throwable cause) {
        super("PROVIDER_ERROR", message, null, cause);
        this.statusCode = statusCode;
        this.providerCode = providerCode;
    }

    public static ProviderApiException timeout(String message, Throwable cause) {
        return new ProviderApiException(null, CODE_TIMEOUT, message, cause);
    }

    public static ProviderApiException connectionError(String message, Throwable cause) {
        return new ProviderApiException(null, CODE_CONNECTION_ERROR, message, cause);
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getProviderCode() {
        return providerCode;
    }
}
