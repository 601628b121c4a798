package com.lexinsight.llmjob.dto.llm;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Poller invocation output: an HTTP-like status code and a body.
 */
public record InvocationResult(int statusCode, Body body) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Body(
            boolean success,
            String error,
            PollStats stats,
            Long pendingRemaining
    ) {
    }

    public static InvocationResult ok(PollStats stats, long pendingRemaining) {
        return new InvocationResult(200, new Body(true, null, stats, pendingRemaining));
    }

    public static InvocationResult error(String error, PollStats stats) {
        return new InvocationResult(500, new Body(false, error, stats, null));
    }

    public boolean isSuccess() {
        return statusCode == 200;
    }
}
