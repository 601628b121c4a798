package com.lexinsight.llmjob.dto.llm;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Poller invocation input.
 *
 * @param chainDepth number of self-triggered invocations since the last scheduled one
 */
public record InvocationRequest(@PositiveOrZero Integer chainDepth) {

    public static InvocationRequest scheduled() {
        return new InvocationRequest(0);
    }

    public int depth() {
        return chainDepth == null || chainDepth < 0 ? 0 : chainDepth;
    }
}
