package com.lexinsight.llmjob.dto.llm;

public record CancellationResult(int jobsProcessed, int itemsCancelled, int errors) {

    public static CancellationResult empty() {
        return new CancellationResult(0, 0, 0);
    }
}
