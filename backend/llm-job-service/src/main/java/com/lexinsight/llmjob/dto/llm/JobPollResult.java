package com.lexinsight.llmjob.dto.llm;

public record JobPollResult(int itemsPolled, int itemsUpdated, int errors, boolean resolved) {
}
