package com.lexinsight.llmjob.dto.llm;

import com.lexinsight.llmjob.entity.llm.LlmJobStatus;

public record AggregationResult(Long jobId, JobItemCounts counts, LlmJobStatus status) {
}
