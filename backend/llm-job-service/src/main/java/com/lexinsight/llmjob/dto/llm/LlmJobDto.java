package com.lexinsight.llmjob.dto.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * DTO for LLM job responses (counters only, no items).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmJobDto {
    private Long jobId;
    private String label;
    private String status;
    private int totalItems;
    private int submittedItems;
    private int processedItems;
    private int succeededItems;
    private int failedItems;
    private int flaggedItems;
    private long inputTokens;
    private long outputTokens;
    private Long costMicrounits;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
