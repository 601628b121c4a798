package com.lexinsight.llmjob.dto.llm;

import java.util.List;

public record SubmissionResult(int submitted, int failed, List<ItemError> errors) {

    public static SubmissionResult empty() {
        return new SubmissionResult(0, 0, List.of());
    }
}
