package com.lexinsight.llmjob.exception;

/**
 * 작업을 찾을 수 없음 (존재하지 않거나 soft-delete 된 경우)
 */
public class LlmJobNotFoundException extends LlmJobException {

    public LlmJobNotFoundException(Long jobId) {
        super("JOB_NOT_FOUND", "LLM job not found: " + jobId, jobId);
    }
}
