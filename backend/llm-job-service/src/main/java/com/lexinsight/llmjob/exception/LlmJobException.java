package com.lexinsight.llmjob.exception;

import lombok.Getter;

/**
 * 작업 엔진 예외의 공통 부모. errorCode 와 관련 jobId 는 API 오류 응답에 그대로 실림.
 */
@Getter
public class LlmJobException extends RuntimeException {

    private final String errorCode;
    private final Long jobId;

    protected LlmJobException(String errorCode, String message, Long jobId) {
        this(errorCode, message, jobId, null);
    }

    protected LlmJobException(String errorCode, String message, Long jobId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.jobId = jobId;
    }
}
