package com.lexinsight.llmjob.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * LLM 작업 API 전역 예외 핸들러
 *
 * <p>제공자 오류는 항목의 last_error 에 기록되고 API 까지 올라오지 않으므로 별도 핸들러를 두지 않음.
 */
@RestControllerAdvice(basePackages = "com.lexinsight.llmjob.controller")
@Slf4j
public class LlmJobExceptionHandler {

    @ExceptionHandler(LlmJobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(LlmJobNotFoundException ex) {
        log.warn("Job not found: {}", ex.getMessage());
        return build(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(LlmJobException.class)
    public ResponseEntity<Map<String, Object>> handleLlmJobException(LlmJobException ex) {
        log.error("LLM job error: {}", ex.getMessage(), ex);
        return build(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        log.warn("Invalid request: {}", message);
        Map<String, Object> response = createErrorResponse(
                "INVALID_REQUEST",
                message,
                null,
                HttpStatus.BAD_REQUEST.value()
        );
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        Map<String, Object> response = createErrorResponse(
                "INTERNAL_ERROR",
                "An unexpected error occurred",
                null,
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ResponseEntity<Map<String, Object>> build(LlmJobException ex, HttpStatus status) {
        Map<String, Object> response = createErrorResponse(
                ex.getErrorCode(),
                ex.getMessage(),
                ex.getJobId(),
                status.value()
        );
        return ResponseEntity.status(status).body(response);
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, Long jobId, int status) {
        Map<String, Object> response = new HashMap<>();
        response.put("errorCode", errorCode);
        response.put("message", message);
        response.put("status", status);
        response.put("timestamp", LocalDateTime.now().toString());
        if (jobId != null) {
            response.put("jobId", jobId);
        }
        return response;
    }
}
