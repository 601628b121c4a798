package com.lexinsight.llmjob.exception;

/**
 * 후속 poller 호출을 예약하지 못한 경우
 */
public class ChainTriggerException extends LlmJobException {

    public ChainTriggerException(int chainDepth, Throwable cause) {
        super("CHAIN_TRIGGER_FAILED", "Failed to trigger chained invocation at depth " + chainDepth, null, cause);
    }
}
