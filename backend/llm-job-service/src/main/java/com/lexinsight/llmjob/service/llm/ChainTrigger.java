package com.lexinsight.llmjob.service.llm;

/**
 * Starts a follow-up poller invocation without waiting for it.
 */
public interface ChainTrigger {

    /**
     * @throws com.lexinsight.llmjob.exception.ChainTriggerException if the invocation could not be started
     */
    void trigger(int chainDepth);
}
