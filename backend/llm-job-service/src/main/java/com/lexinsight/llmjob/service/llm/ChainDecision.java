package com.lexinsight.llmjob.service.llm;

/**
 * Whether an invocation should trigger a follow-up invocation.
 */
public record ChainDecision(boolean chain, int nextDepth, String reason) {

    public static ChainDecision decide(long pendingRemaining, int chainDepth, int maxDepth) {
        if (pendingRemaining <= 0) {
            return new ChainDecision(false, chainDepth, "No pending items remaining");
        }
        if (chainDepth >= maxDepth) {
            return new ChainDecision(false, chainDepth,
                    "Max chain depth (" + maxDepth + ") reached, waiting for next scheduled run");
        }
        return new ChainDecision(true, chainDepth + 1,
                pendingRemaining + " pending item(s), triggering depth " + (chainDepth + 1) + "/" + maxDepth);
    }
}
