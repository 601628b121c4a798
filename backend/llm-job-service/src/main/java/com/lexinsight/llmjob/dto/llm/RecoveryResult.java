package com.lexinsight.llmjob.dto.llm;

/**
 * Counts from the stale-state sweeps run at the start of every invocation.
 *
 * @param itemsReset  items released from a stale SUBMITTING claim
 * @param jobsFailed  jobs failed for exceeding the maximum runtime
 * @param itemsFailed non-terminal items of those jobs
 */
public record RecoveryResult(int itemsReset, int jobsFailed, int itemsFailed) {
}
