package com.lexinsight.llmjob.dto.llm;

/**
 * Aggregate over a job's items, read in a single query.
 */
public record JobItemCounts(
        long total,
        long submitted,
        long processed,
        long succeeded,
        long failed,
        long flagged,
        long inputTokens,
        long outputTokens
) {
    public static JobItemCounts fromRow(Object[] row) {
        return new JobItemCounts(
                toLong(row[0]),
                toLong(row[1]),
                toLong(row[2]),
                toLong(row[3]),
                toLong(row[4]),
                toLong(row[5]),
                toLong(row[6]),
                toLong(row[7])
        );
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
