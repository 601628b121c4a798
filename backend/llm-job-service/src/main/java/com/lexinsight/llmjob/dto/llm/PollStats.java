package com.lexinsight.llmjob.dto.llm;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-phase counters reported by one poller invocation.
 */
@Data
public class PollStats {
    private int itemsReset;
    private int jobsTimedOut;
    private int jobsCancelled;
    private int itemsCancelled;
    private int itemsSubmitted;
    private int itemsFailed;
    private int submissionErrors;
    private int jobsPolled;
    private int itemsPolled;
    private int itemsUpdated;
    private List<String> jobsResolved = new ArrayList<>();
    private int errors;
    private int chainDepth;
    private boolean retriggered;

    public void incrementErrors() {
        errors++;
    }

    public void addErrors(int count) {
        errors += count;
    }
}
