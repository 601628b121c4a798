package com.lexinsight.llmjob.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tuning for the LLM job poller.
 *
 * Defaults match the production deployment; the test profile shrinks backoff
 * and the connection budget.
 */
@Configuration
@ConfigurationProperties(prefix = "llm-jobs")
@Data
public class LlmJobProperties {

    private Submission submission = new Submission();

    private Polling polling = new Polling();

    private Cancellation cancellation = new Cancellation();

    private Recovery recovery = new Recovery();

    private Chain chain = new Chain();

    private Concurrency concurrency = new Concurrency();

    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Submission {
        /** Items claimed per invocation */
        private int maxItems = 1000;

        /** Provider requests in flight at once */
        private int concurrency = 25;

        private int maxRetries = 3;

        /** Backoff base; the n-th retry waits base * 2^n */
        private long backoffBaseMillis = 1000;

        private String defaultModel = "gpt-5-nano";
    }

    @Data
    public static class Polling {
        /** Non-terminal items fetched per job per invocation */
        private int maxItemsPerJob = 1000;

        private int concurrency = 50;

        private long itemTimeoutHours = 2;
    }

    @Data
    public static class Cancellation {
        private int concurrency = 50;
    }

    @Data
    public static class Recovery {
        /** Age after which a submitting item is considered orphaned */
        private long submittingGraceMinutes = 5;

        private long maxJobRuntimeHours = 48;
    }

    @Data
    public static class Chain {
        private int maxDepth = 2;
    }

    @Data
    public static class Concurrency {
        /** Upper bound on concurrent store or provider calls from one fan-out */
        private int dbConnectionBudget = 20;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;

        private long fixedDelayMillis = 30000;
    }
}
