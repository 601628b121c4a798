package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.config.LlmJobProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Function;

/**
 * Runs one task per input on the LLM job pool with a bounded number in flight,
 * and waits for all of them to settle.
 *
 * <p>The bound is the smaller of the requested fan-out and the configured database
 * connection budget, since every task touches the store. Results come back in input
 * order; a failing task does not affect the others.
 */
@Component
@Slf4j
public class BoundedFanOut {

    private final Executor executor;
    private final int connectionBudget;

    public BoundedFanOut(@Qualifier("llmJobExecutor") Executor executor, LlmJobProperties properties) {
        this.executor = executor;
        this.connectionBudget = Math.max(1, properties.getConcurrency().getDbConnectionBudget());
    }

    /**
     * Outcome of one task: either a value or the exception it threw
     */
    public record Settled<R>(R value, Throwable error) {

        public boolean isSuccess() {
            return error == null;
        }
    }

    public <T, R> List<Settled<R>> run(List<T> inputs, int concurrency, Function<T, R> task) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        Semaphore permits = new Semaphore(effectiveConcurrency(concurrency));

        List<CompletableFuture<Settled<R>>> futures = new ArrayList<>(inputs.size());
        for (T input : inputs) {
            permits.acquireUninterruptibly();
            CompletableFuture<Settled<R>> future;
            try {
                future = CompletableFuture.supplyAsync(() -> {
                    try {
                        return new Settled<R>(task.apply(input), null);
                    } catch (RuntimeException e) {
                        return new Settled<R>(null, e);
                    } finally {
                        permits.release();
                    }
                }, executor);
            } catch (RuntimeException e) {
                permits.release();
                log.warn("Fan-out task could not be scheduled: {}", e.getMessage());
                future = CompletableFuture.completedFuture(new Settled<>(null, e));
            }
            futures.add(future);
        }

        List<Settled<R>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<Settled<R>> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                results.add(new Settled<>(null, e.getCause() != null ? e.getCause() : e));
            }
        }
        return results;
    }

    int effectiveConcurrency(int requested) {
        return Math.max(1, Math.min(requested, connectionBudget));
    }
}
