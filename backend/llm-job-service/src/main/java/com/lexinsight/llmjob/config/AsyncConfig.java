package com.lexinsight.llmjob.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.llm-job.core-pool-size:25}")
    private int llmJobCorePoolSize;

    @Value("${async.llm-job.max-pool-size:50}")
    private int llmJobMaxPoolSize;

    @Value("${async.llm-job.queue-capacity:1000}")
    private int llmJobQueueCapacity;

    @Value("${async.chain.core-pool-size:1}")
    private int chainCorePoolSize;

    @Value("${async.chain.max-pool-size:2}")
    private int chainMaxPoolSize;

    @Value("${async.chain.queue-capacity:10}")
    private int chainQueueCapacity;

    /**
     * 제공자 호출 및 항목 단위 DB 작업용 실행자
     */
    @Bean(name = "llmJobExecutor")
    public ThreadPoolTaskExecutor llmJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(llmJobCorePoolSize);
        executor.setMaxPoolSize(llmJobMaxPoolSize);
        executor.setQueueCapacity(llmJobQueueCapacity);
        executor.setThreadNamePrefix("llm-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        // 거부된 작업은 호출 스레드에서 실행 (결과 대기 중인 fan-out이 멈추지 않도록)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * 체인 재호출 전용 실행자
     */
    @Bean(name = "chainExecutor")
    public ThreadPoolTaskExecutor chainExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(chainCorePoolSize);
        executor.setMaxPoolSize(chainMaxPoolSize);
        executor.setQueueCapacity(chainQueueCapacity);
        executor.setThreadNamePrefix("llm-chain-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(300);
        // 거부 시 예외를 던져 체인 트리거가 실패를 인지하도록 함
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return llmJobExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> {
            log.error("Uncaught async exception in method {}: {}", method.getName(), ex.getMessage(), ex);
        };
    }
}
