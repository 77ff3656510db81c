package com.quantlab.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for polling workers, background dispatch and event delivery.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    /**
     * Runs submit calls for backlog jobs, including their retry backoff, off the polling threads.
     */
    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("JobDispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Delivers job events to channels. One thread keeps events in publish order.
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10000);
        executor.setThreadNamePrefix("JobEvents-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "pollingExecutorService")
    public ExecutorService pollingExecutorService(OrchestratorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getPoller().getWorkerCount()),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("PollingWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
