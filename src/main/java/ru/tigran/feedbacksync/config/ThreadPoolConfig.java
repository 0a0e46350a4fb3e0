package ru.tigran.feedbacksync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Конфигурация thread pools (bulkhead): AI батчи и загрузка источников изолированы друг от друга.
 * При переполнении очереди задача выполняется в вызывающем потоке, задачи не теряются.
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Executor для AI батчей. Размер пула равен ширине волны, поэтому волна выполняется целиком параллельно.
     */
    @Bean(name = "aiBatchExecutor")
    public Executor aiBatchExecutor(@Value("${app.ai.concurrency:10}") int concurrency) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(concurrency * 10);
        executor.setThreadNamePrefix("ai-batch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(callerRunsWithWarning("AI batch"));
        executor.initialize();
        return executor;
    }

    /**
     * Executor для параллельной загрузки из источников (по одной задаче на источник)
     */
    @Bean(name = "sourceFetchExecutor")
    public Executor sourceFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("source-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(callerRunsWithWarning("Source fetch"));
        executor.initialize();
        return executor;
    }

    private static ThreadPoolExecutor.CallerRunsPolicy callerRunsWithWarning(String poolName) {
        return new ThreadPoolExecutor.CallerRunsPolicy() {
            @Override
            public void rejectedExecution(Runnable task, ThreadPoolExecutor pool) {
                log.warn("{} task rejected: queue is full, running in caller thread", poolName);
                super.rejectedExecution(task, pool);
            }
        };
    }
}
