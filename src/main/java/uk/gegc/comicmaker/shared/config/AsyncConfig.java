package uk.gegc.comicmaker.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool backing the asynchronous job substrate.
 * <p>
 * {@code generationTaskExecutor} runs image generation and PDF compilation jobs, which spend most
 * of their time waiting on provider I/O. It is also the default executor for any other {@code @Async} method.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.generation.core-pool-size:4}")
    private int generationCorePoolSize;

    @Value("${async.generation.max-pool-size:8}")
    private int generationMaxPoolSize;

    @Value("${async.generation.queue-capacity:100}")
    private int generationQueueCapacity;

    @Value("${async.generation.keep-alive-seconds:60}")
    private int generationKeepAliveSeconds;

    @Bean(name = "generationTaskExecutor")
    public Executor generationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generationCorePoolSize);
        executor.setMaxPoolSize(generationMaxPoolSize);
        executor.setQueueCapacity(generationQueueCapacity);
        executor.setKeepAliveSeconds(generationKeepAliveSeconds);
        executor.setThreadNamePrefix("generation-");
        // Jobs are never dropped; a saturated pool pushes work back onto the submitting thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Generation Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                generationCorePoolSize, generationMaxPoolSize, generationQueueCapacity, generationKeepAliveSeconds);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generationTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) -> log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                method.getDeclaringClass().getSimpleName(),
                method.getName(),
                Arrays.toString(params), ex);
    }
}
