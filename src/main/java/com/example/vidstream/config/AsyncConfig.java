package com.example.vidstream.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String TRANSCODE_WORKER_EXECUTOR = "transcodeWorkerExecutor";
    public static final String ENCODER_STREAM_EXECUTOR = "encoderStreamExecutor";

    private final TranscodeProperties transcodeProperties;

    public AsyncConfig(TranscodeProperties transcodeProperties) {
        this.transcodeProperties = transcodeProperties;
    }

    /**
     * Bounded pool the dispatcher hands claimed jobs to. Encoding is CPU bound, so one thread per worker slot.
     */
    @Bean(name = TRANSCODE_WORKER_EXECUTOR)
    public ThreadPoolTaskExecutor transcodeWorkerExecutor() {
        int workers = transcodeProperties.effectiveWorkers();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(workers);
        executor.setThreadNamePrefix("transcode-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("Transcode worker pool initialized with {} workers", workers);
        return executor;
    }

    /**
     * Drains encoder stdout/stderr; every running encode holds two of these threads.
     */
    @Bean(name = ENCODER_STREAM_EXECUTOR)
    public ThreadPoolTaskExecutor encoderStreamExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(transcodeProperties.effectiveWorkers() * 2);
        executor.setThreadNamePrefix("encoder-io-");
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-");
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return asyncTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable ex, Method method, Object... params) ->
                log.error("Unhandled exception caught in @Async method '{}' with parameters {}:",
                method.getName(), Arrays.toString(params), ex);
    }
}
