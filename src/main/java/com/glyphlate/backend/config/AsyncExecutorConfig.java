package com.glyphlate.backend.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "translationTaskExecutor")
    public Executor translationTaskExecutor(ImageTranslationProperties properties) {
        int batchSize = Math.max(1, properties.getTranslation().getBatchSize());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchSize);
        executor.setMaxPoolSize(batchSize * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("translate-");
        // Saturated pool: run the block on the request thread instead of failing the chunk.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
