package com.calai.mealplan.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * FETCH_NUTRITION fan-out 用：每個 unique ingredient key 一個 task
     */
    @Bean("nutritionLookupExecutor")
    public TaskExecutor nutritionLookupExecutor(
            @Value("${app.mealplan.nutrition.executor.pool-size:8}") int poolSize,
            @Value("${app.mealplan.nutrition.executor.queue-capacity:500}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(poolSize);
        ex.setMaxPoolSize(poolSize);
        ex.setQueueCapacity(queueCapacity);
        ex.setThreadNamePrefix("nutrition-lookup-");
        ex.initialize();
        return ex;
    }
}
