package com.project.image.threshold.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ThresholdConfig {

    /**
     * Single thread the presenter handles worker outcomes on, in delivery order.
     */
    @Bean
    public ThreadPoolTaskExecutor presenterExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("presenter-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
