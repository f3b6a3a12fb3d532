package com.db.vf2pp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class ExecutorConfig {
    @Bean(name = "matchExecutor")
    public Executor matchExecutor(AppConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, config.getWorkerThreads()));
        executor.setMaxPoolSize(Math.max(1, config.getWorkerThreads()));
        executor.setThreadNamePrefix("match-");
        executor.initialize();
        return executor;
    }
}
