package com.xammer.costhub.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    /** One worker per upstream source, shared by every aggregation run. */
    @Bean(name = "sourceTaskExecutor")
    public Executor sourceTaskExecutor(@Value("${costhub.executor.source-threads:3}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(threads * 4);
        executor.setThreadNamePrefix("CostSource-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "regionFanOutExecutor")
    public Executor regionFanOutExecutor(@Value("${costhub.executor.region-threads:5}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(threads, 5)); // never more than 5 regions in flight
        executor.setMaxPoolSize(Math.min(threads, 5));
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("CohRegion-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "aggregationTaskExecutor")
    public Executor aggregationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("Aggregation-");
        executor.initialize();
        return executor;
    }
}
