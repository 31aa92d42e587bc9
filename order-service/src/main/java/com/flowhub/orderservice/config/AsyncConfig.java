package com.flowhub.orderservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool running one allocation per request. Trials block on inventory calls,
     * so allocations never run on the servlet threads.
     */
    @Bean
    public ThreadPoolTaskExecutor allocationExecutor(ReservationProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getAllocationThreads());
        executor.setMaxPoolSize(properties.getAllocationThreads());
        executor.setQueueCapacity(properties.getAllocationThreads() * 25);
        executor.setThreadNamePrefix("allocation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
