package com.medledger.consentservice.configurations;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ExecutorConfig {

    /**
     * Pool that runs ledger, blob store and crypto calls so callers can bound them with a timeout.
     */
    @Bean(name = "dependencyExecutor")
    public ThreadPoolTaskExecutor dependencyExecutor(ConsentEngineProperties properties) {
        int poolSize = properties.getDependencies().getPoolSize();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("dependency-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Single source of "now" for expiration checks; requesters never supply their own clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
