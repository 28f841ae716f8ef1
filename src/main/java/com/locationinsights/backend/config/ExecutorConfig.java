package com.locationinsights.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Bounded pool for tile and place-details fan-out.
     * Every task still passes through the shared provider gate, so this only caps in-flight requests.
     */
    @Bean(name = "placesRequestExecutor")
    public ThreadPoolTaskExecutor placesRequestExecutor(GooglePlacesProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getConcurrency());
        executor.setMaxPoolSize(properties.getConcurrency());
        executor.setQueueCapacity(properties.getQueueCapacity());
        executor.setThreadNamePrefix("places-request-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
