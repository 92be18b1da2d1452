package com.logflow.anomaly.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Slf4j
@Configuration
public class DetectionExecutorConfig {

    @Bean(name = "detectorExecutor")
    ThreadPoolTaskExecutor detectorExecutor(@Value("${anomaly.executor.core-pool-size:3}") int corePoolSize,
                                            @Value("${anomaly.executor.max-pool-size:12}") int maxPoolSize,
                                            @Value("${anomaly.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("detector-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Detector executor ready: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
