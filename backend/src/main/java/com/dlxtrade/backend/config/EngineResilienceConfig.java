package com.dlxtrade.backend.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class EngineResilienceConfig {

    @Bean
    public TimeLimiter engineIoTimeLimiter(EngineProperties engineProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(engineProperties.getIo().getTimeoutMs()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("engine-io", config);
    }
}
