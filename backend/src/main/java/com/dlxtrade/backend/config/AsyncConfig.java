package com.dlxtrade.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final EngineProperties engineProperties;

    /**
     * Runs every per-user engine loop, quote cancellation timer and exit monitor.
     */
    @Bean(name = "engineTaskScheduler")
    public ThreadPoolTaskScheduler engineTaskScheduler() {
        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(8, processors * 2));
        scheduler.setThreadNamePrefix("engine-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "engineScheduler")
    public ScheduledExecutorService engineScheduler(ThreadPoolTaskScheduler engineTaskScheduler) {
        return engineTaskScheduler.getScheduledExecutor();
    }

    /**
     * Collaborator I/O runs here so a hung call only blocks the waiting engine.
     * Tasks are handed off directly, so a busy pool grows a thread instead of queueing one user's
     * call behind another user's hung ones.
     */
    @Bean(name = "ioExecutor")
    public ThreadPoolTaskExecutor ioExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        int corePoolSize = Math.max(8, processors);
        int maxPoolSize = Math.max(engineProperties.getIo().getMaxPoolSize(), processors * 4);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("io-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
