package com.wadechandler.notification.dispatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools for the polling loops. Each loop gets its own scheduler so a slow
 * reconciliation never delays notification polling.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single thread: incremental scans and full reconciliations never overlap.
     */
    @Bean(destroyMethod = "shutdown")
    @Profile("reconciler")
    public ThreadPoolTaskScheduler ruleSyncScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("rule-sync-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * One thread per poll (new, scheduled, failed, stale) so the polls run independently.
     */
    @Bean(destroyMethod = "shutdown")
    @Profile("dispatcher")
    public ThreadPoolTaskScheduler notificationPollScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("notification-poll-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean(destroyMethod = "shutdown")
    @Profile("dispatcher")
    public ThreadPoolTaskExecutor dispatchExecutor(DispatcherProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrency());
        executor.setMaxPoolSize(properties.getMaxConcurrency());
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(properties.getShutdownTimeout().toMillis());
        executor.initialize();
        return executor;
    }
}
