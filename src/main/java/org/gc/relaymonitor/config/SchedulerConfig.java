package org.gc.relaymonitor.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.scheduling.Pacer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class SchedulerConfig {

    private final RelayMonitorProperties properties;

    /**
     * Runs every site, category and global job. Jobs of different keys fire concurrently.
     */
    @Bean
    public ThreadPoolTaskScheduler relayTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("relay-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(error -> log.error("Unhandled error in scheduled job: {}", error.getMessage(), error));
        return scheduler;
    }

    @Bean
    public Pacer pacer() {
        return Pacer.delaying();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
