package org.gc.relaymonitor.scheduling;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "relay-monitor.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerBootstrap {

    private final ScheduleOrchestrator scheduleOrchestrator;

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleOnStartup() {
        log.info("Reconciling scheduled jobs on startup");
        try {
            scheduleOrchestrator.initialize();
        } catch (RuntimeException e) {
            log.error("Failed to reconcile scheduled jobs on startup: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void stopJobs() {
        scheduleOrchestrator.shutdown();
    }
}
