package org.gc.relaymonitor.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.checker.SiteChecker;
import org.gc.relaymonitor.domain.BatchOutcome;
import org.gc.relaymonitor.domain.ChangedSite;
import org.gc.relaymonitor.domain.CheckOptions;
import org.gc.relaymonitor.domain.ScheduleConfig;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.notification.Notifier;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.ScheduleConfigRepository;
import org.gc.relaymonitor.repository.SiteRepository;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The global default schedule: a single daily job checking every site that no higher tier owns,
 * or every site in override mode, and sending one aggregated notification per run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalJobRegistry {

    private final TaskScheduler taskScheduler;
    private final ScheduleConfigRepository scheduleConfigRepository;
    private final SiteRepository siteRepository;
    private final SiteJobRegistry siteJobRegistry;
    private final BatchRunner batchRunner;
    private final SiteChecker siteChecker;
    private final Notifier notifier;
    private final PrecedenceResolver precedenceResolver;
    private final RelayMonitorProperties properties;
    private final Clock clock;

    /** Shared by every global trigger, so a reconfigure during a running batch cannot start a second one. */
    private final AtomicBoolean globalInFlight = new AtomicBoolean(false);

    private TimeTrigger globalJob;

    /**
     * Reconciles the global job and every individual site job with the given config.
     *
     * @param config the global config, or null when none exists
     */
    public synchronized void reconfigure(ScheduleConfig config) {
        stop();

        if (config == null || !config.isEnabled()) {
            log.info("Global schedule task disabled, rescheduling individual site jobs");
            siteJobRegistry.upsertAll(siteRepository.findAllByOrderByCreatedAtAsc(), config);
            return;
        }

        if (config.isOverrideIndividual()) {
            log.info("Override mode enabled, stopping all individual site jobs");
            siteJobRegistry.stopAll();
        } else {
            log.info("Non-override mode, rescheduling individual site jobs");
            siteJobRegistry.upsertAll(siteRepository.findAllByOrderByCreatedAtAsc(), config);
        }

        RelayMonitorProperties.GlobalDefaults defaults = properties.getGlobalDefaults();
        int hour = Objects.requireNonNullElse(config.getHour(), defaults.getHour());
        int minute = Objects.requireNonNullElse(config.getMinute(), defaults.getMinute());
        String expression = CronExpressions.daily(hour, minute);
        ZoneId zone = CronExpressions.zone(config.getTimezone(), defaults.getTimezone());

        String configId = config.getId();
        TimeTrigger trigger = new TimeTrigger("global", expression, zone, taskScheduler, globalInFlight,
                () -> runGlobalBatch(configId));
        trigger.start();
        globalJob = trigger;

        log.info("Global schedule task created: '{}' in {}, interval {}s", expression, zone, config.getInterval());
    }

    public synchronized void stop() {
        if (globalJob != null) {
            globalJob.stop();
            globalJob = null;
            log.info("Global schedule task stopped");
        }
    }

    public synchronized boolean isActive() {
        return globalJob != null;
    }

    public synchronized Optional<String> currentExpression() {
        return Optional.ofNullable(globalJob).map(TimeTrigger::getExpression);
    }

    void runGlobalBatch(String configId) {
        try {
            log.info("Global schedule task triggered");

            Optional<ScheduleConfig> latest = scheduleConfigRepository.findById(configId);
            if (latest.isEmpty() || !latest.get().isEnabled()) {
                log.info("Global schedule task is disabled, skipping");
                return;
            }

            ScheduleConfig config = latest.get();
            List<Site> allSites = siteRepository.findAllByOrderByCreatedAtAsc();
            List<Site> sites = precedenceResolver.globalCandidates(config, allSites);

            log.info("Global task: {} sites in total, override {}, {} with custom schedule, {} to check",
                    allSites.size(), config.isOverrideIndividual(), allSites.size() - sites.size(), sites.size());

            if (sites.isEmpty()) {
                log.info("No sites to check for the global task");
                markLastRun(configId);
                return;
            }

            int intervalSeconds = Objects.requireNonNullElse(config.getInterval(), properties.getGlobalDefaults().getInterval());
            BatchOutcome outcome = batchRunner.run(sites, Duration.ofSeconds(intervalSeconds),
                            site -> siteChecker.check(site, CheckOptions.scheduled(true)))
                    .blockOptional()
                    .orElseGet(BatchOutcome::empty);

            notifyAggregated(outcome);
            markLastRun(configId);

            log.info("Global schedule task completed: {} checked, {} failed",
                    outcome.getResults().size(), outcome.getFailedSites().size());
        } catch (RuntimeException e) {
            log.error("Global schedule task error: {}", e.getMessage(), e);
        }
    }

    private void notifyAggregated(BatchOutcome outcome) {
        List<ChangedSite> sitesWithChanges = outcome.notifiableSites();
        for (ChangedSite changed : sitesWithChanges) {
            log.info("Site {} ({}) added to notification: model changes {}, check-in result {}",
                    changed.getSiteId(), changed.getSiteName(), changed.getDiff() != null, changed.getCheckInResult() != null);
        }

        if (sitesWithChanges.isEmpty() && !outcome.hasFailures()) {
            log.info("No changes or failures detected, skipping notification");
            return;
        }

        log.info("Sending aggregated notification: {} sites with changes, {} failed",
                sitesWithChanges.size(), outcome.getFailedSites().size());
        try {
            notifier.sendAggregated(sitesWithChanges, outcome.getFailedSites()).block();
        } catch (RuntimeException e) {
            log.error("Aggregated notification failed: {}", e.getMessage());
        }
    }

    private void markLastRun(String configId) {
        Instant now = clock.instant();
        scheduleConfigRepository.findById(configId).ifPresent(current -> {
            current.setLastRun(now);
            scheduleConfigRepository.save(current);
        });
    }
}
