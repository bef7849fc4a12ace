package org.gc.relaymonitor.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.checker.SiteChecker;
import org.gc.relaymonitor.domain.CheckOptions;
import org.gc.relaymonitor.domain.ScheduleConfig;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.ScheduleConfigRepository;
import org.gc.relaymonitor.repository.SiteRepository;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.Optional;

/**
 * Individual schedules, one job per site that has its own schedule expression.
 */
@Slf4j
@Component
public class SiteJobRegistry extends KeyedJobRegistry {

    private final SiteRepository siteRepository;
    private final ScheduleConfigRepository scheduleConfigRepository;
    private final SiteChecker siteChecker;
    private final PrecedenceResolver precedenceResolver;
    private final RelayMonitorProperties properties;

    public SiteJobRegistry(TaskScheduler taskScheduler,
                           SiteRepository siteRepository,
                           ScheduleConfigRepository scheduleConfigRepository,
                           SiteChecker siteChecker,
                           PrecedenceResolver precedenceResolver,
                           RelayMonitorProperties properties) {
        super(taskScheduler);
        this.siteRepository = siteRepository;
        this.scheduleConfigRepository = scheduleConfigRepository;
        this.siteChecker = siteChecker;
        this.precedenceResolver = precedenceResolver;
        this.properties = properties;
    }

    /**
     * Re-derives the site's job against the stored global config.
     *
     * @throws InvalidScheduleException if the site's expression or timezone is malformed
     */
    public synchronized void upsert(Site site) {
        upsert(site, scheduleConfigRepository.findFirstByOrderByCreatedAtAsc().orElse(null));
    }

    /**
     * Re-derives the site's job against the given global config snapshot.
     */
    public synchronized void upsert(Site site, ScheduleConfig globalConfig) {
        stopJob(site.getId());

        if (precedenceResolver.individualSchedulesSuppressed(globalConfig)) {
            log.info("Global override enabled, site {} ({}) will be handled by the global task", site.getId(), site.getName());
            return;
        }

        if (!site.hasOwnSchedule()) {
            log.info("Site {} ({}) has no custom schedule, will be handled by the global task", site.getId(), site.getName());
            return;
        }

        String siteId = site.getId();
        ZoneId zone = CronExpressions.zone(site.getTimezone(), properties.getScheduler().getDefaultTimezone());
        TimeTrigger trigger = new TimeTrigger("site:" + siteId, site.getScheduleCron().trim(), zone, taskScheduler,
                inFlightFlag(siteId), () -> runScheduledCheck(siteId));
        installJob(siteId, trigger);

        log.info("Individual schedule task created for site {} ({}): '{}' in {}",
                siteId, site.getName(), trigger.getExpression(), zone);
    }

    /**
     * Bulk reconciliation. A site with a malformed schedule is logged and skipped.
     */
    public synchronized void upsertAll(Iterable<Site> sites, ScheduleConfig globalConfig) {
        for (Site site : sites) {
            try {
                upsert(site, globalConfig);
            } catch (InvalidScheduleException e) {
                log.error("Skipping schedule of site {} ({}): {}", site.getId(), site.getName(), e.getMessage());
            }
        }
    }

    public synchronized boolean remove(String siteId) {
        boolean removed = stopJob(siteId);
        if (removed) {
            log.info("Individual schedule task removed for site {}", siteId);
        }
        return removed;
    }

    @Override
    public synchronized int stopAll() {
        int count = super.stopAll();
        log.info("Stopped {} individual site jobs", count);
        return count;
    }

    void runScheduledCheck(String siteId) {
        try {
            Optional<Site> latest = siteRepository.findById(siteId);
            if (latest.isEmpty()) {
                log.warn("Site {} not found, skipping scheduled check", siteId);
                return;
            }

            Site site = latest.get();
            siteChecker.check(site, CheckOptions.scheduled(false)).block();
            log.info("Individual scheduled check done for site {} ({})", site.getId(), site.getName());
        } catch (RuntimeException e) {
            log.warn("Individual scheduled check failed for site {}: {}", siteId, e.getMessage());
        }
    }
}
