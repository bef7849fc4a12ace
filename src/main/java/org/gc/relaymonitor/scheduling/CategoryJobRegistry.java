package org.gc.relaymonitor.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.checker.SiteChecker;
import org.gc.relaymonitor.domain.BatchOutcome;
import org.gc.relaymonitor.domain.Category;
import org.gc.relaymonitor.domain.CheckOptions;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.CategoryRepository;
import org.gc.relaymonitor.repository.SiteRepository;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Category schedules. A firing checks every non-pinned member of the category, each site sending
 * its own notification. Not affected by the global override flag.
 */
@Slf4j
@Component
public class CategoryJobRegistry extends KeyedJobRegistry {

    private final CategoryRepository categoryRepository;
    private final SiteRepository siteRepository;
    private final SiteChecker siteChecker;
    private final BatchRunner batchRunner;
    private final PrecedenceResolver precedenceResolver;
    private final RelayMonitorProperties properties;

    public CategoryJobRegistry(TaskScheduler taskScheduler,
                               CategoryRepository categoryRepository,
                               SiteRepository siteRepository,
                               SiteChecker siteChecker,
                               BatchRunner batchRunner,
                               PrecedenceResolver precedenceResolver,
                               RelayMonitorProperties properties) {
        super(taskScheduler);
        this.categoryRepository = categoryRepository;
        this.siteRepository = siteRepository;
        this.siteChecker = siteChecker;
        this.batchRunner = batchRunner;
        this.precedenceResolver = precedenceResolver;
        this.properties = properties;
    }

    /**
     * @throws InvalidScheduleException if the category's expression or timezone is malformed
     */
    public synchronized void upsert(Category category) {
        stopJob(category.getId());

        if (!category.hasOwnSchedule()) {
            log.info("Category {} ({}) has no custom schedule", category.getId(), category.getName());
            return;
        }

        String categoryId = category.getId();
        ZoneId zone = CronExpressions.zone(category.getTimezone(), properties.getScheduler().getDefaultTimezone());
        TimeTrigger trigger = new TimeTrigger("category:" + categoryId, category.getScheduleCron().trim(), zone,
                taskScheduler, inFlightFlag(categoryId), () -> runCategoryBatch(categoryId));
        installJob(categoryId, trigger);

        log.info("Category schedule task created for {} ({}): '{}' in {}",
                categoryId, category.getName(), trigger.getExpression(), zone);
    }

    public synchronized void upsertAll(Iterable<Category> categories) {
        for (Category category : categories) {
            try {
                upsert(category);
            } catch (InvalidScheduleException e) {
                log.error("Skipping schedule of category {} ({}): {}", category.getId(), category.getName(), e.getMessage());
            }
        }
    }

    /**
     * Called when a category is deleted.
     */
    public synchronized boolean remove(String categoryId) {
        boolean removed = stopJob(categoryId);
        if (removed) {
            log.info("Category schedule task removed for {}", categoryId);
        }
        return removed;
    }

    void runCategoryBatch(String categoryId) {
        try {
            Optional<Category> latest = categoryRepository.findById(categoryId);
            if (latest.isEmpty()) {
                log.warn("Category {} not found, skipping scheduled check", categoryId);
                return;
            }

            Category category = latest.get();
            List<Site> sitesToCheck = precedenceResolver.categoryCandidates(siteRepository.findByCategoryId(categoryId));
            if (sitesToCheck.isEmpty()) {
                log.info("No sites to check in category {} ({})", categoryId, category.getName());
                return;
            }

            log.info("Category scheduled check started for {} ({}), {} sites", categoryId, category.getName(), sitesToCheck.size());

            Duration interval = Duration.ofSeconds(properties.getScheduler().getCategoryIntervalSeconds());
            BatchOutcome outcome = batchRunner.run(sitesToCheck, interval,
                            site -> siteChecker.check(site, CheckOptions.scheduled(false))
                                    .doOnNext(result -> log.info("Site {} ({}) checked in category task, changes: {}",
                                            site.getId(), result.getSiteName(), result.isHasChanges())))
                    .block();

            if (outcome != null) {
                outcome.getFailedSites().forEach(failed -> log.error("Site {} ({}) failed in category task: {}",
                        failed.getSiteId(), failed.getSiteName(), failed.getErrorMessage()));
            }

            log.info("Category scheduled check completed for {} ({})", categoryId, category.getName());
        } catch (RuntimeException e) {
            log.error("Category scheduled check failed for {}: {}", categoryId, e.getMessage(), e);
        }
    }
}
