package org.gc.relaymonitor.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.domain.Category;
import org.gc.relaymonitor.domain.ScheduleConfig;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.dto.ScheduleStatus;
import org.gc.relaymonitor.repository.CategoryRepository;
import org.gc.relaymonitor.repository.ScheduleConfigRepository;
import org.gc.relaymonitor.repository.SiteRepository;
import org.springframework.stereotype.Service;

/**
 * Entry points for configuration changes. Every hook re-derives the affected jobs right away,
 * so a malformed schedule is reported to the caller that saved it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleOrchestrator {

    private final SiteJobRegistry siteJobRegistry;
    private final CategoryJobRegistry categoryJobRegistry;
    private final GlobalJobRegistry globalJobRegistry;
    private final SiteRepository siteRepository;
    private final CategoryRepository categoryRepository;
    private final ScheduleConfigRepository scheduleConfigRepository;
    private final PrecedenceResolver precedenceResolver;

    public void onSiteUpdated(Site site) {
        siteJobRegistry.upsert(site);
    }

    public void onSiteDeleted(String siteId) {
        siteJobRegistry.remove(siteId);
    }

    public void onCategoryUpdated(Category category) {
        categoryJobRegistry.upsert(category);
    }

    public void onCategoryDeleted(String categoryId) {
        categoryJobRegistry.remove(categoryId);
    }

    public void onGlobalConfigUpdated(ScheduleConfig config) {
        globalJobRegistry.reconfigure(config);
    }

    /**
     * Full reconciliation of every site and every category. Used at startup and after bulk imports.
     */
    public void scheduleAll() {
        ScheduleConfig config = currentConfig();
        siteJobRegistry.upsertAll(siteRepository.findAllByOrderByCreatedAtAsc(), config);
        categoryJobRegistry.upsertAll(categoryRepository.findAllByOrderByCreatedAtAsc());
        log.info("Scheduled all jobs: {} site jobs, {} category jobs",
                siteJobRegistry.jobCount(), categoryJobRegistry.jobCount());
    }

    /**
     * Startup: reconciles sites and categories, then installs the global job if a config is stored.
     */
    public void initialize() {
        scheduleAll();

        try {
            ScheduleConfig config = currentConfig();
            if (config != null) {
                globalJobRegistry.reconfigure(config);
                log.info("Global schedule task initialized (enabled: {})", config.isEnabled());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to initialize global schedule task: {}", e.getMessage());
        }
    }

    public void shutdown() {
        globalJobRegistry.stop();
        int sites = siteJobRegistry.stopAll();
        int categories = categoryJobRegistry.stopAll();
        log.info("Scheduler shut down, stopped {} site jobs and {} category jobs", sites, categories);
    }

    public SchedulingTier resolveTier(Site site) {
        Category category = site.getCategoryId() == null
                ? null
                : categoryRepository.findById(site.getCategoryId()).orElse(null);
        return precedenceResolver.resolve(site, category, currentConfig());
    }

    public ScheduleStatus status() {
        return ScheduleStatus.builder()
                .siteJobs(siteJobRegistry.jobKeys())
                .categoryJobs(categoryJobRegistry.jobKeys())
                .globalJobActive(globalJobRegistry.isActive())
                .globalExpression(globalJobRegistry.currentExpression().orElse(null))
                .build();
    }

    private ScheduleConfig currentConfig() {
        return scheduleConfigRepository.findFirstByOrderByCreatedAtAsc().orElse(null);
    }
}
