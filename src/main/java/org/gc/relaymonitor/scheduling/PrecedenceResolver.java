package org.gc.relaymonitor.scheduling;

import org.gc.relaymonitor.domain.Category;
import org.gc.relaymonitor.domain.ScheduleConfig;
import org.gc.relaymonitor.domain.Site;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which tier governs a site and which sites each kind of batch picks up.
 * <p>
 * Category schedules are additive: a category member without its own schedule is also a
 * candidate of the global default batch.
 */
@Component
public class PrecedenceResolver {

    public boolean individualSchedulesSuppressed(ScheduleConfig config) {
        return config != null && config.overridesIndividualSchedules();
    }

    /**
     * The primary scheduling authority for a site.
     *
     * @param category the site's category, or null
     * @param config   the global config, or null when none exists yet
     */
    public SchedulingTier resolve(Site site, Category category, ScheduleConfig config) {
        if (individualSchedulesSuppressed(config)) {
            return SchedulingTier.GLOBAL_OVERRIDE;
        }
        if (site.hasOwnSchedule()) {
            return SchedulingTier.SITE;
        }
        if (category != null && category.hasOwnSchedule() && !site.isPinned()) {
            return SchedulingTier.CATEGORY;
        }
        if (config != null && config.isEnabled()) {
            return SchedulingTier.GLOBAL_DEFAULT;
        }
        return SchedulingTier.UNSCHEDULED;
    }

    /**
     * Sites checked by a global firing. {@code excludeFromBatch} does not apply here.
     */
    public List<Site> globalCandidates(ScheduleConfig config, List<Site> sites) {
        if (config.isOverrideIndividual()) {
            return List.copyOf(sites);
        }
        return sites.stream()
                .filter(site -> !site.hasOwnSchedule())
                .toList();
    }

    /**
     * Sites checked by a scheduled category firing. {@code excludeFromBatch} does not apply here.
     */
    public List<Site> categoryCandidates(List<Site> members) {
        return members.stream()
                .filter(site -> !site.isPinned())
                .toList();
    }

    public List<Site> manualCandidates(List<Site> sites) {
        return sites.stream()
                .filter(site -> !site.isExcludeFromBatch())
                .toList();
    }

    public List<Site> manualCategoryCandidates(List<Site> members) {
        return members.stream()
                .filter(site -> !site.isPinned() && !site.isExcludeFromBatch())
                .toList();
    }
}
