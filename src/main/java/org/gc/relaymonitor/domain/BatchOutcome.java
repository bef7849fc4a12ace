package org.gc.relaymonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of one paced batch run. Built per run and handed to the caller or the notifier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchOutcome {

    @Builder.Default
    private List<SiteCheckResult> results = new ArrayList<>();

    @Builder.Default
    private List<FailedSite> failedSites = new ArrayList<>();

    private int totalSites;

    public static BatchOutcome empty() {
        return BatchOutcome.builder().totalSites(0).build();
    }

    /**
     * Sites whose model list changed.
     */
    public List<ChangedSite> changedSites() {
        return results.stream()
                .filter(result -> result.isHasChanges() && result.getDiff() != null)
                .map(ChangedSite::from)
                .toList();
    }

    /**
     * Sites worth an aggregated notification: a model diff or a check-in result.
     */
    public List<ChangedSite> notifiableSites() {
        return results.stream()
                .filter(result -> result.isHasChanges() || result.getCheckInResult() != null)
                .map(ChangedSite::from)
                .toList();
    }

    public boolean hasFailures() {
        return !failedSites.isEmpty();
    }
}
