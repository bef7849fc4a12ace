package org.gc.relaymonitor.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.checker.SiteChecker;
import org.gc.relaymonitor.domain.BatchOutcome;
import org.gc.relaymonitor.domain.CheckOptions;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.SiteCheckResult;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.SiteRepository;
import org.gc.relaymonitor.scheduling.BatchRunner;
import org.gc.relaymonitor.scheduling.PrecedenceResolver;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Checks started by an operator. Unlike scheduled batches these honor {@code excludeFromBatch}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualCheckService {

    private final SiteRepository siteRepository;
    private final SiteChecker siteChecker;
    private final BatchRunner batchRunner;
    private final PrecedenceResolver precedenceResolver;
    private final RelayMonitorProperties properties;

    public Mono<SiteCheckResult> checkSite(String siteId, boolean skipNotification) {
        log.info("Manual check requested for site {}", siteId);

        return Mono.fromCallable(() -> siteRepository.findById(siteId))
                .flatMap(site -> site
                        .map(found -> siteChecker.check(found, CheckOptions.manual(skipNotification)))
                        .orElseGet(() -> Mono.error(new NotFoundException("Site not found: " + siteId))));
    }

    /**
     * Checks every site not excluded from batch runs, without per-site notifications.
     */
    public Mono<BatchOutcome> checkAllSites() {
        return Mono.fromCallable(() -> precedenceResolver.manualCandidates(siteRepository.findAllByOrderByCreatedAtAsc()))
                .flatMap(sites -> {
                    log.info("Manual check of all sites: {} sites", sites.size());
                    return runManualBatch(sites, true);
                });
    }

    /**
     * Checks the category's members that are neither pinned nor excluded from batch runs.
     */
    public Mono<BatchOutcome> checkCategory(String categoryId, boolean skipNotification) {
        return Mono.fromCallable(() -> precedenceResolver.manualCategoryCandidates(siteRepository.findByCategoryId(categoryId)))
                .flatMap(sites -> {
                    if (sites.isEmpty()) {
                        return Mono.error(new NoCheckableSitesException(categoryId));
                    }
                    log.info("Manual check of category {}: {} sites", categoryId, sites.size());
                    return runManualBatch(sites, skipNotification);
                });
    }

    private Mono<BatchOutcome> runManualBatch(List<Site> sites, boolean skipNotification) {
        Duration interval = Duration.ofSeconds(properties.getScheduler().getManualIntervalSeconds());
        return batchRunner.run(sites, interval, site -> siteChecker.check(site, CheckOptions.manual(skipNotification)))
                .doOnSuccess(outcome -> log.info("Manual batch completed: {} sites, {} changed, {} failed",
                        outcome.getTotalSites(), outcome.changedSites().size(), outcome.getFailedSites().size()));
    }
}
