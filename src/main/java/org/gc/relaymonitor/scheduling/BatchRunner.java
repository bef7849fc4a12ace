package org.gc.relaymonitor.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.domain.BatchOutcome;
import org.gc.relaymonitor.domain.FailedSite;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.SiteCheckResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs site checks one after another, pausing between them so a relay is never hit with a burst of requests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchRunner {

    private final Pacer pacer;

    /**
     * Checks every site in input order. A failing check is recorded and the batch moves on.
     *
     * @param interval pause between two consecutive checks, never applied after the last one
     */
    public Mono<BatchOutcome> run(List<Site> sites, Duration interval, Function<Site, Mono<SiteCheckResult>> check) {
        if (sites.isEmpty()) {
            return Mono.just(BatchOutcome.empty());
        }

        int total = sites.size();
        return Flux.range(0, total)
                .concatMap(index -> {
                    Mono<Void> pause = index == 0 ? Mono.empty() : pacer.waitBetween(interval);
                    return pause.then(checkOne(sites.get(index), index, total, check));
                })
                .collectList()
                .map(items -> toOutcome(items, total));
    }

    private Mono<ItemOutcome> checkOne(Site site, int index, int total, Function<Site, Mono<SiteCheckResult>> check) {
        return Mono.defer(() -> {
                    log.info("Checking site {}/{}: {} ({})", index + 1, total, site.getName(), site.getId());
                    return check.apply(site);
                })
                .map(result -> ItemOutcome.success(site, result))
                .switchIfEmpty(Mono.fromSupplier(() -> ItemOutcome.failure(site, "Check returned no result")))
                .onErrorResume(error -> {
                    log.error("Site check failed for {} ({}): {}", site.getName(), site.getId(), error.getMessage());
                    return Mono.just(ItemOutcome.failure(site, messageOf(error)));
                });
    }

    private BatchOutcome toOutcome(List<ItemOutcome> items, int total) {
        List<SiteCheckResult> results = new ArrayList<>();
        List<FailedSite> failures = new ArrayList<>();

        for (ItemOutcome item : items) {
            if (item.result != null) {
                results.add(item.result);
            } else {
                failures.add(FailedSite.builder()
                        .siteId(item.site.getId())
                        .siteName(item.site.getName())
                        .errorMessage(item.errorMessage)
                        .build());
            }
        }

        return BatchOutcome.builder()
                .results(results)
                .failedSites(failures)
                .totalSites(total)
                .build();
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static final class ItemOutcome {
        private final Site site;
        private final SiteCheckResult result;
        private final String errorMessage;

        private ItemOutcome(Site site, SiteCheckResult result, String errorMessage) {
            this.site = site;
            this.result = result;
            this.errorMessage = errorMessage;
        }

        static ItemOutcome success(Site site, SiteCheckResult result) {
            return new ItemOutcome(site, result, null);
        }

        static ItemOutcome failure(Site site, String errorMessage) {
            return new ItemOutcome(site, null, errorMessage);
        }
    }
}
