package org.gc.relaymonitor.scheduling;

import org.gc.relaymonitor.checker.SiteCheckException;
import org.gc.relaymonitor.domain.BatchOutcome;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.SiteCheckResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.gc.relaymonitor.support.TestSites.recordingPacer;
import static org.gc.relaymonitor.support.TestSites.site;
import static org.gc.relaymonitor.support.TestSites.unchanged;

class BatchRunnerTest {

    private List<Duration> waits;
    private BatchRunner batchRunner;

    @BeforeEach
    void setUp() {
        waits = new ArrayList<>();
        batchRunner = new BatchRunner(recordingPacer(waits));
    }

    @Test
    void emptyBatchReturnsEmptyOutcomeWithoutWaiting() {
        StepVerifier.create(batchRunner.run(List.of(), Duration.ofSeconds(5), site -> Mono.error(new AssertionError())))
                .assertNext(outcome -> {
                    assertThat(outcome.getResults()).isEmpty();
                    assertThat(outcome.getFailedSites()).isEmpty();
                    assertThat(outcome.getTotalSites()).isZero();
                })
                .verifyComplete();

        assertThat(waits).isEmpty();
    }

    @Test
    void checksInOrderAndWaitsOnlyBetweenSites() {
        List<Site> sites = List.of(site("a"), site("b"), site("c"));
        List<String> checked = new ArrayList<>();

        BatchOutcome outcome = batchRunner.run(sites, Duration.ofSeconds(10), site -> {
            checked.add(site.getId());
            return Mono.just(unchanged(site));
        }).block();

        assertThat(checked).containsExactly("a", "b", "c");
        assertThat(waits).containsExactly(Duration.ofSeconds(10), Duration.ofSeconds(10));
        assertThat(outcome.getResults()).extracting(SiteCheckResult::getSiteId).containsExactly("a", "b", "c");
        assertThat(outcome.getTotalSites()).isEqualTo(3);
    }

    @Test
    void failingCheckIsRecordedAndBatchContinues() {
        List<Site> sites = List.of(site("a"), site("b"), site("c"));

        BatchOutcome outcome = batchRunner.run(sites, Duration.ofSeconds(1), site -> {
            if (site.getId().equals("b")) {
                return Mono.error(new SiteCheckException("HTTP 502 from relay"));
            }
            return Mono.just(unchanged(site));
        }).block();

        assertThat(outcome.getResults()).extracting(SiteCheckResult::getSiteId).containsExactly("a", "c");
        assertThat(outcome.getFailedSites()).singleElement().satisfies(failed -> {
            assertThat(failed.getSiteId()).isEqualTo("b");
            assertThat(failed.getSiteName()).isEqualTo("relay-b");
            assertThat(failed.getErrorMessage()).isEqualTo("HTTP 502 from relay");
        });
        assertThat(outcome.getTotalSites()).isEqualTo(3);
    }

    @Test
    void checkThrowingBeforeSubscriptionIsIsolated() {
        BatchOutcome outcome = batchRunner.run(List.of(site("a"), site("b")), Duration.ZERO, site -> {
            if (site.getId().equals("a")) {
                throw new IllegalStateException("boom");
            }
            return Mono.just(unchanged(site));
        }).block();

        assertThat(outcome.getFailedSites()).extracting("errorMessage").containsExactly("boom");
        assertThat(outcome.getResults()).hasSize(1);
    }

    @Test
    void emptyCheckResultCountsAsFailure() {
        BatchOutcome outcome = batchRunner.run(List.of(site("a")), Duration.ZERO, site -> Mono.empty()).block();

        assertThat(outcome.getFailedSites()).extracting("errorMessage").containsExactly("Check returned no result");
    }

    @Test
    void delayingPacerWaitsTheInterval() {
        StepVerifier.withVirtualTime(() -> Pacer.delaying().waitBetween(Duration.ofSeconds(5)))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(4))
                .thenAwait(Duration.ofSeconds(1))
                .verifyComplete();
    }

    @Test
    void delayingPacerSkipsZeroInterval() {
        StepVerifier.create(Pacer.delaying().waitBetween(Duration.ZERO))
                .verifyComplete();
    }
}
