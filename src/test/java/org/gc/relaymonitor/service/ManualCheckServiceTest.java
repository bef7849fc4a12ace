package org.gc.relaymonitor.service;

import org.gc.relaymonitor.checker.SiteCheckException;
import org.gc.relaymonitor.checker.SiteChecker;
import org.gc.relaymonitor.domain.CheckOptions;
import org.gc.relaymonitor.domain.ModelDiff;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.SiteCheckResult;
import org.gc.relaymonitor.properties.RelayMonitorProperties;
import org.gc.relaymonitor.repository.SiteRepository;
import org.gc.relaymonitor.scheduling.BatchRunner;
import org.gc.relaymonitor.scheduling.PrecedenceResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.gc.relaymonitor.support.TestSites.recordingPacer;
import static org.gc.relaymonitor.support.TestSites.site;
import static org.gc.relaymonitor.support.TestSites.unchanged;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ManualCheckServiceTest {

    private SiteRepository siteRepository;
    private SiteChecker siteChecker;
    private List<Duration> waits;
    private ManualCheckService manualCheckService;

    @BeforeEach
    void setUp() {
        siteRepository = mock(SiteRepository.class);
        siteChecker = mock(SiteChecker.class);
        waits = new ArrayList<>();
        manualCheckService = new ManualCheckService(siteRepository, siteChecker, new BatchRunner(recordingPacer(waits)),
                new PrecedenceResolver(), new RelayMonitorProperties());
    }

    @Test
    void checkSiteIsManual() {
        Site site = site("a");
        when(siteRepository.findById("a")).thenReturn(Optional.of(site));
        when(siteChecker.check(site, CheckOptions.manual(true))).thenReturn(Mono.just(unchanged(site)));

        StepVerifier.create(manualCheckService.checkSite("a", true))
                .assertNext(result -> assertThat(result.getSiteId()).isEqualTo("a"))
                .verifyComplete();
    }

    @Test
    void checkUnknownSiteIsNotFound() {
        when(siteRepository.findById("missing")).thenReturn(Optional.empty());

        StepVerifier.create(manualCheckService.checkSite("missing", false))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void checkSitePropagatesCheckerError() {
        Site site = site("a");
        when(siteRepository.findById("a")).thenReturn(Optional.of(site));
        when(siteChecker.check(any(), any())).thenReturn(Mono.error(new SiteCheckException("HTTP 401")));

        StepVerifier.create(manualCheckService.checkSite("a", false))
                .expectErrorMessage("HTTP 401")
                .verify();
    }

    @Test
    void checkAllSkipsExcludedSitesAndNotifications() {
        Site first = site("a");
        Site excluded = site("b");
        excluded.setExcludeFromBatch(true);
        Site pinned = site("c");
        pinned.setPinned(true);
        when(siteRepository.findAllByOrderByCreatedAtAsc()).thenReturn(List.of(first, excluded, pinned));
        when(siteChecker.check(first, CheckOptions.manual(true))).thenReturn(Mono.just(SiteCheckResult.builder()
                .siteId("a").siteName("relay-a").hasChanges(true)
                .diff(ModelDiff.between(List.of("m1"), List.of("m1", "m2")))
                .build()));
        when(siteChecker.check(pinned, CheckOptions.manual(true))).thenReturn(Mono.error(new SiteCheckException("timeout")));

        StepVerifier.create(manualCheckService.checkAllSites())
                .assertNext(outcome -> {
                    assertThat(outcome.getTotalSites()).isEqualTo(2);
                    assertThat(outcome.changedSites()).singleElement()
                            .satisfies(changed -> assertThat(changed.getDiff().getAdded()).containsExactly("m2"));
                    assertThat(outcome.getFailedSites()).extracting("siteId").containsExactly("c");
                })
                .verifyComplete();

        verify(siteChecker, never()).check(excluded, CheckOptions.manual(true));
        assertThat(waits).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void checkCategoryUsesCheckableMembers() {
        Site member = site("a");
        Site pinned = site("b");
        pinned.setPinned(true);
        Site excluded = site("c");
        excluded.setExcludeFromBatch(true);
        when(siteRepository.findByCategoryId("cat")).thenReturn(List.of(member, pinned, excluded));
        when(siteChecker.check(member, CheckOptions.manual(false))).thenReturn(Mono.just(unchanged(member)));

        StepVerifier.create(manualCheckService.checkCategory("cat", false))
                .assertNext(outcome -> {
                    assertThat(outcome.getTotalSites()).isEqualTo(1);
                    assertThat(outcome.getResults()).hasSize(1);
                })
                .verifyComplete();

        assertThat(waits).isEmpty();
    }

    @Test
    void checkCategoryWithoutCheckableMembersFails() {
        Site pinned = site("b");
        pinned.setPinned(true);
        when(siteRepository.findByCategoryId("cat")).thenReturn(List.of(pinned));

        StepVerifier.create(manualCheckService.checkCategory("cat", false))
                .expectErrorMatches(error -> error instanceof NoCheckableSitesException
                        && error.getMessage().equals("No checkable sites in category cat"))
                .verify();

        verify(siteChecker, never()).check(any(), any());
    }
}
