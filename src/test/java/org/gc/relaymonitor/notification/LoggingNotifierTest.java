package org.gc.relaymonitor.notification;

import org.gc.relaymonitor.domain.ChangedSite;
import org.gc.relaymonitor.domain.CheckInResult;
import org.gc.relaymonitor.domain.FailedSite;
import org.gc.relaymonitor.domain.ModelDiff;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.gc.relaymonitor.support.TestSites.site;

class LoggingNotifierTest {

    private final LoggingNotifier notifier = new LoggingNotifier();

    @Test
    void aggregateListsChangesAndFailures() {
        ChangedSite changed = ChangedSite.builder()
                .siteId("a")
                .siteName("relay-a")
                .diff(ModelDiff.between(List.of("m1"), List.of("m2")))
                .build();
        ChangedSite checkedIn = ChangedSite.builder()
                .siteId("b")
                .siteName("relay-b")
                .checkInResult(CheckInResult.builder().checkInSuccess(false).checkInMessage("already checked in").build())
                .build();
        FailedSite failed = FailedSite.builder().siteId("c").siteName("relay-c").errorMessage("HTTP 503").build();

        String text = notifier.formatAggregate(List.of(changed, checkedIn), List.of(failed));

        assertThat(text).startsWith("2 sites changed, 1 sites failed");
        assertThat(text).contains("relay-a added [m2] removed [m1]");
        assertThat(text).contains("relay-b check-in failed (already checked in)");
        assertThat(text).contains("relay-c: HTTP 503");
    }

    @Test
    void sendCompletes() {
        StepVerifier.create(notifier.sendSingle(site("a"), ModelDiff.between(List.of(), List.of("m1")), null))
                .verifyComplete();
        StepVerifier.create(notifier.sendAggregated(List.of(), List.of()))
                .verifyComplete();
    }
}
