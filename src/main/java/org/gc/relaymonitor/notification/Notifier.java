package org.gc.relaymonitor.notification;

import org.gc.relaymonitor.domain.ChangedSite;
import org.gc.relaymonitor.domain.CheckInResult;
import org.gc.relaymonitor.domain.FailedSite;
import org.gc.relaymonitor.domain.ModelDiff;
import org.gc.relaymonitor.domain.Site;
import reactor.core.publisher.Mono;

import java.util.List;

public interface Notifier {

    /**
     * Notification for a single site, sent by the checker when the caller did not ask to skip it.
     */
    Mono<Void> sendSingle(Site site, ModelDiff diff, CheckInResult checkInResult);

    /**
     * One notification covering a whole batch.
     */
    Mono<Void> sendAggregated(List<ChangedSite> changedSites, List<FailedSite> failedSites);
}
