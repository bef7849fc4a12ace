package org.gc.relaymonitor.notification;

import lombok.extern.slf4j.Slf4j;
import org.gc.relaymonitor.domain.ChangedSite;
import org.gc.relaymonitor.domain.CheckInResult;
import org.gc.relaymonitor.domain.FailedSite;
import org.gc.relaymonitor.domain.ModelDiff;
import org.gc.relaymonitor.domain.Site;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Writes notifications to the application log. Replace with a delivering bean (mail, chat) in production.
 */
@Slf4j
@Service
public class LoggingNotifier implements Notifier {

    @Override
    public Mono<Void> sendSingle(Site site, ModelDiff diff, CheckInResult checkInResult) {
        return Mono.fromRunnable(() -> log.info("[notification] {}", formatSite(site.getName(), diff, checkInResult)));
    }

    @Override
    public Mono<Void> sendAggregated(List<ChangedSite> changedSites, List<FailedSite> failedSites) {
        return Mono.fromRunnable(() -> log.info("[notification]\n{}", formatAggregate(changedSites, failedSites)));
    }

    String formatAggregate(List<ChangedSite> changedSites, List<FailedSite> failedSites) {
        StringBuilder text = new StringBuilder();
        text.append(changedSites.size()).append(" sites changed, ")
                .append(failedSites.size()).append(" sites failed");

        for (ChangedSite changed : changedSites) {
            text.append("\n  - ").append(formatSite(changed.getSiteName(), changed.getDiff(), changed.getCheckInResult()));
        }
        for (FailedSite failed : failedSites) {
            text.append("\n  ! ").append(failed.getSiteName()).append(": ").append(failed.getErrorMessage());
        }
        return text.toString();
    }

    String formatSite(String siteName, ModelDiff diff, CheckInResult checkInResult) {
        StringBuilder text = new StringBuilder(siteName);
        if (diff != null) {
            text.append(" added ").append(diff.getAdded())
                    .append(" removed ").append(diff.getRemoved());
        }
        if (checkInResult != null) {
            text.append(" check-in ").append(checkInResult.isCheckInSuccess() ? "ok" : "failed");
            if (checkInResult.getCheckInMessage() != null) {
                text.append(" (").append(checkInResult.getCheckInMessage()).append(")");
            }
        }
        return text.toString();
    }
}
