package org.gc.relaymonitor.checker;

import org.gc.relaymonitor.domain.CheckOptions;
import org.gc.relaymonitor.domain.Site;
import org.gc.relaymonitor.domain.SiteCheckResult;
import reactor.core.publisher.Mono;

/**
 * Fetches one site, diffs it against its last snapshot and persists the new snapshot.
 * When {@link CheckOptions#isSkipNotification()} is false the checker sends the per-site
 * notification itself.
 */
public interface SiteChecker {

    /**
     * @return the check result, or an error (typically {@link SiteCheckException}) with a readable message
     */
    Mono<SiteCheckResult> check(Site site, CheckOptions options);
}
