package org.gc.relaymonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangedSite {

    private String siteId;
    private String siteName;

    /** Null when the site is only reported for its check-in result. */
    private ModelDiff diff;

    private CheckInResult checkInResult;

    public static ChangedSite from(SiteCheckResult result) {
        return ChangedSite.builder()
                .siteId(result.getSiteId())
                .siteName(result.getSiteName())
                .diff(result.isHasChanges() ? result.getDiff() : null)
                .checkInResult(result.getCheckInResult())
                .build();
    }
}
