package org.gc.relaymonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SiteCheckResult {

    private String siteId;
    private String siteName;
    private boolean hasChanges;
    private ModelDiff diff;
    private CheckInResult checkInResult;
}
