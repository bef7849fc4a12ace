package org.gc.relaymonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedSite {

    private String siteId;
    private String siteName;
    private String errorMessage;
}
