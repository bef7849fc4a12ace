package org.gc.relaymonitor.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStatus {

    private Set<String> siteJobs;
    private Set<String> categoryJobs;
    private boolean globalJobActive;
    private String globalExpression;
}
