package org.gc.relaymonitor.scheduling;

public enum SchedulingTier {
    GLOBAL_OVERRIDE,
    SITE,
    CATEGORY,
    GLOBAL_DEFAULT,
    UNSCHEDULED
}
