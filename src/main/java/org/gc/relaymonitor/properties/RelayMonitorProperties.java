package org.gc.relaymonitor.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "relay-monitor")
public class RelayMonitorProperties {

    private Scheduler scheduler = new Scheduler();
    private GlobalDefaults globalDefaults = new GlobalDefaults();
    private Checker checker = new Checker();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private int poolSize = 4;
        private int categoryIntervalSeconds = 5;
        private int manualIntervalSeconds = 5;
        private String defaultTimezone = "UTC";
    }

    /**
     * Values used when the global schedule record is created on first read.
     */
    @Data
    public static class GlobalDefaults {
        private int hour = 9;
        private int minute = 0;
        private int interval = 30;
        private String timezone = "Asia/Shanghai";
    }

    @Data
    public static class Checker {
        private String modelsPath = "/v1/models";
        private int timeoutSeconds = 30;
    }
}
