package org.gc.relaymonitor.domain;

import lombok.Value;

@Value
public class CheckOptions {

    /** When true the checker must not send its own per-site notification. */
    boolean skipNotification;

    boolean manual;

    public static CheckOptions scheduled(boolean skipNotification) {
        return new CheckOptions(skipNotification, false);
    }

    public static CheckOptions manual(boolean skipNotification) {
        return new CheckOptions(skipNotification, true);
    }
}
