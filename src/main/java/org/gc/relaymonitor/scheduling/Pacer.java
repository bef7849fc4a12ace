package org.gc.relaymonitor.scheduling;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Wait inserted between two consecutive checks of a batch.
 */
@FunctionalInterface
public interface Pacer {

    Mono<Void> waitBetween(Duration interval);

    static Pacer delaying() {
        return interval -> interval.isZero() || interval.isNegative()
                ? Mono.empty()
                : Mono.delay(interval).then();
    }
}
