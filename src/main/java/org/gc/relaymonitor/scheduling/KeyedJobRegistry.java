package org.gc.relaymonitor.scheduling;

import org.springframework.scheduling.TaskScheduler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns at most one live {@link TimeTrigger} per key. Installing a trigger for a key stops the
 * previous one first. Subclasses synchronize on the registry, as the helpers here do.
 */
public abstract class KeyedJobRegistry {

    protected final TaskScheduler taskScheduler;

    private final Map<String, TimeTrigger> jobs = new HashMap<>();
    private final Map<String, AtomicBoolean> inFlightByKey = new HashMap<>();

    protected KeyedJobRegistry(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /**
     * In-flight flag of a job key. Kept after the job is removed, so a firing still running for
     * a removed or replaced job blocks the next trigger installed under the same key.
     */
    protected synchronized AtomicBoolean inFlightFlag(String key) {
        return inFlightByKey.computeIfAbsent(key, k -> new AtomicBoolean(false));
    }

    protected synchronized boolean stopJob(String key) {
        TimeTrigger existing = jobs.remove(key);
        if (existing == null) {
            return false;
        }
        existing.stop();
        return true;
    }

    protected synchronized void installJob(String key, TimeTrigger trigger) {
        stopJob(key);
        trigger.start();
        jobs.put(key, trigger);
    }

    /**
     * Stops every job and returns how many were removed.
     */
    public synchronized int stopAll() {
        int count = jobs.size();
        jobs.values().forEach(TimeTrigger::stop);
        jobs.clear();
        return count;
    }

    public synchronized boolean hasJob(String key) {
        return jobs.containsKey(key);
    }

    public synchronized int jobCount() {
        return jobs.size();
    }

    public synchronized Set<String> jobKeys() {
        return Set.copyOf(jobs.keySet());
    }

    public synchronized Optional<String> expressionOf(String key) {
        return Optional.ofNullable(jobs.get(key)).map(TimeTrigger::getExpression);
    }
}
