package org.gc.relaymonitor.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A stoppable cron job: fires its callback at every matching wall-clock instant in the given zone.
 * Triggers sharing an in-flight flag never overlap; a firing that comes due while another one holding
 * the flag is still running is skipped. Registries hand every trigger of one job key the same flag,
 * so a replaced trigger's last firing also blocks its successor.
 */
@Slf4j
public class TimeTrigger {

    private final String name;
    private final String expression;
    private final TaskScheduler taskScheduler;
    private final Runnable callback;
    private final CronTrigger cronTrigger;
    private final AtomicBoolean inFlight;

    private ScheduledFuture<?> future;

    /**
     * @throws InvalidScheduleException if the expression cannot be parsed
     */
    public TimeTrigger(String name, String expression, ZoneId zone, TaskScheduler taskScheduler, Runnable callback) {
        this(name, expression, zone, taskScheduler, new AtomicBoolean(false), callback);
    }

    /**
     * @param inFlight flag shared by every trigger of the same job key
     * @throws InvalidScheduleException if the expression cannot be parsed
     */
    public TimeTrigger(String name, String expression, ZoneId zone, TaskScheduler taskScheduler,
                       AtomicBoolean inFlight, Runnable callback) {
        CronExpression parsed = CronExpressions.parse(expression);
        this.name = name;
        this.expression = expression;
        this.taskScheduler = taskScheduler;
        this.inFlight = inFlight;
        this.callback = callback;
        this.cronTrigger = new CronTrigger(parsed.toString(), zone);
    }

    public synchronized void start() {
        if (future != null) {
            return;
        }
        future = taskScheduler.schedule(this::fire, cronTrigger);
        if (future == null) {
            throw new IllegalStateException("Task scheduler rejected job " + name);
        }
    }

    /**
     * Cancels upcoming firings. A firing already in progress runs to completion.
     */
    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
    }

    public synchronized boolean isRunning() {
        return future != null;
    }

    public String getExpression() {
        return expression;
    }

    void fire() {
        if (!inFlight.compareAndSet(false, true)) {
            log.warn("Skipping firing of {}: previous run is still in progress", name);
            return;
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Scheduled job {} failed: {}", name, e.getMessage(), e);
        } finally {
            inFlight.set(false);
        }
    }
}
