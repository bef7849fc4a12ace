package org.gc.relaymonitor.scheduling;

import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Conversions between the stored 5-field schedule form ("minute hour day month weekday")
 * and Spring's 6-field cron expressions.
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    /**
     * Daily schedule at a fixed hour and minute, in stored form.
     */
    public static String daily(int hour, int minute) {
        return minute + " " + hour + " * * *";
    }

    /**
     * Parses a stored expression. A 6-field expression is taken as already carrying seconds.
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new InvalidScheduleException("Schedule expression is empty");
        }

        String[] fields = expression.trim().split("\\s+");
        String springExpression = switch (fields.length) {
            case 5 -> "0 " + String.join(" ", fields);
            case 6 -> String.join(" ", fields);
            default -> throw new InvalidScheduleException(
                    "Schedule expression must have 5 fields (minute hour day month weekday): " + expression);
        };

        try {
            return CronExpression.parse(springExpression);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid schedule expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    public static ZoneId zone(String timezone, String fallback) {
        String id = timezone == null || timezone.trim().isEmpty() ? fallback : timezone.trim();
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone: " + id, e);
        }
    }
}
