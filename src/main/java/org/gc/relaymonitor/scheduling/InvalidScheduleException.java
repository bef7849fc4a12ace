package org.gc.relaymonitor.scheduling;

/**
 * Raised when a schedule expression or timezone cannot be turned into a job.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
