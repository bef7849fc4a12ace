package org.gc.relaymonitor.checker;

public class SiteCheckException extends RuntimeException {

    public SiteCheckException(String message) {
        super(message);
    }

    public SiteCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
