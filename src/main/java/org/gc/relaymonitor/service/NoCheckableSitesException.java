package org.gc.relaymonitor.service;

/**
 * A manual category check found no member that is neither pinned nor excluded from batch runs.
 */
public class NoCheckableSitesException extends RuntimeException {

    public NoCheckableSitesException(String categoryId) {
        super("No checkable sites in category " + categoryId);
    }
}
