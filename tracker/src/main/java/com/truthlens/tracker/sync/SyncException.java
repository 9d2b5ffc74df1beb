package com.truthlens.tracker.sync;

/**
 * A call to the Session API failed.
 *
 * A transient failure (offline, server error, throttling, expired token)
 * leaves the record buffered for retry. A permanent failure means the server
 * refused the record itself and resending it cannot succeed.
 */
public class SyncException extends RuntimeException {

    private final boolean permanent;

    public SyncException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public SyncException(String message, Throwable cause, boolean permanent) {
        super(message, cause);
        this.permanent = permanent;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
