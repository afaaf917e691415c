package com.depforge.core.process;

/**
 * Unrecoverable failure of the current operation. Aborts the enclosing task.
 */
public class BailOutException extends RuntimeException {

    /**
     * What the failing operation was doing, used to label the failure in logs.
     */
    public enum Reason {
        GENERIC,
        REDOWNLOAD
    }

    private final Reason reason;

    public BailOutException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BailOutException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
