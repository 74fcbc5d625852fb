package com.purchasingpower.remediation.exception;

import lombok.Getter;

/**
 * The scanner could not deliver a verdict for the submitted code.
 *
 * <p>Distinct from a scan that reports findings; those are returned, not thrown.
 */
@Getter
public class ScanException extends RuntimeException {

    public enum Reason {
        /** Binary missing, not executable, or the process could not be started. */
        UNAVAILABLE,
        TIMEOUT,
        /** The scanner exited with a non-zero status. */
        CRASHED,
        /** The report file is not valid JSON. */
        UNPARSEABLE,
        CANCELLED
    }

    private final Reason reason;

    public ScanException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ScanException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
