package com.purchasingpower.remediation.exception;

import lombok.Getter;

/**
 * The code generator could not produce usable output.
 *
 * <p>Always an infrastructure failure: the remediation loop ends the request instead of
 * retrying.
 */
@Getter
public class GenerationException extends RuntimeException {

    public enum Reason {
        /** Connection refused, DNS failure or a non-2xx answer. */
        UNAVAILABLE,
        TIMEOUT,
        /** The body could not be read as a chat completion. */
        INVALID_RESPONSE,
        /** The generator answered with nothing but whitespace. */
        EMPTY_RESPONSE,
        CANCELLED
    }

    private final Reason reason;

    public GenerationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
