package com.easytidal.mirror.scheduler;

/**
 * Thrown when the Tidal API is unreachable, slow, refuses us, or answers
 * with something we can't read.
 *
 * Transport details (HTTP status codes, socket exceptions) are folded into
 * a {@link Kind} so that callers can tell failures apart without depending
 * on java.net.http.
 */
public class SchedulerException extends RuntimeException {

    public enum Kind { CONNECTION, TIMEOUT, AUTH, NOT_FOUND, MALFORMED_RESPONSE }

    private final Kind kind;

    public SchedulerException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public SchedulerException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
