package com.healthecon.common.constants;

/**
 * Classification of reasoning service failures.
 * Transient kinds are retried by the client adapter, all others fail the query immediately.
 */
public enum ErrorKind {
    TIMEOUT(true),
    RATE_LIMITED(true),
    SERVER_ERROR(true),
    NETWORK_ERROR(true),
    MALFORMED_REQUEST(false),
    AUTHENTICATION(false),
    CONTENT_POLICY(false),
    INVALID_RESPONSE(false),
    // transient failures that outlived the attempt budget
    RETRIES_EXHAUSTED(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
