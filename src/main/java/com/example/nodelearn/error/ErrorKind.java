package com.example.nodelearn.error;

/**
 * Error taxonomy shared by every engine failure.
 */
public enum ErrorKind {
    VALIDATION(false),
    STRUCTURAL(false),
    TRANSIENT(true),
    CONCURRENCY(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
