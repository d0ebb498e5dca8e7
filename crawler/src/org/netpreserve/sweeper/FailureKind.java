package org.netpreserve.sweeper;

/**
 * Why a target crawl failed.
 */
public enum FailureKind {
    /**
     * The account is gone or private. Retrying won't help.
     */
    TARGET_NOT_FOUND(false),
    NAVIGATION_FAILURE(true),
    NAVIGATION_TIMEOUT(true),
    /**
     * The browser went away or was logged out.
     */
    SESSION_LOST(true),
    DEADLINE_EXCEEDED(true),
    INTERRUPTED(true),
    PERSISTENCE_FAILURE(true),
    /**
     * An error with no more specific kind. Logged with its stack trace.
     */
    UNEXPECTED(true);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
