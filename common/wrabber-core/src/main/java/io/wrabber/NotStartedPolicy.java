package io.wrabber;

/**
 * Behaviour of {@code publish} when the client has not been started or has been stopped.
 */
public enum NotStartedPolicy {
    /** Log a warning and drop the event. */
    DROP,
    /** Throw {@link IllegalStateException} to the caller. */
    FAIL
}
