package io.wrabber.runtime;

/**
 * Completes pending readiness waits when the client is stopped before it became ready.
 */
public class ClientStoppedException extends IllegalStateException {

    public ClientStoppedException(String message) {
        super(message);
    }
}
