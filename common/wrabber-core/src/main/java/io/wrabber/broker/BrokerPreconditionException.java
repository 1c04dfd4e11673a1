package io.wrabber.broker;

import java.io.IOException;

/**
 * Raised when the broker rejects a declaration because an object with the same name exists with
 * different properties. The channel the declaration was issued on is closed by the broker.
 */
public class BrokerPreconditionException extends IOException {

    public BrokerPreconditionException(String message, Throwable cause) {
        super(message, cause);
    }

    public BrokerPreconditionException(String message) {
        super(message);
    }
}
