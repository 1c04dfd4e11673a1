package io.wrabber.envelope;

/**
 * A message body that cannot be decoded into an {@link EventEnvelope}.
 */
public class MalformedEnvelopeException extends RuntimeException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
