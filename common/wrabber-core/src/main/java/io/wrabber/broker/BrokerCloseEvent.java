package io.wrabber.broker;

/**
 * Describes why a connection or channel closed.
 *
 * @param initiatedByApplication {@code true} when this client closed the resource itself
 * @param replyCode              protocol reply code, {@code 0} when unknown
 * @param reason                 human readable reason
 * @param cause                  underlying failure, may be {@code null}
 */
public record BrokerCloseEvent(boolean initiatedByApplication, int replyCode, String reason, Throwable cause) {

    public static BrokerCloseEvent unexpected(String reason, Throwable cause) {
        return new BrokerCloseEvent(false, 0, reason, cause);
    }

    public static BrokerCloseEvent byApplication() {
        return new BrokerCloseEvent(true, 200, "closed by application", null);
    }
}
