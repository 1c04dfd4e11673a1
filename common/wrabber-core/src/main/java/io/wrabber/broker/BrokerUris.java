package io.wrabber.broker;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for broker connection URIs.
 */
public final class BrokerUris {

    private static final Pattern HEARTBEAT_PARAM = Pattern.compile("(?i)[?&]heartbeat=");
    private static final Pattern HEARTBEAT_VALUE = Pattern.compile("(?i)[?&]heartbeat=(\\d+)");

    private BrokerUris() {
    }

    /**
     * Appends {@code heartbeat=<seconds>} to the query string unless the caller already set one.
     */
    public static String withHeartbeat(String uri, int heartbeatSeconds) {
        Objects.requireNonNull(uri, "uri");
        if (HEARTBEAT_PARAM.matcher(uri).find()) {
            return uri;
        }
        String separator = uri.contains("?") ? "&" : "?";
        return uri + separator + "heartbeat=" + heartbeatSeconds;
    }

    /**
     * Heartbeat seconds carried in the query string, or {@code fallback} when absent or not numeric.
     */
    public static int heartbeatSeconds(String uri, int fallback) {
        if (uri == null) {
            return fallback;
        }
        Matcher matcher = HEARTBEAT_VALUE.matcher(uri);
        if (!matcher.find()) {
            return fallback;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    /**
     * Masks the password component for logging.
     */
    public static String redact(String uri) {
        if (uri == null) {
            return null;
        }
        return uri.replaceFirst("(?<=://)([^:/@]*):[^@/]*@", "$1:****@");
    }
}
