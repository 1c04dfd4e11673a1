package io.wrabber.envelope;

import java.util.regex.Pattern;

/**
 * Rules for namespace-qualified event names such as {@code Users.ProfileUpdated}.
 */
public final class EventNames {

    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)+");

    private EventNames() {
    }

    public static boolean isValid(String event) {
        return event != null && QUALIFIED.matcher(event).matches();
    }

    public static String requireValid(String event) {
        if (!isValid(event)) {
            throw new IllegalArgumentException(
                "event must be a dotted '<namespace>.<eventName>' name (was '" + event + "')");
        }
        return event;
    }

    public static String qualify(String namespace, String eventName) {
        return requireValid(namespace + "." + eventName);
    }
}
