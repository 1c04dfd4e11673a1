package io.wrabber;

public enum ClientMode {
    /** Talks to a real broker. */
    LIVE,
    /** Local development mode: publishes are only logged and no network resource is touched. */
    SIMULATED
}
