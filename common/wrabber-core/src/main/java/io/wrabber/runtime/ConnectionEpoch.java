package io.wrabber.runtime;

import io.wrabber.broker.BrokerChannel;
import java.util.Objects;

/**
 * Hand-off of the live channel for one successful connect. A new epoch starts with every reconnect;
 * components must not keep the channel beyond the epoch they received it in.
 */
public record ConnectionEpoch(long id, BrokerChannel channel) {

    public ConnectionEpoch {
        Objects.requireNonNull(channel, "channel");
    }
}
