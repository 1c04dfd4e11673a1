package io.wrabber.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.wrabber.WrabberSettings;
import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

    @Test
    void followsDefaultSequenceAndCapsAtLastEntry() {
        ReconnectBackoff backoff = new ReconnectBackoff(WrabberSettings.DEFAULT_RECONNECT_BACKOFF);

        List<Long> delays = IntStream.rangeClosed(1, 9)
            .mapToObj(attempt -> backoff.delayFor(attempt).toMillis())
            .toList();

        assertThat(delays).containsExactly(500L, 1000L, 2000L, 5000L, 10000L, 15000L, 30000L, 30000L, 30000L);
    }

    @Test
    void singleEntryIsAFixedDelay() {
        ReconnectBackoff backoff = new ReconnectBackoff(List.of(Duration.ofMillis(250)));

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(250));
        assertThat(backoff.delayFor(100)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> new ReconnectBackoff(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectBackoff(List.of(Duration.ZERO)).delayFor(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
