package io.wrabber.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.wrabber.UnhandledMessagePolicy;
import io.wrabber.WrabberSettings;
import io.wrabber.broker.BrokerChannel;
import io.wrabber.broker.BrokerDelivery;
import io.wrabber.envelope.EventEnvelopeCodec;
import io.wrabber.handler.HandlerRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class ConsumerLoopTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    BrokerChannel channel;

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final HandlerRegistry registry = new HandlerRegistry(MAPPER);

    private ConsumerLoop loop(UnhandledMessagePolicy policy) {
        WrabberSettings settings = WrabberSettings.builder()
            .url("amqp://localhost")
            .namespace("Users")
            .serviceName("profile-api")
            .unhandledMessagePolicy(policy)
            .build();
        return new ConsumerLoop(settings, registry, new EventEnvelopeCodec(MAPPER),
            new MessagingMetrics(meters, settings.serviceName()));
    }

    private static BrokerDelivery delivery(long tag, String body) {
        return new BrokerDelivery("ctag-1", tag, false, "", body.getBytes(StandardCharsets.UTF_8));
    }

    private double consumed(String outcome) {
        return meters.get("wrabber.messages.consumed").tag("outcome", outcome).counter().count();
    }

    @Test
    void acknowledgesAfterHandlerCompletes() throws Exception {
        List<JsonNode> received = new ArrayList<>();
        List<String> mdcEvents = new ArrayList<>();
        registry.register("Users.Created", data -> {
            received.add(data);
            mdcEvents.add(MDC.get(ConsumerLoop.MDC_EVENT));
        });

        loop(UnhandledMessagePolicy.ACKNOWLEDGE)
            .dispatch(channel, delivery(7, "{\"event\":\"Users.Created\",\"data\":{\"userId\":\"u-1\"}}"));

        assertThat(received).singleElement().satisfies(data -> assertThat(data.path("userId").asText()).isEqualTo("u-1"));
        assertThat(mdcEvents).containsExactly("Users.Created");
        assertThat(MDC.get(ConsumerLoop.MDC_EVENT)).isNull();
        verify(channel).ack(7);
        verify(channel, never()).nack(anyLong(), anyBoolean());
        assertThat(consumed("acknowledged")).isEqualTo(1.0);
        assertThat(meters.get("wrabber.handler.duration").tag("event", "Users.Created").tag("outcome", "success")
            .timer().count()).isEqualTo(1);
    }

    @Test
    void failingHandlerRejectsWithoutRequeueAndNextMessageStillRuns() throws Exception {
        List<String> seen = new ArrayList<>();
        registry.register("Users.Created", data -> {
            seen.add(data.asText());
            if ("bad".equals(data.asText())) {
                throw new IllegalStateException("cannot process");
            }
        });
        ConsumerLoop loop = loop(UnhandledMessagePolicy.ACKNOWLEDGE);

        loop.dispatch(channel, delivery(1, "{\"event\":\"Users.Created\",\"data\":\"bad\"}"));
        loop.dispatch(channel, delivery(2, "{\"event\":\"Users.Created\",\"data\":\"good\"}"));

        assertThat(seen).containsExactly("bad", "good");
        verify(channel).nack(1, false);
        verify(channel).ack(2);
        assertThat(consumed("rejected")).isEqualTo(1.0);
        assertThat(consumed("acknowledged")).isEqualTo(1.0);
    }

    @Test
    void handlerThrowingAnErrorIsRejectedLikeAnyOtherFailure() throws Exception {
        List<String> seen = new ArrayList<>();
        registry.register("Users.Created", data -> {
            seen.add(data.asText());
            if ("bad".equals(data.asText())) {
                throw new AssertionError("boom");
            }
        });
        registry.registerAsync("Users.Deleted",
            data -> CompletableFuture.failedFuture(new StackOverflowError("deep")));
        ConsumerLoop loop = loop(UnhandledMessagePolicy.ACKNOWLEDGE);

        assertThatCode(() -> loop.dispatch(channel, delivery(1, "{\"event\":\"Users.Created\",\"data\":\"bad\"}")))
            .doesNotThrowAnyException();
        assertThatCode(() -> loop.dispatch(channel, delivery(2, "{\"event\":\"Users.Deleted\",\"data\":{}}")))
            .doesNotThrowAnyException();
        loop.dispatch(channel, delivery(3, "{\"event\":\"Users.Created\",\"data\":\"good\"}"));

        assertThat(seen).containsExactly("bad", "good");
        verify(channel).nack(1, false);
        verify(channel).nack(2, false);
        verify(channel).ack(3);
        assertThat(consumed("rejected")).isEqualTo(2.0);
        assertThat(MDC.get(ConsumerLoop.MDC_EVENT)).isNull();
    }

    @Test
    void unhandledEventIsAcknowledgedByDefault() throws Exception {
        loop(UnhandledMessagePolicy.ACKNOWLEDGE).dispatch(channel, delivery(3, "{\"event\":\"Users.Deleted\",\"data\":{}}"));

        verify(channel).ack(3);
        assertThat(consumed("unhandled-acknowledged")).isEqualTo(1.0);
    }

    @Test
    void unhandledEventIsRejectedWhenConfigured() throws Exception {
        loop(UnhandledMessagePolicy.REJECT).dispatch(channel, delivery(4, "{\"event\":\"Users.Deleted\",\"data\":{}}"));

        verify(channel).nack(4, false);
        verify(channel, never()).ack(anyLong());
        assertThat(consumed("unhandled-rejected")).isEqualTo(1.0);
    }

    @Test
    void malformedBodyIsRejectedWithoutInvokingHandlers() throws Exception {
        List<JsonNode> received = new ArrayList<>();
        registry.register("Users.Created", received::add);
        ConsumerLoop loop = loop(UnhandledMessagePolicy.ACKNOWLEDGE);

        loop.dispatch(channel, delivery(5, "not json"));
        loop.dispatch(channel, delivery(6, "{\"data\":{}}"));

        assertThat(received).isEmpty();
        verify(channel).nack(5, false);
        verify(channel).nack(6, false);
        assertThat(consumed("malformed")).isEqualTo(2.0);
    }

    @Test
    void asyncHandlerIsSettledOnlyAfterItsStageCompletes() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            registry.registerAsync("Users.Created", data -> CompletableFuture.runAsync(() -> sleep(50), executor));
            registry.registerAsync("Users.Deleted", data ->
                CompletableFuture.failedFuture(new IllegalArgumentException("unknown user")));
            ConsumerLoop loop = loop(UnhandledMessagePolicy.ACKNOWLEDGE);

            loop.dispatch(channel, delivery(8, "{\"event\":\"Users.Created\",\"data\":{}}"));
            loop.dispatch(channel, delivery(9, "{\"event\":\"Users.Deleted\",\"data\":{}}"));

            verify(channel).ack(8);
            verify(channel).nack(9, false);
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void interruptedHandlerLeavesMessageUnsettled() throws Exception {
        registry.register("Users.Created", data -> {
            throw new InterruptedException("shutting down");
        });

        loop(UnhandledMessagePolicy.ACKNOWLEDGE).dispatch(channel, delivery(10, "{\"event\":\"Users.Created\"}"));

        assertThat(Thread.interrupted()).isTrue();
        verify(channel, never()).ack(anyLong());
        verify(channel, never()).nack(anyLong(), anyBoolean());
    }

    @Test
    void ackFailureIsLoggedNotThrown() throws Exception {
        registry.register("Users.Created", data -> { });
        doThrow(new IOException("channel closed")).when(channel).ack(11);

        loop(UnhandledMessagePolicy.ACKNOWLEDGE).dispatch(channel, delivery(11, "{\"event\":\"Users.Created\"}"));

        verify(channel).ack(11);
    }

    @Test
    void listenSubscribesToPrimaryQueueAndDispatchesDeliveries() throws Exception {
        List<JsonNode> received = new ArrayList<>();
        registry.register("Users.Created", received::add);
        ArgumentCaptor<BrokerChannel.DeliveryCallback> callback = ArgumentCaptor.forClass(BrokerChannel.DeliveryCallback.class);
        when(channel.consume(eq("Users.profile-api"), callback.capture())).thenReturn("ctag-1");
        ConsumerLoop loop = loop(UnhandledMessagePolicy.ACKNOWLEDGE);

        loop.listen(channel);
        callback.getValue().onDelivery(delivery(12, "{\"event\":\"Users.Created\",\"data\":1}"));
        loop.cancel();

        assertThat(received).hasSize(1);
        verify(channel).ack(12);
        verify(channel).cancel("ctag-1");
    }

    @Test
    void relistenOnSameChannelCancelsPreviousSubscription() throws Exception {
        when(channel.consume(eq("Users.profile-api"), any())).thenReturn("ctag-1", "ctag-2");
        ConsumerLoop loop = loop(UnhandledMessagePolicy.ACKNOWLEDGE);

        loop.listen(channel);
        loop.listen(channel);

        verify(channel).cancel("ctag-1");
        verify(channel, never()).cancel("ctag-2");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
