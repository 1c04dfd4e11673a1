package io.wrabber;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.JsonNode;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.GetResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class WrabberRabbitMqContainerTest {

    @Container
    static final RabbitMQContainer RABBIT = new RabbitMQContainer("rabbitmq:3.13.1-management");

    private final List<Wrabber> clients = new ArrayList<>();

    @AfterEach
    void closeClients() {
        clients.forEach(Wrabber::close);
    }

    private Wrabber client(WrabberSettings settings) {
        Wrabber client = Wrabber.builder(settings).build();
        clients.add(client);
        return client;
    }

    private static WrabberSettings.Builder settings(String namespace, String serviceName) {
        return WrabberSettings.builder()
            .url(RABBIT.getAmqpUrl())
            .namespace(namespace)
            .serviceName(serviceName)
            .reconnectBackoff(List.of(Duration.ofMillis(200)));
    }

    @Test
    void roundTripsEventsThroughRealBroker() throws Exception {
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        Wrabber consumer = client(settings("Orders", "fulfilment").build());
        consumer.on("Orders.Placed", received::add);
        consumer.start();
        Wrabber producer = client(settings("Orders", "storefront").listening(false).build());
        producer.start();
        assertThat(consumer.awaitReady(Duration.ofSeconds(30))).isTrue();
        assertThat(producer.awaitReady(Duration.ofSeconds(30))).isTrue();

        assertThat(producer.publish("Orders.Placed", Map.of("orderId", "o-1", "total", 42))).isTrue();

        await().atMost(10, TimeUnit.SECONDS).until(() -> received.size() == 1);
        assertThat(received.get(0).path("orderId").asText()).isEqualTo("o-1");
        assertThat(received.get(0).path("total").asInt()).isEqualTo(42);
    }

    @Test
    void replacesQueueDeclaredWithoutDeadLettering() throws Exception {
        Wrabber legacy = client(settings("Payments", "ledger").build());
        legacy.start();
        assertThat(legacy.awaitReady(Duration.ofSeconds(30))).isTrue();
        legacy.close();

        Wrabber upgraded = client(settings("Payments", "ledger")
            .deadLetter(DeadLetterSettings.active())
            .unhandledMessagePolicy(UnhandledMessagePolicy.REJECT)
            .build());
        upgraded.start();
        assertThat(upgraded.awaitReady(Duration.ofSeconds(30))).isTrue();

        upgraded.publish("Payments.Refunded", Map.of("paymentId", "p-1"));

        try (Connection connection = rawConnection(); Channel channel = connection.createChannel()) {
            await().atMost(10, TimeUnit.SECONDS).until(() -> channel.messageCount("Payments.ledger.dlq") == 1);
            GetResponse deadLettered = channel.basicGet("Payments.ledger.dlq", true);
            assertThat(deadLettered.getProps().getType()).isEqualTo("Payments.Refunded");
            assertThat(deadLettered.getProps().getContentType()).isEqualTo("application/json");
            assertThat(channel.messageCount("Payments.ledger")).isZero();
        }
    }

    @Test
    void recoversAfterConnectionIsForceClosed() throws Exception {
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        Wrabber client = client(settings("Inventory", "restock").connectionName("inventory-restock-test").build());
        client.on("Inventory.LowStock", received::add);
        client.start();
        assertThat(client.awaitReady(Duration.ofSeconds(30))).isTrue();

        RABBIT.execInContainer("rabbitmqctl", "close_all_connections", "test");
        await().atMost(20, TimeUnit.SECONDS).until(() -> client.publish("Inventory.LowStock", Map.of("sku", "s-1")));

        await().atMost(20, TimeUnit.SECONDS).until(() -> !received.isEmpty());
        assertThat(received.get(0).path("sku").asText()).isEqualTo("s-1");
    }

    private static Connection rawConnection() throws Exception {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setUri(RABBIT.getAmqpUrl());
        factory.setUsername(RABBIT.getAdminUsername());
        factory.setPassword(RABBIT.getAdminPassword());
        return factory.newConnection("wrabber-test-inspector");
    }
}
