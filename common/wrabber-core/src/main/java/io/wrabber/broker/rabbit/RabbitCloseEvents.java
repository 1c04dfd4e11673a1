package io.wrabber.broker.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import io.wrabber.broker.BrokerCloseEvent;

final class RabbitCloseEvents {

    private RabbitCloseEvents() {
    }

    static BrokerCloseEvent from(ShutdownSignalException signal) {
        if (signal == null) {
            return BrokerCloseEvent.unexpected("closed without shutdown signal", null);
        }
        return new BrokerCloseEvent(
            signal.isInitiatedByApplication(),
            replyCode(signal.getReason()),
            signal.getMessage(),
            signal.getCause() != null ? signal.getCause() : signal);
    }

    static int replyCode(Method reason) {
        if (reason instanceof AMQP.Channel.Close close) {
            return close.getReplyCode();
        }
        if (reason instanceof AMQP.Connection.Close close) {
            return close.getReplyCode();
        }
        return 0;
    }
}
