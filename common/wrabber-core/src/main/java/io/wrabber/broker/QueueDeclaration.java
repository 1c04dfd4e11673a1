package io.wrabber.broker;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Queue definition asserted on the broker. Two declarations of the same queue conflict when any
 * flag or argument differs.
 */
public record QueueDeclaration(String name,
                               boolean durable,
                               boolean exclusive,
                               boolean autoDelete,
                               Map<String, Object> arguments) {

    public QueueDeclaration {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private boolean durable = true;
        private boolean exclusive;
        private boolean autoDelete;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder durable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder autoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
            return this;
        }

        public Builder argument(String key, Object value) {
            if (value != null) {
                arguments.put(key, value);
            }
            return this;
        }

        public QueueDeclaration build() {
            return new QueueDeclaration(name, durable, exclusive, autoDelete, arguments);
        }
    }
}
