package io.wrabber.handler;

/**
 * Handler receiving the event payload converted to {@code T}.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface TypedEventHandler<T> {

    void handle(T data) throws Exception;
}
