package io.wrabber.spring;

import io.wrabber.Wrabber;

/**
 * Callback for beans that register event handlers. All configurers are applied before the client
 * starts consuming.
 */
@FunctionalInterface
public interface WrabberHandlerConfigurer {

    void registerHandlers(Wrabber wrabber);
}
