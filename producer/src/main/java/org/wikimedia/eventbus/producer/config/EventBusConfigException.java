package org.wikimedia.eventbus.producer.config;

/**
 * The EventBus configuration could not be loaded.
 */
public class EventBusConfigException extends RuntimeException {
    public EventBusConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
