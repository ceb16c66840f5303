package org.wikimedia.eventbus.producer.adapters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.BinaryValues;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.producer.DeferredUpdates;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventBusSendUpdate;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;

/**
 * Sends log entries as events.
 *
 * The event is the first {@link Map} argument of the log entry, for example
 * {@code log.info("page viewed", event)}. Entries without one are ignored. A
 * {@code private} key is dropped and binary values are encoded. Events are
 * queued in the deferred updates of the current request.
 */
public class EventBusAppender extends AppenderBase<ILoggingEvent> {
    public static final String PRIVATE_FIELD = "private";

    private final EventBusFactory eventBusFactory;
    private final String eventServiceName;
    private final Supplier<DeferredUpdates> deferredUpdates;

    /**
     * @param deferredUpdates pending updates of the request being handled
     */
    public EventBusAppender(EventBusFactory eventBusFactory, String eventServiceName,
                            Supplier<DeferredUpdates> deferredUpdates) {
        this.eventBusFactory = eventBusFactory;
        this.eventServiceName = eventServiceName;
        this.deferredUpdates = deferredUpdates;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void append(ILoggingEvent loggingEvent) {
        Map<String, Object> context = findContext(loggingEvent.getArgumentArray());
        if (context == null) return;
        Map<String, Object> fields = new LinkedHashMap<>(context);
        fields.remove(PRIVATE_FIELD);
        Event event = new Event((Map<String, Object>) BinaryValues.replaceRecursive(fields));
        deferredUpdates.get().add(new EventBusSendUpdate(eventBusFactory, eventServiceName,
                Collections.singletonList(event)));
    }

    @Nullable
    @SuppressWarnings("unchecked")
    private static Map<String, Object> findContext(Object[] arguments) {
        if (arguments == null) return null;
        for (Object argument : arguments) {
            if (argument instanceof Map) return (Map<String, Object>) argument;
        }
        return null;
    }
}
