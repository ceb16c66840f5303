package org.wikimedia.eventbus.producer;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.NotThreadSafe;

import org.wikimedia.eventbus.common.Event;

import com.google.common.annotations.VisibleForTesting;

/**
 * Events waiting to be sent at the end of a request, grouped by event service.
 *
 * Merging concatenates the pending events of each service so that a request
 * sends one batch per service no matter how many events it produced.
 */
@NotThreadSafe
public final class EventBusSendUpdate implements MergeableUpdate {
    private final EventBusFactory eventBusFactory;
    private final Map<String, List<Event>> eventsByService = new LinkedHashMap<>();

    public EventBusSendUpdate(EventBusFactory eventBusFactory, String eventServiceName, List<Event> events) {
        checkArgument(events != null, "The events must be a flat list of events");
        for (Event event : events) {
            checkArgument(event != null, "The events must be a flat list of events");
        }
        this.eventBusFactory = eventBusFactory;
        eventsByService.put(eventServiceName, new ArrayList<>(events));
    }

    public static EventBusSendUpdate newForStream(EventBusFactory eventBusFactory, String stream, List<Event> events) {
        return new EventBusSendUpdate(eventBusFactory, eventBusFactory.getEventServiceNameForStream(stream), events);
    }

    @Override
    public void doUpdate() {
        eventsByService.forEach((service, events) -> {
            if (!events.isEmpty()) {
                eventBusFactory.getInstance(service).send(events, EventType.EVENT);
            }
        });
    }

    @Override
    public void merge(MergeableUpdate update) {
        EventBusSendUpdate other = (EventBusSendUpdate) update;
        other.eventsByService.forEach((service, events) ->
                eventsByService.computeIfAbsent(service, s -> new ArrayList<>()).addAll(events));
    }

    @VisibleForTesting
    Map<String, List<Event>> pendingEvents() {
        Map<String, List<Event>> copy = new LinkedHashMap<>();
        eventsByService.forEach((service, events) -> copy.put(service, Collections.unmodifiableList(events)));
        return copy;
    }

    @Override
    public String toString() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        eventsByService.forEach((service, events) -> counts.put(service, events.size()));
        return "EventBusSendUpdate" + counts;
    }
}
