package org.wikimedia.eventbus.producer.adapters;

import org.wikimedia.eventbus.producer.DeferredUpdates;
import org.wikimedia.eventbus.producer.EventBus;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventType;

/**
 * Sends the lines of the recent changes feed once the request is done.
 */
public class RecentChangeFeedEngine {
    private final RecentChangeFeedFormatter formatter;
    private final EventBusFactory eventBusFactory;

    public RecentChangeFeedEngine(RecentChangeFeedFormatter formatter, EventBusFactory eventBusFactory) {
        this.formatter = formatter;
        this.eventBusFactory = eventBusFactory;
    }

    /**
     * @param line a serialized event as formatted by {@link RecentChangeFeedFormatter}
     * @return always true, delivery happens later and its failures are only logged
     */
    public boolean send(DeferredUpdates updates, byte[] line) {
        EventBus eventBus = eventBusFactory.getInstanceForStream(formatter.stream());
        updates.add(() -> eventBus.send(line, EventType.EVENT));
        return true;
    }
}
