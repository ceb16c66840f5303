package org.wikimedia.eventbus.producer.adapters;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventFactory;
import org.wikimedia.eventbus.common.EventSerializer;
import org.wikimedia.eventbus.common.model.RecentChange;

/**
 * Formats recent changes as serialized {@code mediawiki/recentchange} events.
 *
 * Attributes that do not apply to a change are left out rather than sent as nulls.
 */
public class RecentChangeFeedFormatter {
    public static final String STREAM = "mediawiki.recentchange";

    private final EventFactory eventFactory;
    private final EventSerializer serializer;
    private final String stream;

    public RecentChangeFeedFormatter(EventFactory eventFactory, EventSerializer serializer) {
        this(eventFactory, serializer, STREAM);
    }

    public RecentChangeFeedFormatter(EventFactory eventFactory, EventSerializer serializer, String stream) {
        this.eventFactory = eventFactory;
        this.serializer = serializer;
        this.stream = stream;
    }

    public String stream() {
        return stream;
    }

    /**
     * @return a JSON array holding the event, empty if it cannot be serialized
     */
    @SuppressWarnings("unchecked")
    public Optional<byte[]> getLine(RecentChange recentChange) {
        Event event = eventFactory.createRecentChangeEvent(stream, recentChange);
        Event pruned = new Event((Map<String, Object>) EventFactory.removeNulls(event.fields()));
        return serializer.serializeEvents(Collections.singletonList(pruned));
    }
}
