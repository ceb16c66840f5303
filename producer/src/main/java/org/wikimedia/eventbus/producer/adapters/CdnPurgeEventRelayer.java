package org.wikimedia.eventbus.producer.adapters;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.stream.Collectors.toList;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventFactory;
import org.wikimedia.eventbus.producer.EventBus;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Relays CDN purge requests as {@code resource_change} events tagged {@code mediawiki}.
 */
public class CdnPurgeEventRelayer {
    public static final String CHANNEL = "cdn-url-purges";
    public static final String STREAM_PARAM = "stream";

    private static final List<String> TAGS = ImmutableList.of("mediawiki");

    private final EventFactory eventFactory;
    private final EventBus eventBus;
    private final String purgeStream;

    /**
     * @param params relayer parameters, the purge stream must be set as {@code stream}
     * @throws IllegalArgumentException when the purge stream is not configured
     */
    public CdnPurgeEventRelayer(Map<String, String> params, EventFactory eventFactory,
                                EventBusFactory eventBusFactory) {
        String stream = params.get(STREAM_PARAM);
        checkArgument(stream != null, "purge_stream must be configured");
        this.purgeStream = stream;
        this.eventFactory = eventFactory;
        this.eventBus = eventBusFactory.getInstanceForStream(stream);
    }

    /**
     * Send the purges right away.
     *
     * @return whether all of them were accepted
     * @throws IllegalStateException when called for another channel
     */
    public boolean notify(String channel, List<Purge> purges) {
        checkState(CHANNEL.equals(channel), "Invalid CdnPurgeEventRelayer configuration. Called on %s", channel);
        List<Event> events = purges.stream()
                .map(purge -> eventFactory.createEvent(purge.url(), EventFactory.RESOURCE_CHANGE_SCHEMA, purgeStream,
                        ImmutableMap.<String, Object>of("tags", TAGS), null, purge.timestamp(), null))
                .collect(toList());
        return eventBus.send(events, EventType.PURGE).success();
    }

    /**
     * A URL to purge, and when the purge was requested.
     */
    @Value
    @Accessors(fluent = true)
    public static class Purge {
        String url;
        Instant timestamp;
    }
}
