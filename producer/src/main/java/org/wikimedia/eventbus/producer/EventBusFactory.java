package org.wikimedia.eventbus.producer;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikimedia.eventbus.common.EventSerializer;
import org.wikimedia.eventbus.common.RequestContext;
import org.wikimedia.eventbus.producer.config.EventBusConfig;
import org.wikimedia.eventbus.producer.config.EventServiceConfig;
import org.wikimedia.eventbus.producer.config.StreamConfig;
import org.wikimedia.eventbus.producer.config.StreamProducerConfig;

/**
 * Resolves streams to event services and holds one {@link EventBus} per event service.
 *
 * Instances are created lazily and shared by all the threads using this
 * factory. The factory owns the HTTP client used by its instances.
 */
public class EventBusFactory implements AutoCloseable {
    /** Name of the event service that accepts everything and sends nothing. */
    public static final String DISABLED_EVENT_SERVICE_NAME = "_disabled_eventbus_";
    /** Name of this producer in the {@code producers} settings of a stream. */
    public static final String EVENT_STREAM_CONFIG_PRODUCER_NAME = "mediawiki_eventbus";

    private static final Logger LOG = LoggerFactory.getLogger(EventBusFactory.class);

    private final EventBusConfig config;
    private final CloseableHttpClient httpClient;
    private final EventSerializer serializer;
    private final Supplier<RequestContext> requestContext;
    private final EnumSet<EventType> allowedTypes;
    private final ConcurrentMap<String, EventBus> instances = new ConcurrentHashMap<>();

    public EventBusFactory(EventBusConfig config, CloseableHttpClient httpClient, EventSerializer serializer,
                           Supplier<RequestContext> requestContext) {
        this.config = config;
        this.httpClient = httpClient;
        this.serializer = serializer;
        this.requestContext = requestContext;
        this.allowedTypes = EventType.parseAllowed(config.getEnableEventBus());
    }

    public static EventBusFactory build(EventBusConfig config, Supplier<RequestContext> requestContext) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .useSystemProperties()
                .build();
        return new EventBusFactory(config, httpClient, new EventSerializer(), requestContext);
    }

    /**
     * Name of the event service events of this stream should be sent to.
     *
     * <ul>
     * <li>without stream declarations, the default event service
     * <li>undeclared streams, and streams disabled for this producer, go to
     * {@link #DISABLED_EVENT_SERVICE_NAME}
     * <li>otherwise the service named by the producer settings of the stream,
     * then by the deprecated top level setting, then the default one
     * </ul>
     */
    public String getEventServiceNameForStream(String stream) {
        Map<String, StreamConfig> streams = config.getEventStreams();
        if (streams == null) return config.getEventServiceDefault();

        StreamConfig streamConfig = streams.get(stream);
        if (streamConfig == null) {
            LOG.debug("Stream {} is not declared, its events will not be sent", stream);
            return DISABLED_EVENT_SERVICE_NAME;
        }
        StreamProducerConfig producerConfig = streamConfig.producer(EVENT_STREAM_CONFIG_PRODUCER_NAME);
        if (producerConfig != null && Boolean.FALSE.equals(producerConfig.getEnabled())) {
            return DISABLED_EVENT_SERVICE_NAME;
        }
        if (producerConfig != null && producerConfig.getDestinationEventService() != null) {
            return producerConfig.getDestinationEventService();
        }
        if (streamConfig.getDestinationEventService() != null) {
            return streamConfig.getDestinationEventService();
        }
        return config.getEventServiceDefault();
    }

    /**
     * @throws IllegalArgumentException if the event service is not configured with a url
     */
    public EventBus getInstance(String eventServiceName) {
        return instances.computeIfAbsent(eventServiceName, this::newInstance);
    }

    public EventBus getInstanceForStream(String stream) {
        return getInstance(getEventServiceNameForStream(stream));
    }

    private EventBus newInstance(String eventServiceName) {
        if (DISABLED_EVENT_SERVICE_NAME.equals(eventServiceName)) {
            return EventBus.disabled(httpClient, serializer);
        }
        EventServiceConfig service = config.getEventServices().get(eventServiceName);
        if (service == null || service.getUrl() == null) {
            String error = "Could not get configuration of EventBus instance for '" + eventServiceName + "'. "
                    + "$eventServiceName must exist in EventServices with a url in main config.";
            LOG.error(error);
            throw new IllegalArgumentException(error);
        }
        int timeout = service.getTimeout() != null ? service.getTimeout() : EventBus.DEFAULT_REQUEST_TIMEOUT;
        return new EventBus(httpClient, service.getUrl(), timeout, config.getMaxBatchByteSize(), allowedTypes,
                service.isForwardClientIp(), serializer, requestContext);
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            LOG.error("Cannot close the http client", e);
        }
    }
}
