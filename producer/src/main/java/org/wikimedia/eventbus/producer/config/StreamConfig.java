package org.wikimedia.eventbus.producer.config;

import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Declaration of a stream. Settings this producer does not use (schema, topics...) are ignored.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamConfig {
    @Nullable
    @JsonProperty("stream")
    String stream;

    /** Deprecated, use the {@code destination_event_service} of the producer settings instead. */
    @Nullable
    @JsonProperty("destination_event_service")
    String destinationEventService;

    /** Producer specific settings, keyed by producer name. */
    @Singular
    @JsonProperty("producers")
    Map<String, StreamProducerConfig> producers;

    @Nullable
    public StreamProducerConfig producer(String name) {
        return producers.get(name);
    }
}
