package org.wikimedia.eventbus.producer.config;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Settings of a stream that only apply to one producer.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamProducerConfig {
    @Nullable
    @JsonProperty("destination_event_service")
    String destinationEventService;

    /** Only an explicit {@code false} disables the stream. */
    @Nullable
    @JsonProperty("enabled")
    Boolean enabled;
}
