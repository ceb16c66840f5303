package org.wikimedia.eventbus.producer.config;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An event intake service events can be posted to.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventServiceConfig {
    /** Endpoint receiving the POSTed events, the service is unusable without it. */
    @Nullable
    @JsonProperty("url")
    String url;

    /** Request timeout in seconds, the default timeout applies when absent. */
    @Nullable
    @JsonProperty("timeout")
    Integer timeout;

    /** Whether to forward the client IP of the current request in an {@code X-Client-IP} header. */
    @JsonProperty("x_client_ip_forwarding_enabled")
    boolean forwardClientIp;
}
