package org.wikimedia.eventbus.producer.config;

import java.util.Map;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.SiteInfo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Configuration of the event producer, keyed like the wiki configuration settings it mirrors.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventBusConfig {
    public static final String DEFAULT_EVENT_SERVICE_NAME = "eventbus";
    public static final long DEFAULT_MAX_BATCH_BYTE_SIZE = 4194304L;

    /**
     * Event types allowed to be produced: {@code TYPE_NONE}, {@code TYPE_EVENT}, {@code TYPE_JOB},
     * {@code TYPE_PURGE}, {@code TYPE_ALL} or a {@code |} separated union of them.
     */
    @Builder.Default
    @JsonProperty("EnableEventBus")
    String enableEventBus = "TYPE_ALL";

    /** Event service used by streams that do not name one. */
    @Builder.Default
    @JsonProperty("EventServiceDefault")
    String eventServiceDefault = DEFAULT_EVENT_SERVICE_NAME;

    @Singular
    @JsonProperty("EventServices")
    Map<String, EventServiceConfig> eventServices;

    @Builder.Default
    @JsonProperty("EventBusMaxBatchByteSize")
    long maxBatchByteSize = DEFAULT_MAX_BATCH_BYTE_SIZE;

    /**
     * Declared streams. When null every stream goes to the default event service,
     * otherwise undeclared streams are disabled.
     */
    @Nullable
    @JsonProperty("EventStreams")
    Map<String, StreamConfig> eventStreams;

    /** Aliases of the default stream names. */
    @Singular("streamName")
    @JsonProperty("EventBusStreamNamesMap")
    Map<String, String> streamNamesMap;

    @JsonProperty("DBname")
    String dbName;

    @JsonProperty("ServerName")
    String serverName;

    @JsonProperty("CanonicalServer")
    String canonicalServer;

    @Builder.Default
    @JsonProperty("ArticlePath")
    String articlePath = "/wiki/$1";

    @Builder.Default
    @JsonProperty("UserNamespace")
    String userNamespace = "User";

    /** Domains of the other wikis of the farm, keyed by database name. */
    @Singular
    @JsonProperty("WikiDomains")
    Map<String, String> wikiDomains;

    public SiteInfo siteInfo() {
        return new SiteInfo(dbName, serverName, canonicalServer, articlePath, userNamespace, wikiDomains);
    }
}
