package org.wikimedia.eventbus.producer;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Maps the default names of the streams produced here to the names configured for this wiki.
 */
public class StreamNameMapper {
    public static final String STREAM_NAMES_MAP_CONFIG_KEY = "EventBusStreamNamesMap";

    private final Map<String, String> streamNamesMap;

    public StreamNameMapper(Map<String, String> streamNamesMap) {
        this.streamNamesMap = ImmutableMap.copyOf(streamNamesMap);
    }

    /**
     * @return the configured name, or the given name when it is not remapped
     */
    public String resolve(String name) {
        return streamNamesMap.getOrDefault(name, name);
    }
}
