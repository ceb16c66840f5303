package org.wikimedia.eventbus.producer.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads {@link EventBusConfig} from YAML, or JSON which YAML parsers accept as well.
 */
public class EventBusConfigParser {
    private final ObjectMapper objectMapper;

    public static EventBusConfig parseYaml(InputStream is) throws IOException {
        return yamlParser().parse(is);
    }

    public static EventBusConfigParser yamlParser() {
        return new EventBusConfigParser(new YAMLFactory());
    }

    public EventBusConfigParser(JsonFactory factory) {
        this.objectMapper = new ObjectMapper(factory);
    }

    public EventBusConfig parse(InputStream is) throws IOException {
        return objectMapper.readerFor(EventBusConfig.class).readValue(is);
    }

    /**
     * @throws EventBusConfigException if the file cannot be read or parsed
     */
    public EventBusConfig load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        } catch (IOException e) {
            throw new EventBusConfigException("Cannot load the EventBus configuration from " + path, e);
        }
    }
}
