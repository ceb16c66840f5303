package org.wikimedia.eventbus.producer.adapters;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.Test;
import org.wikimedia.eventbus.common.EventSerializer;
import org.wikimedia.eventbus.common.model.RecentChange;
import org.wikimedia.eventbus.common.model.Title;
import org.wikimedia.eventbus.producer.DeferredUpdates;
import org.wikimedia.eventbus.producer.EventBus;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventType;
import org.wikimedia.eventbus.producer.ProducerTestUtils;
import org.wikimedia.eventbus.producer.SendResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RecentChangeFeedUnitTest {
    private final RecentChangeFeedFormatter formatter = new RecentChangeFeedFormatter(
            ProducerTestUtils.newEventFactory(), new EventSerializer());

    private static RecentChange logEntry() {
        return RecentChange.builder()
                .id(100L)
                .type("log")
                .title(new Title(2, "User:Tester"))
                .comment("created account")
                .timestamp(Instant.parse("2021-03-04T05:06:07Z"))
                .user("Tester")
                .logId(7L)
                .logType("newusers")
                .logAction("create")
                .build();
    }

    @Test
    public void linesAreArraysWithoutNulls() throws Exception {
        byte[] line = formatter.getLine(logEntry()).get();

        JsonNode events = new ObjectMapper().readTree(line);
        assertThat(events.isArray()).isTrue();
        assertThat(events.size()).isEqualTo(1);
        JsonNode event = events.get(0);
        assertThat(event.get("meta").get("stream").asText()).isEqualTo(RecentChangeFeedFormatter.STREAM);
        assertThat(event.get("meta").get("dt").asText()).isEqualTo("2021-03-04T05:06:07Z");
        assertThat(event.get("title").asText()).isEqualTo("User:Tester");
        assertThat(event.get("log_type").asText()).isEqualTo("newusers");
        assertThat(event.has("minor")).isFalse();
        assertThat(event.has("revision")).isFalse();
        assertThat(new String(line, UTF_8)).doesNotContain("null");
    }

    @Test
    public void linesAreSentWithTheDeferredUpdates() {
        EventBusFactory factory = mock(EventBusFactory.class);
        EventBus bus = mock(EventBus.class);
        when(factory.getInstanceForStream(RecentChangeFeedFormatter.STREAM)).thenReturn(bus);
        when(bus.send(any(byte[].class), any(EventType.class))).thenReturn(SendResult.ok());
        RecentChangeFeedEngine engine = new RecentChangeFeedEngine(formatter, factory);
        DeferredUpdates updates = new DeferredUpdates();
        byte[] line = formatter.getLine(logEntry()).get();

        assertThat(engine.send(updates, line)).isTrue();
        verify(bus, never()).send(any(byte[].class), any(EventType.class));

        updates.doUpdates();
        verify(bus).send(eq(line), eq(EventType.EVENT));
    }
}
