package org.wikimedia.eventbus.producer;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import javax.annotation.Nullable;

import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventSerializer;
import org.wikimedia.eventbus.common.RequestContext;
import org.wikimedia.eventbus.producer.config.EventBusConfig;

import com.google.common.annotations.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Delivers events to one event intake service.
 *
 * Events are POSTed as JSON arrays, split in batches no larger than the
 * configured maximum batch size. The service answers 201 when all events are
 * accepted, 207 when only some are and 400 when none are. Anything but a 201
 * is logged as an error; nothing is retried and nothing is thrown, the
 * outcome is reported as a {@link SendResult}.
 */
public class EventBus {
    /** Request timeout, in seconds, for services not configuring one. */
    public static final int DEFAULT_REQUEST_TIMEOUT = 10;
    public static final String CLIENT_IP_HEADER = "X-Client-IP";

    private static final Logger LOG = LoggerFactory.getLogger(EventBus.class);

    private final CloseableHttpClient httpClient;
    @Nullable
    private final String url;
    private final RequestConfig requestConfig;
    private final long maxBatchByteSize;
    private final EnumSet<EventType> allowedTypes;
    private final boolean forwardClientIp;
    private final EventSerializer serializer;
    private final Supplier<RequestContext> requestContext;

    @SuppressWarnings("checkstyle:ParameterNumber")
    public EventBus(CloseableHttpClient httpClient, @Nullable String url, int timeoutSeconds, long maxBatchByteSize,
                    EnumSet<EventType> allowedTypes, boolean forwardClientIp, EventSerializer serializer,
                    Supplier<RequestContext> requestContext) {
        this.httpClient = httpClient;
        this.url = url;
        int timeoutMillis = timeoutSeconds * 1000;
        this.requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();
        this.maxBatchByteSize = maxBatchByteSize;
        this.allowedTypes = EnumSet.copyOf(allowedTypes);
        this.forwardClientIp = forwardClientIp;
        this.serializer = serializer;
        this.requestContext = requestContext;
    }

    /**
     * A destination accepting every send without doing anything.
     */
    public static EventBus disabled(CloseableHttpClient httpClient, EventSerializer serializer) {
        return new EventBus(httpClient, null, DEFAULT_REQUEST_TIMEOUT, EventBusConfig.DEFAULT_MAX_BATCH_BYTE_SIZE,
                EnumSet.noneOf(EventType.class), false, serializer, RequestContext::detached);
    }

    public SendResult send(List<Event> events) {
        return send(events, EventType.EVENT);
    }

    public SendResult send(List<Event> events, EventType type) {
        if (!shouldSend(type)) return SendResult.ok();
        if (events.isEmpty()) return emptySend();

        serializer.validateJsonSerializable(events);
        Optional<byte[]> body = serializer.serializeEvents(events);
        if (!body.isPresent()) return SendResult.failure("Unable to serialize events");
        if (body.get().length <= maxBatchByteSize || events.size() == 1) {
            return post(Collections.singletonList(new Batch(body.get(), events)));
        }
        Optional<List<Batch>> batches = partition(events);
        if (!batches.isPresent()) return SendResult.failure("Unable to serialize events");
        return post(batches.get());
    }

    /**
     * Send an already serialized body.
     *
     * The body is sent as it is unless it is larger than the maximum batch
     * size and holds a JSON array of events, in which case it is split.
     */
    public SendResult send(byte[] body, EventType type) {
        if (!shouldSend(type)) return SendResult.ok();
        if (body.length == 0) return emptySend();
        if (body.length > maxBatchByteSize) {
            Optional<List<Event>> events = parseArray(body);
            if (events.isPresent() && events.get().size() > 1) {
                Optional<List<Batch>> batches = partition(events.get());
                if (batches.isPresent()) return post(batches.get());
            }
        }
        return post(Collections.singletonList(new Batch(body, null)));
    }

    public boolean shouldSend(EventType type) {
        return allowedTypes.contains(type);
    }

    @Nullable
    @VisibleForTesting
    String url() {
        return url;
    }

    @VisibleForTesting
    boolean forwardsClientIp() {
        return forwardClientIp;
    }

    @VisibleForTesting
    RequestConfig requestConfig() {
        return requestConfig;
    }

    private SendResult emptySend() {
        LOG.error("Must call send with at least 1 event. Aborting send.");
        return SendResult.failure("No events to send");
    }

    private Optional<List<Event>> parseArray(byte[] body) {
        int first = 0;
        while (first < body.length && Character.isWhitespace(body[first])) first++;
        if (first == body.length || body[first] != '[') return Optional.empty();
        try {
            return Optional.of(serializer.parseEvents(body));
        } catch (IOException e) {
            LOG.debug("Body is not a JSON array of events, sending it unsplit", e);
            return Optional.empty();
        }
    }

    /**
     * Group events, in order, into batches whose serialized size does not
     * exceed the maximum. An event larger than the maximum is sent alone.
     */
    private Optional<List<Batch>> partition(List<Event> events) {
        List<Batch> batches = new ArrayList<>();
        ByteArrayOutputStream current = new ByteArrayOutputStream();
        List<Event> currentEvents = new ArrayList<>();
        for (Event event : events) {
            Optional<byte[]> serialized = serializer.serializeEvent(event);
            if (!serialized.isPresent()) return Optional.empty();
            byte[] bytes = serialized.get();
            // opening bracket, separator and closing bracket
            long sizeWithEvent = current.size() + bytes.length + 2;
            if (!currentEvents.isEmpty() && sizeWithEvent > maxBatchByteSize) {
                batches.add(toBatch(current, currentEvents));
                current = new ByteArrayOutputStream();
                currentEvents = new ArrayList<>();
            }
            current.write(currentEvents.isEmpty() ? '[' : ',');
            current.write(bytes, 0, bytes.length);
            currentEvents.add(event);
        }
        batches.add(toBatch(current, currentEvents));
        return Optional.of(batches);
    }

    private static Batch toBatch(ByteArrayOutputStream content, List<Event> events) {
        content.write(']');
        return new Batch(content.toByteArray(), events);
    }

    private SendResult post(List<Batch> batches) {
        List<String> errors = new ArrayList<>();
        for (Batch batch : batches) {
            String error = post(batch);
            if (error != null) errors.add(error);
        }
        return errors.isEmpty() ? SendResult.ok() : SendResult.failure(errors);
    }

    /**
     * @return the error message, null when all events were accepted
     */
    @Nullable
    private String post(Batch batch) {
        HttpPost post = new HttpPost(url);
        post.setConfig(requestConfig);
        post.setEntity(new ByteArrayEntity(batch.body, ContentType.APPLICATION_JSON));
        if (forwardClientIp) {
            String clientIp = requestContext.get().clientIp();
            if (clientIp != null) post.setHeader(CLIENT_IP_HEADER, clientIp);
        }
        try (CloseableHttpResponse response = httpClient.execute(post)) {
            StatusLine status = response.getStatusLine();
            if (status.getStatusCode() == 201) return null;
            String message = "Unable to deliver all events: " + status.getStatusCode() + ": " + status.getReasonPhrase();
            LOG.error("{}. Events: {}. Service response: {}",
                    message, describe(batch), responseBody(response.getEntity()));
            return message;
        } catch (IOException e) {
            String message = "Unable to deliver all events: " + e;
            LOG.error("{}. Events: {}", message, describe(batch), e);
            return message;
        }
    }

    private String describe(Batch batch) {
        if (batch.events != null) return serializer.describeForLog(batch.events, batch.body.length);
        if (batch.body.length > EventSerializer.MAX_LOGGED_BODY_BYTES) return batch.body.length + " bytes";
        return new String(batch.body, UTF_8);
    }

    private static String responseBody(@Nullable HttpEntity entity) {
        if (entity == null) return "";
        try {
            return EntityUtils.toString(entity, UTF_8);
        } catch (IOException e) {
            return "unreadable response: " + e.getMessage();
        }
    }

    private static final class Batch {
        private final byte[] body;
        /** Events of the body, null when it was given already serialized. */
        @Nullable
        private final List<Event> events;

        @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "batches are private and never modified")
        private Batch(byte[] body, @Nullable List<Event> events) {
            this.body = body;
            this.events = events;
        }
    }
}
