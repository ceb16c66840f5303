package org.wikimedia.eventbus.producer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventFactory;
import org.wikimedia.eventbus.common.EventSignature;
import org.wikimedia.eventbus.common.model.JobSpecification;

/**
 * A job queue that pushes jobs as signed events, to be run by whoever consumes the job streams.
 *
 * Each job goes to the stream {@code mediawiki.job.<type>}. Jobs that may be
 * collapsed are de-duplicated within a push by their {@code sha1}. Unlike
 * other events jobs are sent right away, and failing to send them is an error
 * reported to the caller.
 */
public class JobQueueEventBus {
    public static final String STREAM_PREFIX = "mediawiki.job.";

    private static final Logger LOG = LoggerFactory.getLogger(JobQueueEventBus.class);

    private final EventFactory eventFactory;
    private final EventSignature signature;
    private final EventBusFactory eventBusFactory;
    @Nullable
    private final String wikiId;

    /**
     * @param wikiId wiki the jobs run on, the local wiki when null
     */
    public JobQueueEventBus(EventFactory eventFactory, EventSignature signature, EventBusFactory eventBusFactory,
                            @Nullable String wikiId) {
        this.eventFactory = eventFactory;
        this.signature = signature;
        this.eventBusFactory = eventBusFactory;
        this.wikiId = wikiId;
    }

    public static String streamForJobType(String type) {
        return STREAM_PREFIX + type;
    }

    /**
     * @throws JobQueueException if some of the jobs could not be sent
     */
    public void push(Collection<JobSpecification> jobs) throws JobQueueException {
        Map<String, Event> events = new LinkedHashMap<>();
        for (JobSpecification job : jobs) {
            Event unsigned = eventFactory.createJobEvent(streamForJobType(job.type()), wikiId, job);
            Optional<Event> signed = signature.sign(unsigned);
            if (!signed.isPresent()) {
                LOG.warn("Skipping job {} that cannot be serialized", job.type());
                continue;
            }
            Object sha1 = signed.get().get("sha1");
            events.put(sha1 != null ? (String) sha1 : signed.get().id(), signed.get());
        }
        if (events.isEmpty()) return;

        Map<String, List<Event>> byStream = new LinkedHashMap<>();
        for (Event event : events.values()) {
            byStream.computeIfAbsent(event.stream(), s -> new ArrayList<>()).add(event);
        }
        List<String> errors = new ArrayList<>();
        byStream.forEach((stream, streamEvents) -> {
            SendResult result = eventBusFactory.getInstanceForStream(stream).send(streamEvents, EventType.JOB);
            errors.addAll(result.errors());
        });
        if (!errors.isEmpty()) {
            throw new JobQueueException("Could not enqueue jobs", errors);
        }
    }
}
