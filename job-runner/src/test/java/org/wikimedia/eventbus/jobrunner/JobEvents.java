package org.wikimedia.eventbus.jobrunner;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventFactory;
import org.wikimedia.eventbus.common.EventSerializer;
import org.wikimedia.eventbus.common.EventSignature;
import org.wikimedia.eventbus.common.RequestContext;
import org.wikimedia.eventbus.common.SiteInfo;
import org.wikimedia.eventbus.common.model.JobSpecification;
import org.wikimedia.eventbus.common.model.Title;

/**
 * Job events as the job queue sends them.
 */
public final class JobEvents {
    public static final String SECRET = "not so secret";
    public static final EventSerializer SERIALIZER = new EventSerializer();
    public static final EventSignature SIGNATURE = new EventSignature(SECRET, SERIALIZER);

    private static final EventFactory FACTORY = new EventFactory(
            new SiteInfo("testwiki", "test.wikipedia.org", "https://test.wikipedia.org", "/wiki/$1"),
            () -> new RequestContext("5b1d0c7e-0c26-4b31-8a6a-6e3c2f4f0d11", null));

    private JobEvents() {
        // Utility class should not be constructed
    }

    public static JobSpecification.JobSpecificationBuilder job(String type) {
        return JobSpecification.builder()
                .type(type)
                .title(new Title(0, "Main_Page"))
                .param("requestId", "req-1");
    }

    public static Event unsigned(JobSpecification job) {
        return FACTORY.createJobEvent("mediawiki.job." + job.type(), null, job);
    }

    public static byte[] signed(JobSpecification job) {
        return serialize(SIGNATURE.sign(unsigned(job)).get());
    }

    /**
     * Sign the event once modified.
     */
    public static byte[] signedAfter(JobSpecification job, Consumer<Map<String, Object>> change) {
        Map<String, Object> fields = new LinkedHashMap<>(unsigned(job).fields());
        change.accept(fields);
        return serialize(SIGNATURE.sign(new Event(fields)).get());
    }

    /**
     * Modify the event once signed.
     */
    public static byte[] tampered(JobSpecification job, Consumer<Map<String, Object>> change) {
        Map<String, Object> fields = new LinkedHashMap<>(SIGNATURE.sign(unsigned(job)).get().fields());
        change.accept(fields);
        return serialize(new Event(fields));
    }

    public static byte[] serialize(Event event) {
        return SERIALIZER.serializeEvent(event).get();
    }

    public static byte[] utf8(String body) {
        return body.getBytes(UTF_8);
    }
}
