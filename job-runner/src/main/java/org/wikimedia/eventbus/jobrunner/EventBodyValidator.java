package org.wikimedia.eventbus.jobrunner;

import static java.util.stream.Collectors.toList;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikimedia.eventbus.common.BinaryValues;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventSerializer;
import org.wikimedia.eventbus.common.EventSignature;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Turns the body of a job request into the job it describes.
 *
 * The body is a job event as produced by the job queue. It must be signed
 * with the secret shared with the producer. Binary parameters are decoded
 * back to byte arrays.
 */
public class EventBodyValidator {
    private static final Logger LOG = LoggerFactory.getLogger(EventBodyValidator.class);

    public static final String MISSING_PARAMS = "missing_params";
    private static final List<String> REQUIRED_FIELDS = ImmutableList.of("database", "type", "params");

    private final EventSerializer serializer;
    private final EventSignature signature;
    private final JobFactory jobFactory;

    public EventBodyValidator(EventSerializer serializer, EventSignature signature, JobFactory jobFactory) {
        this.serializer = serializer;
        this.signature = signature;
        this.jobFactory = jobFactory;
    }

    /**
     * @throws JobRequestException 500 if the body cannot be decoded, 400 if
     * fields are missing or the job cannot be built, 403 if the signature is
     * missing or wrong
     */
    public Job validateBody(byte[] body) throws JobRequestException {
        Event event = decode(body);

        List<String> missing = REQUIRED_FIELDS.stream().filter(field -> event.get(field) == null).collect(toList());
        if (!missing.isEmpty()) {
            throw new JobRequestException("Invalid event received", 400, ImmutableMap.of(MISSING_PARAMS, missing));
        }

        verifySignature(event);

        String type = String.valueOf(event.get("type"));
        Object params = event.get("params");
        if (!(params instanceof Map)) {
            throw new JobRequestException("Invalid event received", 400,
                    ImmutableMap.of("error", "params must be an object"));
        }
        return createJob(type, decodeParams((Map<?, ?>) params));
    }

    private Event decode(byte[] body) throws JobRequestException {
        try {
            return serializer.parseEvent(body);
        } catch (IOException e) {
            throw new JobRequestException("Could not decode the event", 500,
                    ImmutableMap.of("error", Strings.nullToEmpty(e.getMessage())));
        }
    }

    private void verifySignature(Event event) throws JobRequestException {
        Object eventSignature = event.get(Event.SIGNATURE_FIELD);
        if (eventSignature == null) {
            throw new JobRequestException("Missing mediawiki signature", 403);
        }
        Optional<byte[]> signed = serializer.serializeEvent(event.without(Event.SIGNATURE_FIELD));
        boolean verified = eventSignature instanceof String
                && signed.isPresent()
                && signature.verify(signed.get(), (String) eventSignature);
        if (!verified) {
            throw new JobRequestException("Invalid mediawiki signature", 403);
        }
    }

    private static Map<String, Object> decodeParams(Map<?, ?> params) throws JobRequestException {
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (Map.Entry<?, ?> param : params.entrySet()) {
            String key = String.valueOf(param.getKey());
            try {
                decoded.put(key, BinaryValues.decodeRecursive(param.getValue()));
            } catch (IllegalArgumentException e) {
                throw new JobRequestException("Internal Server Error", 500,
                        ImmutableMap.of("error", "base64 decoding failed for parameter " + key));
            }
        }
        return decoded;
    }

    @SuppressWarnings("checkstyle:IllegalCatch")
    private Job createJob(String type, Map<String, Object> params) throws JobRequestException {
        Job job;
        String error;
        try {
            job = jobFactory.create(type, params);
            error = "Could not create a job from event";
        } catch (RuntimeException e) {
            job = null;
            error = Strings.nullToEmpty(e.getMessage());
        }
        if (job != null) return job;
        LOG.error("Failed creating job from description. Job type: {}, error: {}", type, error);
        throw new JobRequestException("Failed creating job from description", 400,
                ImmutableMap.of("error", error, "type", type));
    }
}
