package org.wikimedia.eventbus.common;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.security.MessageDigest;
import java.util.Optional;

import javax.annotation.Nullable;

import com.auth0.jwt.algorithms.Algorithm;
import com.google.common.hash.Hashing;

/**
 * Signs events so that the job runner can trust the jobs it is asked to run.
 *
 * The signature is the hex encoded SHA-256 of the HMAC-SHA256 of the
 * serialized event, computed while the event has no
 * {@value Event#SIGNATURE_FIELD} field.
 */
public class EventSignature {
    private final Algorithm algorithm;
    private final EventSerializer serializer;

    public EventSignature(String secret, EventSerializer serializer) {
        this(Algorithm.HMAC256(secret), serializer);
    }

    EventSignature(Algorithm algorithm, EventSerializer serializer) {
        this.algorithm = algorithm;
        this.serializer = serializer;
    }

    @SuppressWarnings("deprecation")
    public String signature(byte[] serialized) {
        return Hashing.sha256().hashBytes(algorithm.sign(serialized)).toString();
    }

    /**
     * Constant time check of a signature against serialized content.
     */
    public boolean verify(byte[] serialized, @Nullable String signature) {
        if (signature == null) return false;
        return MessageDigest.isEqual(signature(serialized).getBytes(UTF_8), signature.getBytes(UTF_8));
    }

    /**
     * Return a copy of the event carrying its signature, empty if the event
     * cannot be serialized.
     */
    public Optional<Event> sign(Event event) {
        return serializer.serializeEvent(event.without(Event.SIGNATURE_FIELD))
                .map(bytes -> event.withSignature(signature(bytes)));
    }

    public boolean verify(Event event) {
        Optional<byte[]> serialized = serializer.serializeEvent(event.without(Event.SIGNATURE_FIELD));
        return serialized.isPresent() && verify(serialized.get(), event.signature());
    }
}
