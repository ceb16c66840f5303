package org.wikimedia.eventbus.producer;

import java.util.EnumSet;
import java.util.Locale;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

/**
 * Kinds of events a destination may be allowed to send.
 */
public enum EventType {
    /** Regular events describing changes to the wiki. */
    EVENT(1),
    /** Serialized jobs. */
    JOB(2),
    /** CDN purge requests. */
    PURGE(4);

    private static final Logger LOG = LoggerFactory.getLogger(EventType.class);
    private static final Splitter UNION_SPLITTER = Splitter.on('|').trimResults().omitEmptyStrings();

    private final int bit;

    EventType(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    /**
     * Parse the set of allowed types from its configuration value.
     *
     * Accepts {@code TYPE_NONE}, {@code TYPE_EVENT}, {@code TYPE_JOB}, {@code TYPE_PURGE},
     * {@code TYPE_ALL}, unions like {@code TYPE_EVENT|TYPE_PURGE} and the integer value of
     * the bit mask. Empty values allow everything. Unknown values are logged and allow
     * everything as well.
     */
    public static EnumSet<EventType> parseAllowed(@Nullable String value) {
        if (value == null || value.trim().isEmpty()) return EnumSet.allOf(EventType.class);
        EnumSet<EventType> allowed = EnumSet.noneOf(EventType.class);
        for (String token : UNION_SPLITTER.split(value)) {
            EnumSet<EventType> parsed = parseToken(token);
            if (parsed == null) {
                LOG.warn("Unknown $wgEnableEventBus config parameter value {}", value);
                return EnumSet.allOf(EventType.class);
            }
            allowed.addAll(parsed);
        }
        return allowed;
    }

    public static EnumSet<EventType> fromMask(int mask) {
        EnumSet<EventType> types = EnumSet.noneOf(EventType.class);
        for (EventType type : values()) {
            if ((mask & type.bit) != 0) types.add(type);
        }
        return types;
    }

    @Nullable
    private static EnumSet<EventType> parseToken(String token) {
        switch (token.toUpperCase(Locale.ROOT)) {
            case "TYPE_NONE":
                return EnumSet.noneOf(EventType.class);
            case "TYPE_EVENT":
                return EnumSet.of(EVENT);
            case "TYPE_JOB":
                return EnumSet.of(JOB);
            case "TYPE_PURGE":
                return EnumSet.of(PURGE);
            case "TYPE_ALL":
                return EnumSet.allOf(EventType.class);
            default:
                try {
                    return fromMask(Integer.parseInt(token));
                } catch (NumberFormatException e) {
                    return null;
                }
        }
    }
}
