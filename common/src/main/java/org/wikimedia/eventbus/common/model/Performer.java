package org.wikimedia.eventbus.common.model;

import java.time.Instant;
import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * The user who performed an action, anonymous users have no id.
 */
@Value
@Builder
@Accessors(fluent = true)
public class Performer {
    String userText;
    @Nullable
    Long userId;
    @Singular
    List<String> groups;
    boolean bot;
    @Nullable
    Long editCount;
    @Nullable
    Instant registration;
    /** Maintenance accounts acting on behalf of the software. */
    boolean system;
    /** Temporary accounts created for logged-out editors. */
    boolean temp;

    public boolean isRegistered() {
        return userId != null && userId > 0;
    }
}
