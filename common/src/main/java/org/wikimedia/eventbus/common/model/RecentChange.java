package org.wikimedia.eventbus.common.model;

import java.time.Instant;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A row of the recent changes feed. Fields that do not apply to a change type are null.
 */
@Value
@Builder
@Accessors(fluent = true)
public class RecentChange {
    @Nullable
    Long id;
    /** edit, new, log, categorize or external. */
    String type;
    Title title;
    String comment;
    Instant timestamp;
    String user;
    boolean bot;
    @Nullable
    Boolean minor;
    @Nullable
    Boolean patrolled;
    @Nullable
    Long oldLength;
    @Nullable
    Long newLength;
    @Nullable
    Long oldRevisionId;
    @Nullable
    Long newRevisionId;
    @Nullable
    Long logId;
    @Nullable
    String logType;
    @Nullable
    String logAction;
    @Nullable
    String logActionComment;
    @Nullable
    String serverScriptPath;
}
