package org.wikimedia.eventbus.common.model;

import java.time.Instant;
import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Builder
@Accessors(fluent = true)
public class Revision {
    public static final int DELETED_TEXT = 1;
    public static final int DELETED_COMMENT = 2;
    public static final int DELETED_USER = 4;
    public static final int DELETED_RESTRICTED = 8;
    public static final int SUPPRESSED_ALL = DELETED_TEXT | DELETED_COMMENT | DELETED_USER | DELETED_RESTRICTED;

    long id;
    long pageId;
    Title title;
    Instant timestamp;
    /** Previous revision of the page, null or 0 on page creation. */
    @Nullable
    Long parentId;
    /** Null when the user is hidden. */
    @Nullable
    Performer performer;
    /** Null when the comment is hidden. */
    @Nullable
    String comment;
    boolean minor;
    long size;
    String sha1;
    String contentModel;
    String contentFormat;
    /** Bit field of DELETED_* constants. */
    int visibility;
    /** Null when the revision has no loaded content. */
    @Nullable
    RevisionContent content;
    /** Content slots by role order, empty when not loaded. */
    @Singular
    List<RevisionSlot> slots;

    public boolean isHidden(int field) {
        return (visibility & field) == field;
    }
}
