package org.wikimedia.eventbus.common.model;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Metadata of the content held in one slot of a revision, the content itself is not included.
 */
@Value
@Builder
@Accessors(fluent = true)
public class RevisionSlot {
    /** For example {@code main}. */
    String role;
    String contentModel;
    /** Null when neither the slot nor the content model declares one. */
    @Nullable
    String contentFormat;
    String contentSha1;
    long contentSize;
    /** Revision that introduced this content, null when unknown. */
    @Nullable
    Long originRevisionId;
}
