package org.wikimedia.eventbus.common.model;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Builder
@Accessors(fluent = true)
public class Page {
    long id;
    Title title;
    boolean redirect;
    /** Id of the current revision, null when the page has none (deleted page). */
    @Nullable
    Long latestRevisionId;
}
