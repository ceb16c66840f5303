package org.wikimedia.eventbus.producer.hooks;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.model.Page;
import org.wikimedia.eventbus.common.model.Performer;
import org.wikimedia.eventbus.common.model.Title;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * What changed in the links and properties of a page after it was parsed.
 */
@Value
@Builder
@Accessors(fluent = true)
public class LinksUpdate {
    Page page;
    /** User whose action triggered the update, null for maintenance work. */
    @Nullable
    Performer triggeringUser;
    /** Revision that triggered the update, null when unknown. */
    @Nullable
    Long triggeringRevisionId;
    @Singular
    Map<String, Object> addedProperties;
    @Singular
    Map<String, Object> removedProperties;
    @Singular
    List<Title> addedLinks;
    @Singular
    List<String> addedExternalLinks;
    @Singular
    List<Title> removedLinks;
    @Singular
    List<String> removedExternalLinks;

    /**
     * Id of the triggering revision, or of the latest revision of the page when there is none.
     */
    public long revisionId() {
        if (triggeringRevisionId != null) return triggeringRevisionId;
        return page.latestRevisionId() != null ? page.latestRevisionId() : 0L;
    }

    public boolean hasPropertyChanges() {
        return !addedProperties.isEmpty() || !removedProperties.isEmpty();
    }

    public boolean hasLinkChanges() {
        return !addedLinks.isEmpty() || !addedExternalLinks.isEmpty()
                || !removedLinks.isEmpty() || !removedExternalLinks.isEmpty();
    }
}
