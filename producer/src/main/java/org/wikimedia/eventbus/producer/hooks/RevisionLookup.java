package org.wikimedia.eventbus.producer.hooks;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.model.Revision;

/**
 * Loads revisions from the wiki.
 */
@FunctionalInterface
public interface RevisionLookup {
    /**
     * @return the revision, null if it does not exist (anymore)
     */
    @Nullable
    Revision getRevisionById(long revisionId);
}
