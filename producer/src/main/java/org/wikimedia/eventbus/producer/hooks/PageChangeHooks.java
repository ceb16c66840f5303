package org.wikimedia.eventbus.producer.hooks;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.PageChangeEventFactory;
import org.wikimedia.eventbus.common.model.Page;
import org.wikimedia.eventbus.common.model.Performer;
import org.wikimedia.eventbus.common.model.Revision;
import org.wikimedia.eventbus.common.model.Title;
import org.wikimedia.eventbus.producer.DeferredUpdates;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventBusSendUpdate;
import org.wikimedia.eventbus.producer.StreamNameMapper;

/**
 * Produces {@code page_change} events, one per change of a page, to a single stream.
 */
public class PageChangeHooks {
    public static final String PAGE_CHANGE_STREAM = "mediawiki.page_change.v1";

    private static final Logger LOG = LoggerFactory.getLogger(PageChangeHooks.class);

    private final PageChangeEventFactory eventFactory;
    private final EventBusFactory eventBusFactory;
    private final StreamNameMapper streamNameMapper;
    private final RevisionLookup revisionLookup;

    public PageChangeHooks(PageChangeEventFactory eventFactory, EventBusFactory eventBusFactory,
                           StreamNameMapper streamNameMapper, RevisionLookup revisionLookup) {
        this.eventFactory = eventFactory;
        this.eventBusFactory = eventBusFactory;
        this.streamNameMapper = streamNameMapper;
        this.revisionLookup = revisionLookup;
    }

    /**
     * A page was created or edited. Null edits change nothing and are not reported.
     *
     * @param created whether the revision is the first one of the page
     * @param nullEdit whether the save created no new revision
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public void onPageSaveComplete(DeferredUpdates updates, Page page, Performer performer, Revision revision,
                                   boolean created, boolean nullEdit) {
        if (nullEdit) {
            LOG.debug("Null edit of page {}, no page change to report.", page.id());
            return;
        }
        String stream = stream();
        Event event;
        if (created) {
            event = eventFactory.createPageCreateEvent(stream, page, performer, revision);
        } else {
            event = eventFactory.createPageEditEvent(stream, page, performer, revision, parentOf(revision));
        }
        queue(updates, stream, event);
    }

    /**
     * @param revision the revision recording the move
     * @param createdRedirectPage redirect left at the old title, null when none was created
     * @throws IllegalArgumentException when the revision before the move cannot be loaded
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public void onPageMoveComplete(DeferredUpdates updates, Page page, Performer performer, Revision revision,
                                   Title oldTitle, String reason, @Nullable Page createdRedirectPage) {
        Revision parent = parentOf(revision);
        if (parent == null) {
            throw new IllegalArgumentException("Revision " + revision.id()
                    + " recording the move of page " + page.id() + " has no parent revision.");
        }
        String stream = stream();
        queue(updates, stream, eventFactory.createPageMoveEvent(stream, page, performer, revision, parent, oldTitle,
                reason, createdRedirectPage));
    }

    /**
     * @param revision the current revision of the page when it was deleted
     * @param eventTime time of the deletion, now when null
     * @param archivedRevisionCount number of revisions moved to the archive, null when unknown
     * @param suppression whether the page is also hidden from administrators
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public void onPageDeleteComplete(DeferredUpdates updates, Page page, Performer performer, Revision revision,
                                     String reason, @Nullable Instant eventTime, @Nullable Long archivedRevisionCount,
                                     boolean suppression) {
        String stream = stream();
        queue(updates, stream, eventFactory.createPageDeleteEvent(stream, page, performer, revision, reason,
                eventTime, archivedRevisionCount, suppression));
    }

    /**
     * @param oldPageId id of the page before it was deleted, null when unknown
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public void onPageUndeleteComplete(DeferredUpdates updates, Page page, Performer performer, Revision revision,
                                       String reason, @Nullable Instant eventTime, @Nullable Long oldPageId) {
        String stream = stream();
        queue(updates, stream, eventFactory.createPageUndeleteEvent(stream, page, performer, revision, reason,
                eventTime, oldPageId));
    }

    /**
     * Visibility of some revisions of a page changed.
     *
     * Only the current revision of the page is part of its state, changes of
     * older revisions are not reported.
     *
     * @throws IllegalArgumentException when the current revision does not have the new visibility
     */
    public void onRevisionVisibilitySet(DeferredUpdates updates, Page page, Performer performer,
                                        List<Long> revisionIds, Map<Long, VisibilityChange> visibilityChanges) {
        for (Long revisionId : revisionIds) {
            Revision revision = revisionLookup.getRevisionById(revisionId);
            if (revision == null) {
                LOG.warn("Revision {} could not be found and may have been deleted. "
                        + "Cannot create a page change event.", revisionId);
                continue;
            }
            VisibilityChange change = visibilityChanges.get(revisionId);
            if (change == null) {
                LOG.error("Revision {} not found in the visibility changes. "
                        + "Cannot create a page change event.", revisionId);
                continue;
            }
            if (page.latestRevisionId() == null || revisionId.longValue() != page.latestRevisionId()) {
                continue;
            }
            if (revision.visibility() != change.newBits()) {
                throw new IllegalArgumentException("Current revision " + revisionId + " has visibility "
                        + revision.visibility() + " but the change sets it to " + change.newBits() + ".");
            }
            if (change.oldBits() == change.newBits()) {
                LOG.warn("Visibility of revision {} did not change ({}).", revisionId, change.newBits());
            }
            String stream = stream();
            queue(updates, stream, eventFactory.createVisibilityChangeEvent(stream, page, performer, revision,
                    change.oldBits(), null));
            break;
        }
    }

    @Nullable
    private Revision parentOf(Revision revision) {
        if (revision.parentId() == null || revision.parentId() <= 0) return null;
        return revisionLookup.getRevisionById(revision.parentId());
    }

    private String stream() {
        return streamNameMapper.resolve(PAGE_CHANGE_STREAM);
    }

    private void queue(DeferredUpdates updates, String stream, Event event) {
        updates.add(EventBusSendUpdate.newForStream(eventBusFactory, stream, Collections.singletonList(event)));
    }
}
