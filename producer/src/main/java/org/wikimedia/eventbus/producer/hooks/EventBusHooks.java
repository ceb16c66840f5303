package org.wikimedia.eventbus.producer.hooks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventFactory;
import org.wikimedia.eventbus.common.model.Block;
import org.wikimedia.eventbus.common.model.Page;
import org.wikimedia.eventbus.common.model.Performer;
import org.wikimedia.eventbus.common.model.Revision;
import org.wikimedia.eventbus.common.model.Title;
import org.wikimedia.eventbus.producer.DeferredUpdates;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventBusSendUpdate;
import org.wikimedia.eventbus.producer.StreamNameMapper;

import com.google.common.collect.ImmutableList;

/**
 * Turns changes made to the wiki into events.
 *
 * Handlers only build the events and queue them in the {@link DeferredUpdates}
 * of the current request; they are sent once the request is done.
 */
@SuppressWarnings("checkstyle:classfanoutcomplexity")
public class EventBusHooks {
    public static final String PAGE_DELETE_STREAM = "mediawiki.page-delete";
    public static final String PAGE_UNDELETE_STREAM = "mediawiki.page-undelete";
    public static final String PAGE_MOVE_STREAM = "mediawiki.page-move";
    public static final String PAGE_CREATE_STREAM = "mediawiki.page-create";
    public static final String REVISION_CREATE_STREAM = "mediawiki.revision-create";
    public static final String REVISION_TAGS_CHANGE_STREAM = "mediawiki.revision-tags-change";
    public static final String REVISION_VISIBILITY_CHANGE_STREAM = "mediawiki.revision-visibility-change";
    public static final String PAGE_PROPERTIES_CHANGE_STREAM = "mediawiki.page-properties-change";
    public static final String PAGE_LINKS_CHANGE_STREAM = "mediawiki.page-links-change";
    public static final String PAGE_RESTRICTIONS_CHANGE_STREAM = "mediawiki.page-restrictions-change";
    public static final String USER_BLOCKS_CHANGE_STREAM = "mediawiki.user-blocks-change";
    public static final String RESOURCE_CHANGE_STREAM = "resource_change";

    private static final Logger LOG = LoggerFactory.getLogger(EventBusHooks.class);

    private final EventFactory eventFactory;
    private final EventBusFactory eventBusFactory;
    private final StreamNameMapper streamNameMapper;
    private final RevisionLookup revisionLookup;

    public EventBusHooks(EventFactory eventFactory, EventBusFactory eventBusFactory,
                         StreamNameMapper streamNameMapper, RevisionLookup revisionLookup) {
        this.eventFactory = eventFactory;
        this.eventBusFactory = eventBusFactory;
        this.streamNameMapper = streamNameMapper;
        this.revisionLookup = revisionLookup;
    }

    /**
     * @param archivedRevisionCount number of revisions moved to the archive, null when unknown
     */
    public void onPageDeleteComplete(DeferredUpdates updates, Performer performer, Page page,
                                     @Nullable String reason, @Nullable Long archivedRevisionCount) {
        String stream = stream(PAGE_DELETE_STREAM);
        queue(updates, stream, eventFactory.createPageDeleteEvent(stream, performer, page, reason,
                archivedRevisionCount));
    }

    public void onPageUndeleteComplete(DeferredUpdates updates, Performer performer, Page page,
                                       @Nullable String reason, long oldPageId) {
        String stream = stream(PAGE_UNDELETE_STREAM);
        queue(updates, stream, eventFactory.createPageUndeleteEvent(stream, performer, page, reason, oldPageId));
    }

    /**
     * @param redirectPageId page left as a redirect at the old title, null when none was created
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public void onPageMoveComplete(DeferredUpdates updates, Title oldTitle, Revision newRevision,
                                   Performer performer, @Nullable String reason,
                                   @Nullable Long redirectPageId, @Nullable Long redirectRevisionId) {
        String stream = stream(PAGE_MOVE_STREAM);
        queue(updates, stream, eventFactory.createPageMoveEvent(stream, oldTitle, newRevision, performer, reason,
                redirectPageId, redirectRevisionId));
    }

    /**
     * A page was saved.
     *
     * A null edit, one that did not create a revision, only signals that the
     * page should be re-rendered.
     *
     * @param revision the new revision, null for a null edit
     */
    public void onPageSaveComplete(DeferredUpdates updates, Title title, @Nullable Revision revision,
                                   boolean pageCreated, boolean contentChanged) {
        if (revision == null) {
            sendResourceChange(updates, title, "null_edit");
            return;
        }
        String revisionStream = stream(REVISION_CREATE_STREAM);
        queue(updates, revisionStream, eventFactory.createRevisionCreateEvent(revisionStream, revision,
                contentChanged));
        if (pageCreated) {
            String pageStream = stream(PAGE_CREATE_STREAM);
            queue(updates, pageStream, eventFactory.createPageCreateEvent(pageStream, revision));
        }
    }

    public void onArticlePurge(DeferredUpdates updates, Title title) {
        sendResourceChange(updates, title, "purge");
    }

    /**
     * Visibility of some revisions of a page changed.
     *
     * Revisions that cannot be loaded anymore, because the page was deleted
     * meanwhile, or that have no recorded change are skipped.
     */
    public void onRevisionVisibilitySet(DeferredUpdates updates, Performer performer, List<Long> revisionIds,
                                        Map<Long, VisibilityChange> visibilityChanges) {
        String stream = stream(REVISION_VISIBILITY_CHANGE_STREAM);
        List<Event> events = new ArrayList<>();
        for (Long revisionId : revisionIds) {
            Revision revision = revisionLookup.getRevisionById(revisionId);
            VisibilityChange change = visibilityChanges.get(revisionId);
            if (revision == null) {
                LOG.debug("Revision {} could not be found and may have been deleted. "
                        + "Cannot create a visibility change event.", revisionId);
            } else if (change == null) {
                LOG.debug("Revision {} not found in the visibility changes. "
                        + "Cannot create a visibility change event.", revisionId);
            } else {
                events.add(eventFactory.createRevisionVisibilityChangeEvent(stream, revision, performer,
                        change.oldBits(), change.newBits()));
            }
        }
        if (events.isEmpty()) return;
        updates.add(EventBusSendUpdate.newForStream(eventBusFactory, stream, events));
    }

    public void onUserBlockComplete(DeferredUpdates updates, Performer performer, Block block,
                                    @Nullable Block previousBlock) {
        String stream = stream(USER_BLOCKS_CHANGE_STREAM);
        queue(updates, stream, eventFactory.createUserBlockChangeEvent(stream, performer, block, previousBlock));
    }

    /**
     * Links or properties of a page changed, one event is produced for each
     * kind of change.
     */
    public void onLinksUpdateComplete(DeferredUpdates updates, LinksUpdate linksUpdate) {
        long revisionId = linksUpdate.revisionId();
        if (linksUpdate.hasPropertyChanges()) {
            String stream = stream(PAGE_PROPERTIES_CHANGE_STREAM);
            queue(updates, stream, eventFactory.createPagePropertiesChangeEvent(stream, linksUpdate.page(),
                    linksUpdate.addedProperties(), linksUpdate.removedProperties(),
                    linksUpdate.triggeringUser(), revisionId));
        }
        if (linksUpdate.hasLinkChanges()) {
            String stream = stream(PAGE_LINKS_CHANGE_STREAM);
            queue(updates, stream, eventFactory.createPageLinksChangeEvent(stream, linksUpdate.page(),
                    linksUpdate.addedLinks(), linksUpdate.addedExternalLinks(),
                    linksUpdate.removedLinks(), linksUpdate.removedExternalLinks(),
                    linksUpdate.triggeringUser(), revisionId));
        }
    }

    /**
     * @param restrictions new protection level by action, for example {@code edit => sysop}
     */
    public void onPageProtectComplete(DeferredUpdates updates, Performer performer, Page page,
                                      @Nullable String reason, Map<String, String> restrictions) {
        String stream = stream(PAGE_RESTRICTIONS_CHANGE_STREAM);
        queue(updates, stream, eventFactory.createPageRestrictionsChangeEvent(stream, performer, page, reason,
                restrictions));
    }

    /**
     * Tags of a revision changed. Only revision tags are of interest, changes
     * to tags of log entries or of revisions that no longer exist are ignored.
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public void onChangeTagsAfterUpdateTags(DeferredUpdates updates, List<String> addedTags,
                                            List<String> removedTags, List<String> previousTags,
                                            @Nullable Long revisionId, @Nullable Performer performer) {
        if (revisionId == null) return;
        Revision revision = revisionLookup.getRevisionById(revisionId);
        if (revision == null) return;
        String stream = stream(REVISION_TAGS_CHANGE_STREAM);
        queue(updates, stream, eventFactory.createRevisionTagsChangeEvent(stream, revision, previousTags,
                addedTags, removedTags, performer));
    }

    private void sendResourceChange(DeferredUpdates updates, Title title, String tag) {
        String stream = stream(RESOURCE_CHANGE_STREAM);
        queue(updates, stream, eventFactory.createResourceChangeEvent(stream,
                eventFactory.site().articleUrl(title.prefixedDbKey()), ImmutableList.of(tag), null));
    }

    private String stream(String defaultName) {
        return streamNameMapper.resolve(defaultName);
    }

    private void queue(DeferredUpdates updates, String stream, Event event) {
        updates.add(EventBusSendUpdate.newForStream(eventBusFactory, stream, Collections.singletonList(event)));
    }
}
