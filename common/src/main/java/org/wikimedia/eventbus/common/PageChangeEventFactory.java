package org.wikimedia.eventbus.common;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.model.Page;
import org.wikimedia.eventbus.common.model.Performer;
import org.wikimedia.eventbus.common.model.Revision;
import org.wikimedia.eventbus.common.model.RevisionSlot;
import org.wikimedia.eventbus.common.model.Title;

import com.google.common.annotations.VisibleForTesting;

/**
 * Builds {@code mediawiki/page/change} events, the state of a page after each change made to it.
 *
 * Every event carries the page, the current revision and the performer, and
 * a {@code prior_state} holding only what the change modified. Consumers
 * keeping a copy of the pages apply the {@code changelog_kind}: inserts,
 * updates and deletes.
 */
public class PageChangeEventFactory {
    public static final String PAGE_CHANGE_SCHEMA = "/mediawiki/page/change/1.0.0";

    private static final String PRIOR_STATE = "prior_state";
    private static final String REVISION = "revision";
    private static final String PAGE = "page";

    private final EventFactory eventFactory;
    private final Clock clock;

    public PageChangeEventFactory(EventFactory eventFactory) {
        this(eventFactory, Clock.systemUTC());
    }

    /**
     * @param clock gives the time of changes whose time is not known
     */
    public PageChangeEventFactory(EventFactory eventFactory, Clock clock) {
        this.eventFactory = eventFactory;
        this.clock = clock;
    }

    public Event createPageCreateEvent(String stream, Page page, Performer performer, Revision revision) {
        Map<String, Object> attrs = commonAttrs(PageChangeKind.CREATE, revision.timestamp(), page, performer,
                revision, null);
        return toEvent(stream, page, attrs);
    }

    /**
     * @param parentRevision revision replaced by this edit, null when it could not be loaded
     */
    public Event createPageEditEvent(String stream, Page page, Performer performer, Revision revision,
                                     @Nullable Revision parentRevision) {
        Map<String, Object> attrs = commonAttrs(PageChangeKind.EDIT, revision.timestamp(), page, performer,
                revision, null);
        if (parentRevision != null) {
            Map<String, Object> priorState = new LinkedHashMap<>();
            priorState.put(REVISION, revisionAttrs(parentRevision));
            attrs.put(PRIOR_STATE, priorState);
        }
        return toEvent(stream, page, attrs);
    }

    /**
     * A page was renamed. Moves create a revision, it is the time of the event.
     *
     * @param page the page under its new title
     * @param createdRedirectPage redirect left at the old title, null when none was created
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public Event createPageMoveEvent(String stream, Page page, Performer performer, Revision revision,
                                     Revision parentRevision, Title oldTitle, String reason,
                                     @Nullable Page createdRedirectPage) {
        Map<String, Object> attrs = commonAttrs(PageChangeKind.MOVE, revision.timestamp(), page, performer,
                revision, reason);
        if (createdRedirectPage != null) {
            attrs.put("created_redirect_page", pageAttrs(createdRedirectPage));
        }
        Map<String, Object> priorPage = new LinkedHashMap<>();
        priorPage.put("page_title", oldTitle.prefixedDbKey());
        Map<String, Object> priorState = new LinkedHashMap<>();
        priorState.put(PAGE, priorPage);
        priorState.put(REVISION, revisionAttrs(parentRevision));
        attrs.put(PRIOR_STATE, priorState);
        return toEvent(stream, page, attrs);
    }

    /**
     * A page was deleted.
     *
     * A suppression also hides the page from administrators: the revision is
     * marked fully hidden, stripped of what could reveal the hidden data, and
     * its previous visibility moves to the prior state. The performer is left
     * out of suppressions.
     *
     * @param performer null to leave the performer out
     * @param eventTime time of the deletion, now when null
     * @param archivedRevisionCount number of revisions moved to the archive, null when unknown
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public Event createPageDeleteEvent(String stream, Page page, @Nullable Performer performer, Revision revision,
                                       String reason, @Nullable Instant eventTime,
                                       @Nullable Long archivedRevisionCount, boolean suppression) {
        Map<String, Object> attrs = commonAttrs(PageChangeKind.DELETE, eventTime, page,
                suppression ? null : performer, revision, reason);
        if (archivedRevisionCount != null) {
            pageOf(attrs).put("revision_count", archivedRevisionCount);
        }
        if (suppression) {
            Map<String, Object> hidden = revisionOf(attrs);
            hidden.putAll(visibilityAttrs(Revision.SUPPRESSED_ALL));
            hidden.remove("rev_size");
            hidden.remove("rev_sha1");
            hidden.remove("comment");
            hidden.remove("editor");
            hidden.remove("content_slots");
            Map<String, Object> priorState = new LinkedHashMap<>();
            priorState.put(REVISION, visibilityAttrs(revision.visibility()));
            attrs.put(PRIOR_STATE, priorState);
        }
        return toEvent(stream, page, attrs);
    }

    /**
     * A deleted page was restored.
     *
     * @param eventTime time of the restoration, now when null
     * @param oldPageId id the page had before it was deleted, recorded in the
     *        prior state when it differs from the current one
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public Event createPageUndeleteEvent(String stream, Page page, Performer performer, Revision revision,
                                         String reason, @Nullable Instant eventTime, @Nullable Long oldPageId) {
        Map<String, Object> attrs = commonAttrs(PageChangeKind.UNDELETE, eventTime, page, performer, revision,
                reason);
        if (oldPageId != null && oldPageId != 0 && oldPageId != page.id()) {
            Map<String, Object> priorPage = new LinkedHashMap<>();
            priorPage.put("page_id", oldPageId);
            Map<String, Object> priorState = new LinkedHashMap<>();
            priorState.put(PAGE, priorPage);
            attrs.put(PRIOR_STATE, priorState);
        }
        return toEvent(stream, page, attrs);
    }

    /**
     * Visibility of the current revision of a page changed. The prior state
     * only holds the visibility fields that changed.
     *
     * @param priorVisibility visibility bit field before the change
     * @param eventTime time of the change, now when null
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public Event createVisibilityChangeEvent(String stream, Page page, Performer performer, Revision revision,
                                             int priorVisibility, @Nullable Instant eventTime) {
        Map<String, Object> attrs = commonAttrs(PageChangeKind.VISIBILITY_CHANGE, eventTime, page, performer,
                revision, null);
        Map<String, Object> current = revisionOf(attrs);
        Map<String, Object> changed = new LinkedHashMap<>();
        visibilityAttrs(priorVisibility).forEach((field, visible) -> {
            if (!visible.equals(current.get(field))) changed.put(field, visible);
        });
        Map<String, Object> priorState = new LinkedHashMap<>();
        priorState.put(REVISION, changed);
        attrs.put(PRIOR_STATE, priorState);
        return toEvent(stream, page, attrs);
    }

    public Map<String, Object> pageAttrs(Page page) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("page_id", page.id());
        attrs.put("page_title", page.title().prefixedDbKey());
        attrs.put("namespace_id", page.title().namespace());
        attrs.put("is_redirect", page.redirect());
        return attrs;
    }

    public Map<String, Object> userAttrs(Performer user) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("user_text", user.userText());
        attrs.put("groups", new ArrayList<>(user.groups()));
        attrs.put("is_bot", user.isRegistered() && user.bot());
        attrs.put("is_registered", user.isRegistered());
        attrs.put("is_system", user.system());
        attrs.put("is_temp", user.temp());
        if (user.isRegistered()) {
            attrs.put("user_id", user.userId());
        }
        if (user.registration() != null) {
            attrs.put("registration_dt", user.registration().toString());
        }
        if (user.isRegistered()) {
            attrs.put("edit_count", user.editCount() == null ? 0L : user.editCount());
        }
        return attrs;
    }

    /**
     * The revision entity. A hidden comment is left out while an empty one is
     * kept, a hidden editor is left out.
     */
    public Map<String, Object> revisionAttrs(Revision revision) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("rev_id", revision.id());
        attrs.put("rev_dt", revision.timestamp().toString());
        attrs.put("is_minor_edit", revision.minor());
        attrs.put("rev_sha1", revision.sha1());
        attrs.put("rev_size", revision.size());
        if (revision.parentId() != null && revision.parentId() > 0) {
            attrs.put("rev_parent_id", revision.parentId());
        }
        if (revision.comment() != null) {
            attrs.put("comment", revision.comment());
        }
        if (revision.performer() != null) {
            attrs.put("editor", userAttrs(revision.performer()));
        }
        attrs.putAll(visibilityAttrs(revision.visibility()));
        if (!revision.slots().isEmpty()) {
            Map<String, Object> slots = new LinkedHashMap<>();
            for (RevisionSlot slot : revision.slots()) {
                slots.put(slot.role(), slotAttrs(slot));
            }
            attrs.put("content_slots", slots);
        }
        return attrs;
    }

    @VisibleForTesting
    static Map<String, Object> slotAttrs(RevisionSlot slot) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("slot_role", slot.role());
        attrs.put("content_model", slot.contentModel());
        attrs.put("content_sha1", slot.contentSha1());
        attrs.put("content_size", slot.contentSize());
        if (slot.contentFormat() != null) {
            attrs.put("content_format", slot.contentFormat());
        }
        if (slot.originRevisionId() != null) {
            attrs.put("origin_rev_id", slot.originRevisionId());
        }
        return attrs;
    }

    public static Map<String, Object> visibilityAttrs(int hiddenBits) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("is_content_visible", isVisible(hiddenBits, Revision.DELETED_TEXT));
        attrs.put("is_editor_visible", isVisible(hiddenBits, Revision.DELETED_USER));
        attrs.put("is_comment_visible", isVisible(hiddenBits, Revision.DELETED_COMMENT));
        return attrs;
    }

    private static boolean isVisible(int hiddenBits, int field) {
        return (hiddenBits & field) != field;
    }

    private Map<String, Object> commonAttrs(PageChangeKind kind, @Nullable Instant dt, Page page,
                                            @Nullable Performer performer, Revision revision,
                                            @Nullable String comment) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("changelog_kind", kind.changelogKind());
        attrs.put("page_change_kind", kind.kindName());
        attrs.put("dt", (dt != null ? dt : clock.instant()).toString());
        attrs.put("wiki_id", eventFactory.site().dbName());
        attrs.put(PAGE, pageAttrs(page));
        if (performer != null) {
            attrs.put("performer", userAttrs(performer));
        }
        if (comment != null) {
            attrs.put("comment", comment);
        }
        attrs.put(REVISION, revisionAttrs(revision));
        return attrs;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> pageOf(Map<String, Object> attrs) {
        return (Map<String, Object>) attrs.get(PAGE);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> revisionOf(Map<String, Object> attrs) {
        return (Map<String, Object>) attrs.get(REVISION);
    }

    private Event toEvent(String stream, Page page, Map<String, Object> attrs) {
        return eventFactory.createEvent(eventFactory.site().articleUrl(page.title().prefixedDbKey()),
                PAGE_CHANGE_SCHEMA, stream, attrs);
    }
}
