package org.wikimedia.eventbus.common;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.model.Block;
import org.wikimedia.eventbus.common.model.BlockRestriction;
import org.wikimedia.eventbus.common.model.CampaignSettings;
import org.wikimedia.eventbus.common.model.JobSpecification;
import org.wikimedia.eventbus.common.model.Page;
import org.wikimedia.eventbus.common.model.Performer;
import org.wikimedia.eventbus.common.model.RecentChange;
import org.wikimedia.eventbus.common.model.Revision;
import org.wikimedia.eventbus.common.model.SuppressedDataException;
import org.wikimedia.eventbus.common.model.Title;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.common.html.HtmlEscapers;

/**
 * Builds events out of wiki state changes.
 *
 * Each event kind has its own method taking the plain data it needs. No
 * method performs I/O or modifies its arguments.
 */
@SuppressWarnings("checkstyle:classfanoutcomplexity")
public class EventFactory {
    public static final String PAGE_DELETE_SCHEMA = "/mediawiki/page/delete/1.0.0";
    public static final String PAGE_UNDELETE_SCHEMA = "/mediawiki/page/undelete/1.0.0";
    public static final String PAGE_MOVE_SCHEMA = "/mediawiki/page/move/1.0.0";
    public static final String REVISION_CREATE_SCHEMA = "/mediawiki/revision/create/1.1.0";
    public static final String REVISION_TAGS_CHANGE_SCHEMA = "/mediawiki/revision/tags-change/1.0.0";
    public static final String REVISION_VISIBILITY_CHANGE_SCHEMA = "/mediawiki/revision/visibility-change/1.0.0";
    public static final String PAGE_PROPERTIES_CHANGE_SCHEMA = "/mediawiki/page/properties-change/1.0.0";
    public static final String PAGE_LINKS_CHANGE_SCHEMA = "/mediawiki/page/links-change/1.0.0";
    public static final String PAGE_RESTRICTIONS_CHANGE_SCHEMA = "/mediawiki/page/restrictions-change/1.0.0";
    public static final String USER_BLOCKS_CHANGE_SCHEMA = "/mediawiki/user/blocks-change/1.1.0";
    public static final String RESOURCE_CHANGE_SCHEMA = "/resource_change/1.0.0";
    public static final String RECENT_CHANGE_SCHEMA = "/mediawiki/recentchange/1.0.0";
    public static final String CAMPAIGN_CREATE_SCHEMA = "/mediawiki/centralnotice/campaign/create/1.0.0";
    public static final String CAMPAIGN_CHANGE_SCHEMA = "/mediawiki/centralnotice/campaign/change/1.0.0";
    public static final String CAMPAIGN_DELETE_SCHEMA = "/mediawiki/centralnotice/campaign/delete/1.0.0";
    public static final String JOB_SCHEMA = "/mediawiki/job/1.0.0";

    private static final ObjectWriter DEDUPLICATION_WRITER =
            JacksonUtil.DEFAULT_OBJECT_WRITER.with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final SiteInfo site;
    private final Supplier<RequestContext> requestContext;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final Function<String, String> commentFormatter;

    public EventFactory(SiteInfo site, Supplier<RequestContext> requestContext) {
        this(site, requestContext, Clock.systemUTC(), () -> UUID.randomUUID().toString(),
                HtmlEscapers.htmlEscaper()::escape);
    }

    /**
     * @param commentFormatter renders edit summaries to HTML for {@code parsedcomment}
     */
    public EventFactory(SiteInfo site, Supplier<RequestContext> requestContext, Clock clock,
                        Supplier<String> idGenerator, Function<String, String> commentFormatter) {
        this.site = site;
        this.requestContext = requestContext;
        this.clock = clock;
        this.idGenerator = idGenerator;
        this.commentFormatter = commentFormatter;
    }

    public SiteInfo site() {
        return site;
    }

    /**
     * Create an event for the local wiki, dated now.
     */
    public Event createEvent(String uri, String schema, String stream, Map<String, Object> attrs) {
        return createEvent(uri, schema, stream, attrs, null, null, null);
    }

    /**
     * Wrap attributes into an event with its {@code $schema} and {@code meta} block.
     *
     * @param wikiId wiki the event belongs to, the local wiki when null
     * @param dt time of the event, now when null
     * @param requestId request id, taken from the current request when null
     */
    public Event createEvent(String uri, String schema, String stream, Map<String, Object> attrs,
                             @Nullable String wikiId, @Nullable Instant dt, @Nullable String requestId) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("uri", uri);
        meta.put("request_id", requestId != null ? requestId : requestContext.get().requestId());
        meta.put("id", idGenerator.get());
        meta.put("dt", (dt != null ? dt : clock.instant()).toString());
        String domain = site.domainOf(wikiId);
        if (domain != null) {
            meta.put("domain", domain);
        }
        meta.put("stream", stream);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(Event.SCHEMA_FIELD, schema);
        fields.put(Event.META_FIELD, meta);
        attrs.forEach((k, v) -> {
            if (!Event.SCHEMA_FIELD.equals(k) && !Event.META_FIELD.equals(k)) fields.put(k, v);
        });
        return new Event(fields);
    }

    public Event createPageDeleteEvent(String stream, Performer performer, Page page, @Nullable String reason,
                                       @Nullable Long archivedRevisionCount) {
        Map<String, Object> attrs = pageAttrs(page);
        attrs.put("performer", performerAttrs(performer));
        if (page.latestRevisionId() != null) {
            attrs.put("rev_id", page.latestRevisionId());
        }
        if (archivedRevisionCount != null) {
            attrs.put("rev_count", archivedRevisionCount);
        }
        putComment(attrs, reason);
        return createEvent(site.articleUrl(page.title().prefixedDbKey()), PAGE_DELETE_SCHEMA, stream, attrs);
    }

    /**
     * @param oldPageId id the page had before deletion, only emitted when it changed
     */
    public Event createPageUndeleteEvent(String stream, Performer performer, Page page, @Nullable String reason,
                                         long oldPageId) {
        Map<String, Object> attrs = pageAttrs(page);
        attrs.put("performer", performerAttrs(performer));
        if (page.latestRevisionId() != null) {
            attrs.put("rev_id", page.latestRevisionId());
        }
        if (oldPageId > 0 && oldPageId != page.id()) {
            attrs.put("prior_state", singletonMap("page_id", oldPageId));
        }
        putComment(attrs, reason);
        return createEvent(site.articleUrl(page.title().prefixedDbKey()), PAGE_UNDELETE_SCHEMA, stream, attrs);
    }

    /**
     * @param newRevision the null revision created by the move, its title is the new title
     * @param redirectPageId id of the redirect left behind, null if none was created
     * @param redirectRevisionId revision of the redirect left behind
     */
    public Event createPageMoveEvent(String stream, Title oldTitle, Revision newRevision, Performer performer,
                                     @Nullable String reason,
                                     @Nullable Long redirectPageId, @Nullable Long redirectRevisionId) {
        Title newTitle = newRevision.title();
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("database", site.dbName());
        attrs.put("performer", performerAttrs(performer));
        attrs.put("page_id", newRevision.pageId());
        attrs.put("page_title", newTitle.prefixedDbKey());
        attrs.put("page_namespace", newTitle.namespace());
        attrs.put("page_is_redirect", isRedirect(newRevision));
        attrs.put("rev_id", newRevision.id());

        Map<String, Object> priorState = new LinkedHashMap<>();
        priorState.put("page_title", oldTitle.prefixedDbKey());
        priorState.put("page_namespace", oldTitle.namespace());
        if (newRevision.parentId() != null && newRevision.parentId() > 0) {
            priorState.put("rev_id", newRevision.parentId());
        }
        attrs.put("prior_state", priorState);

        if (redirectPageId != null && redirectPageId > 0) {
            // The redirect takes over the title the page had before the move
            Map<String, Object> redirect = new LinkedHashMap<>();
            redirect.put("page_id", redirectPageId);
            redirect.put("page_title", oldTitle.prefixedDbKey());
            redirect.put("page_namespace", oldTitle.namespace());
            if (redirectRevisionId != null) {
                redirect.put("rev_id", redirectRevisionId);
            }
            attrs.put("new_redirect_page", redirect);
        }
        putComment(attrs, reason);
        return createEvent(site.articleUrl(newTitle.prefixedDbKey()), PAGE_MOVE_SCHEMA, stream, attrs);
    }

    public Event createRevisionCreateEvent(String stream, Revision revision, boolean contentChanged) {
        Map<String, Object> attrs = revisionAttrs(revision);
        attrs.put("rev_content_changed", contentChanged);
        return createEvent(site.articleUrl(revision.title().prefixedDbKey()), REVISION_CREATE_SCHEMA, stream, attrs);
    }

    /**
     * A page creation is described by its first revision.
     */
    public Event createPageCreateEvent(String stream, Revision revision) {
        return createEvent(site.articleUrl(revision.title().prefixedDbKey()), REVISION_CREATE_SCHEMA, stream,
                revisionAttrs(revision));
    }

    /**
     * @param performer who changed the tags, the revision author is used when null
     */
    public Event createRevisionTagsChangeEvent(String stream, Revision revision, List<String> previousTags,
                                               List<String> addedTags, List<String> removedTags,
                                               @Nullable Performer performer) {
        Map<String, Object> attrs = revisionAttrs(revision);
        if (performer != null) {
            attrs.put("performer", performerAttrs(performer));
        }
        Set<String> tags = new LinkedHashSet<>(previousTags);
        tags.addAll(addedTags);
        tags.removeAll(removedTags);
        attrs.put("tags", new ArrayList<>(tags));
        attrs.put("prior_state", singletonMap("tags", new ArrayList<>(previousTags)));
        return createEvent(site.articleUrl(revision.title().prefixedDbKey()), REVISION_TAGS_CHANGE_SCHEMA,
                stream, attrs);
    }

    public Event createRevisionVisibilityChangeEvent(String stream, Revision revision, Performer performer,
                                                     int oldBits, int newBits) {
        Map<String, Object> attrs = revisionAttrs(revision);
        attrs.put("performer", performerAttrs(performer));
        attrs.put("visibility", visibility(newBits));
        attrs.put("prior_state", singletonMap("visibility", visibility(oldBits)));
        return createEvent(site.articleUrl(revision.title().prefixedDbKey()), REVISION_VISIBILITY_CHANGE_SCHEMA,
                stream, attrs);
    }

    /**
     * Property values may be raw bytes, those are made JSON safe.
     */
    public Event createPagePropertiesChangeEvent(String stream, Page page, Map<String, Object> addedProperties,
                                                 Map<String, Object> removedProperties,
                                                 @Nullable Performer performer, long revisionId) {
        Map<String, Object> attrs = pageAttrs(page);
        attrs.put("rev_id", revisionId);
        if (performer != null) {
            attrs.put("performer", performerAttrs(performer));
        }
        if (!addedProperties.isEmpty()) {
            attrs.put("added_properties", BinaryValues.replaceRecursive(addedProperties));
        }
        if (!removedProperties.isEmpty()) {
            attrs.put("removed_properties", BinaryValues.replaceRecursive(removedProperties));
        }
        return createEvent(site.articleUrl(page.title().prefixedDbKey()), PAGE_PROPERTIES_CHANGE_SCHEMA,
                stream, attrs);
    }

    /**
     * Internal links are emitted as local URLs, external links as they are.
     */
    public Event createPageLinksChangeEvent(String stream, Page page,
                                            List<Title> addedLinks, List<String> addedExternalLinks,
                                            List<Title> removedLinks, List<String> removedExternalLinks,
                                            @Nullable Performer performer, long revisionId) {
        Map<String, Object> attrs = pageAttrs(page);
        attrs.put("rev_id", revisionId);
        if (performer != null) {
            attrs.put("performer", performerAttrs(performer));
        }
        List<Map<String, Object>> added = links(addedLinks, addedExternalLinks);
        if (!added.isEmpty()) {
            attrs.put("added_links", added);
        }
        List<Map<String, Object>> removed = links(removedLinks, removedExternalLinks);
        if (!removed.isEmpty()) {
            attrs.put("removed_links", removed);
        }
        return createEvent(site.articleUrl(page.title().prefixedDbKey()), PAGE_LINKS_CHANGE_SCHEMA, stream, attrs);
    }

    /**
     * @param restrictions protection level per action, for example {@code edit -> sysop}
     */
    public Event createPageRestrictionsChangeEvent(String stream, Performer performer, Page page,
                                                   @Nullable String reason, Map<String, String> restrictions) {
        Map<String, Object> attrs = pageAttrs(page);
        attrs.put("performer", performerAttrs(performer));
        if (page.latestRevisionId() != null) {
            attrs.put("rev_id", page.latestRevisionId());
        }
        attrs.put("reason", reason == null ? "" : reason);
        attrs.put("page_restrictions", new LinkedHashMap<>(restrictions));
        return createEvent(site.articleUrl(page.title().prefixedDbKey()), PAGE_RESTRICTIONS_CHANGE_SCHEMA,
                stream, attrs);
    }

    /**
     * @param previousBlock the block replaced by this one, null for a new block
     */
    public Event createUserBlockChangeEvent(String stream, Performer performer, Block block,
                                            @Nullable Block previousBlock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("database", site.dbName());
        attrs.put("performer", performerAttrs(performer));
        putComment(attrs, block.reason());
        attrs.put("user_text", block.target());
        if (block.targetsUser()) {
            if (block.targetUserId() != null && block.targetUserId() > 0) {
                attrs.put("user_id", block.targetUserId());
            }
            attrs.put("user_groups", new ArrayList<>(block.targetGroups()));
        }
        attrs.put("blocks", blockAttrs(block));
        if (previousBlock != null) {
            attrs.put("prior_state", singletonMap("blocks", blockAttrs(previousBlock)));
        }
        return createEvent(site.userPageUrl(block.target()), USER_BLOCKS_CHANGE_SCHEMA, stream, attrs);
    }

    public Event createResourceChangeEvent(String stream, String url, List<String> tags, @Nullable Instant dt) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("tags", new ArrayList<>(tags));
        return createEvent(url, RESOURCE_CHANGE_SCHEMA, stream, attrs, null, dt, null);
    }

    /**
     * Recent change events drop every null value, fields that do not apply
     * to the change type are absent rather than null.
     */
    @SuppressWarnings("unchecked")
    public Event createRecentChangeEvent(String stream, RecentChange rc) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("id", rc.id());
        attrs.put("type", rc.type());
        attrs.put("namespace", rc.title().namespace());
        attrs.put("title", rc.title().prefixedDbKey().replace('_', ' '));
        attrs.put("comment", rc.comment());
        attrs.put("timestamp", rc.timestamp().getEpochSecond());
        attrs.put("user", rc.user());
        attrs.put("bot", rc.bot());
        attrs.put("minor", rc.minor());
        attrs.put("patrolled", rc.patrolled());
        if (rc.oldLength() != null || rc.newLength() != null) {
            Map<String, Object> length = new LinkedHashMap<>();
            length.put("old", rc.oldLength());
            length.put("new", rc.newLength());
            attrs.put("length", length);
        }
        if (rc.oldRevisionId() != null || rc.newRevisionId() != null) {
            Map<String, Object> revision = new LinkedHashMap<>();
            revision.put("old", rc.oldRevisionId());
            revision.put("new", rc.newRevisionId());
            attrs.put("revision", revision);
        }
        attrs.put("log_id", rc.logId());
        attrs.put("log_type", rc.logType());
        attrs.put("log_action", rc.logAction());
        attrs.put("log_action_comment", rc.logActionComment());
        attrs.put("server_url", site.canonicalServer());
        attrs.put("server_name", site.serverName());
        attrs.put("server_script_path", rc.serverScriptPath());
        attrs.put("wiki", site.dbName());
        attrs.put("parsedcomment", commentFormatter.apply(rc.comment()));

        Event event = createEvent(site.articleUrl(rc.title().prefixedDbKey()), RECENT_CHANGE_SCHEMA, stream,
                attrs, null, rc.timestamp(), null);
        return new Event((Map<String, Object>) removeNulls(event.fields()));
    }

    /**
     * @return empty when there are no settings after the change
     */
    public Optional<Event> createCampaignCreateEvent(String stream, String campaignName, Performer performer,
                                                     @Nullable CampaignSettings settings, @Nullable String summary,
                                                     String campaignUrl) {
        if (settings == null) return Optional.empty();
        Map<String, Object> attrs = campaignAttrs(campaignName, performer, summary);
        attrs.putAll(campaignSettingsAttrs(settings));
        return Optional.of(createEvent(campaignUrl, CAMPAIGN_CREATE_SCHEMA, stream, attrs));
    }

    /**
     * @return empty when there are no settings after the change
     */
    public Optional<Event> createCampaignChangeEvent(String stream, String campaignName, Performer performer,
                                                     @Nullable CampaignSettings settings,
                                                     @Nullable CampaignSettings priorSettings,
                                                     @Nullable String summary, String campaignUrl) {
        if (settings == null) return Optional.empty();
        Map<String, Object> attrs = campaignAttrs(campaignName, performer, summary);
        attrs.putAll(campaignSettingsAttrs(settings));
        attrs.put("prior_state", priorSettings == null ? new LinkedHashMap<>() : campaignSettingsAttrs(priorSettings));
        return Optional.of(createEvent(campaignUrl, CAMPAIGN_CHANGE_SCHEMA, stream, attrs));
    }

    public Event createCampaignDeleteEvent(String stream, String campaignName, Performer performer,
                                           @Nullable CampaignSettings priorSettings, @Nullable String summary,
                                           String campaignUrl) {
        Map<String, Object> attrs = campaignAttrs(campaignName, performer, summary);
        attrs.put("prior_state", priorSettings == null ? new LinkedHashMap<>() : campaignSettingsAttrs(priorSettings));
        return createEvent(campaignUrl, CAMPAIGN_DELETE_SCHEMA, stream, attrs);
    }

    /**
     * Build the unsigned event carrying a job.
     *
     * The request id is the one recorded in the job parameters when there is one.
     *
     * @param wikiId wiki the job runs on, the local wiki when null
     */
    public Event createJobEvent(String stream, @Nullable String wikiId, JobSpecification job) {
        Map<String, Object> params = new LinkedHashMap<>(job.params());
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("database", wikiId != null ? wikiId : site.dbName());
        attrs.put("type", job.type());
        attrs.put("page_namespace", job.title().namespace());
        attrs.put("page_title", job.title().prefixedDbKey());
        if (job.releaseTimestamp() != null) {
            attrs.put("delay_until", job.releaseTimestamp().toString());
        }
        if (job.ignoreDuplicates()) {
            attrs.put("sha1", deduplicationHash(job));
        }
        Object rootSignature = params.get(JobSpecification.ROOT_JOB_SIGNATURE);
        Object rootTimestamp = params.get(JobSpecification.ROOT_JOB_TIMESTAMP);
        if (rootSignature != null && rootTimestamp != null) {
            Map<String, Object> rootEvent = new LinkedHashMap<>();
            rootEvent.put("signature", rootSignature);
            rootEvent.put("dt", String.valueOf(rootTimestamp));
            attrs.put("root_event", rootEvent);
        }
        attrs.put("params", BinaryValues.replaceRecursive(params));

        Object requestId = params.get(JobSpecification.REQUEST_ID);
        return createEvent(site.articleUrl(job.title().prefixedDbKey()), JOB_SCHEMA, stream, attrs, wikiId, null,
                requestId instanceof String ? (String) requestId : null);
    }

    /**
     * Remove null values, recursively.
     *
     * Returns a new structure, the input is not modified.
     */
    public static Object removeNulls(Object value) {
        if (value instanceof Map) {
            Map<String, Object> pruned = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> {
                if (v != null) pruned.put(String.valueOf(k), removeNulls(v));
            });
            return pruned;
        }
        if (value instanceof List) {
            List<Object> pruned = new ArrayList<>();
            for (Object v : (List<?>) value) {
                if (v != null) pruned.add(removeNulls(v));
            }
            return pruned;
        }
        return value;
    }

    /**
     * Hex SHA-1 of the JSON form of {@link JobSpecification#deduplicationInfo()},
     * with map keys sorted and binary values encoded as they are in the event.
     *
     * @throws IllegalArgumentException if the job parameters cannot be written as JSON
     */
    @VisibleForTesting
    static String deduplicationHash(JobSpecification job) {
        try {
            byte[] info = DEDUPLICATION_WRITER.writeValueAsBytes(
                    BinaryValues.replaceRecursive(job.deduplicationInfo()));
            return Hashing.sha1().hashBytes(info).toString();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Parameters of job " + job.type() + " cannot be written as JSON", e);
        }
    }

    private Map<String, Object> performerAttrs(Performer performer) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("user_text", performer.userText());
        attrs.put("user_groups", new ArrayList<>(performer.groups()));
        attrs.put("user_is_bot", performer.isRegistered() && performer.bot());
        if (performer.isRegistered()) {
            attrs.put("user_id", performer.userId());
            if (performer.registration() != null) {
                attrs.put("user_registration_dt", performer.registration().toString());
            }
            if (performer.editCount() != null) {
                attrs.put("user_edit_count", performer.editCount());
            }
        }
        return attrs;
    }

    private Map<String, Object> pageAttrs(Page page) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("database", site.dbName());
        attrs.put("page_id", page.id());
        attrs.put("page_title", page.title().prefixedDbKey());
        attrs.put("page_namespace", page.title().namespace());
        attrs.put("page_is_redirect", page.redirect());
        return attrs;
    }

    private Map<String, Object> revisionAttrs(Revision revision) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("database", site.dbName());
        if (revision.performer() != null && !revision.isHidden(Revision.DELETED_USER)) {
            attrs.put("performer", performerAttrs(revision.performer()));
        }
        attrs.put("page_id", revision.pageId());
        attrs.put("page_title", revision.title().prefixedDbKey());
        attrs.put("page_namespace", revision.title().namespace());
        attrs.put("page_is_redirect", isRedirect(revision));
        attrs.put("rev_id", revision.id());
        attrs.put("rev_timestamp", revision.timestamp().toString());
        attrs.put("rev_sha1", revision.sha1());
        attrs.put("rev_len", revision.size());
        attrs.put("rev_minor_edit", revision.minor());
        attrs.put("rev_content_model", revision.contentModel());
        attrs.put("rev_content_format", revision.contentFormat());
        if (!revision.isHidden(Revision.DELETED_COMMENT)) {
            putComment(attrs, revision.comment());
        }
        // 0 is not a valid revision id, a missing parent means page creation
        if (revision.parentId() != null && revision.parentId() > 0) {
            attrs.put("rev_parent_id", revision.parentId());
        }
        return attrs;
    }

    private static boolean isRedirect(Revision revision) {
        if (revision.content() == null) return false;
        try {
            return revision.content().isRedirect();
        } catch (SuppressedDataException e) {
            return false;
        }
    }

    private void putComment(Map<String, Object> attrs, @Nullable String comment) {
        if (comment != null && !comment.isEmpty()) {
            attrs.put("comment", comment);
            attrs.put("parsedcomment", commentFormatter.apply(comment));
        }
    }

    private static Map<String, Object> visibility(int bits) {
        Map<String, Object> visibility = new LinkedHashMap<>();
        visibility.put("text", (bits & Revision.DELETED_TEXT) != Revision.DELETED_TEXT);
        visibility.put("user", (bits & Revision.DELETED_USER) != Revision.DELETED_USER);
        visibility.put("comment", (bits & Revision.DELETED_COMMENT) != Revision.DELETED_COMMENT);
        return visibility;
    }

    private List<Map<String, Object>> links(List<Title> internal, List<String> external) {
        List<Map<String, Object>> links = new ArrayList<>();
        for (Title title : internal) {
            links.add(link(site.localUrl(title.prefixedDbKey()), false));
        }
        for (String url : external) {
            links.add(link(url, true));
        }
        return links;
    }

    private static Map<String, Object> link(String link, boolean external) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("link", link);
        attrs.put("external", external);
        return attrs;
    }

    private static Map<String, Object> blockAttrs(Block block) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("name", block.hideName());
        attrs.put("email", block.preventsEmail());
        attrs.put("user_talk", block.preventsUserTalk());
        attrs.put("account_create", block.preventsAccountCreation());
        attrs.put("sitewide", block.sitewide());
        if (block.expiry() != null) {
            attrs.put("expiry_dt", block.expiry().toString());
        }
        if (!block.sitewide()) {
            List<Map<String, Object>> restrictions = new ArrayList<>();
            for (BlockRestriction restriction : block.restrictions()) {
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("type", restriction.type().wireName());
                r.put("value", restriction.value());
                restrictions.add(r);
            }
            attrs.put("restrictions", restrictions);
        }
        return attrs;
    }

    private Map<String, Object> campaignAttrs(String campaignName, Performer performer, @Nullable String summary) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("database", site.dbName());
        attrs.put("performer", performerAttrs(performer));
        attrs.put("campaign_name", campaignName);
        if (summary != null && !summary.isEmpty()) {
            attrs.put("summary", summary);
        }
        return attrs;
    }

    private static Map<String, Object> campaignSettingsAttrs(CampaignSettings settings) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("start_dt", settings.start().toString());
        attrs.put("end_dt", settings.end().toString());
        attrs.put("enabled", settings.enabled());
        attrs.put("archived", settings.archived());
        attrs.put("banners", ImmutableList.copyOf(settings.banners()));
        return attrs;
    }

    private static Map<String, Object> singletonMap(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
