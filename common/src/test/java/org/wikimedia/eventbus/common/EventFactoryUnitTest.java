package org.wikimedia.eventbus.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.wikimedia.eventbus.common.EventTestUtils.DB_NAME;
import static org.wikimedia.eventbus.common.EventTestUtils.DOMAIN;
import static org.wikimedia.eventbus.common.EventTestUtils.NOW;
import static org.wikimedia.eventbus.common.EventTestUtils.REQUEST_ID;
import static org.wikimedia.eventbus.common.EventTestUtils.page;
import static org.wikimedia.eventbus.common.EventTestUtils.performer;
import static org.wikimedia.eventbus.common.EventTestUtils.revision;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.wikimedia.eventbus.common.model.Block;
import org.wikimedia.eventbus.common.model.BlockRestriction;
import org.wikimedia.eventbus.common.model.JobSpecification;
import org.wikimedia.eventbus.common.model.Page;
import org.wikimedia.eventbus.common.model.Performer;
import org.wikimedia.eventbus.common.model.RecentChange;
import org.wikimedia.eventbus.common.model.Revision;
import org.wikimedia.eventbus.common.model.SuppressedDataException;
import org.wikimedia.eventbus.common.model.Title;
import org.wikimedia.eventbus.test.ManualClock;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.Hashing;

@SuppressWarnings("unchecked")
public class EventFactoryUnitTest {

    private ManualClock clock;
    private EventFactory factory;

    @Before
    public void setUp() {
        clock = new ManualClock(NOW);
        factory = EventTestUtils.newFactory(clock);
    }

    @Test
    public void createEventAddsSchemaAndMeta() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("k", "v");
        Event event = factory.createEvent("https://test.wikipedia.org/wiki/Foo", "/test/1.0.0", "test.stream", attrs);

        assertThat(event.schema()).isEqualTo("/test/1.0.0");
        assertThat(event.get("k")).isEqualTo("v");
        assertThat(event.meta())
                .containsEntry("uri", "https://test.wikipedia.org/wiki/Foo")
                .containsEntry("stream", "test.stream")
                .containsEntry("id", "id-1")
                .containsEntry("request_id", REQUEST_ID)
                .containsEntry("domain", DOMAIN)
                .containsEntry("dt", "2021-03-04T05:06:07Z");
        assertThat(attrs).containsOnlyKeys("k");
    }

    @Test
    public void createEventForAnotherWiki() {
        Event event = factory.createEvent("uri", "/test/1.0.0", "s", Collections.emptyMap(),
                "otherwiki", Instant.parse("2000-01-01T00:00:00Z"), "req");
        assertThat(event.meta())
                .containsEntry("domain", "other.wikipedia.org")
                .containsEntry("dt", "2000-01-01T00:00:00Z")
                .containsEntry("request_id", "req");

        Event unknown = factory.createEvent("uri", "/test/1.0.0", "s", Collections.emptyMap(),
                "unknownwiki", null, null);
        assertThat(unknown.meta()).doesNotContainKey("domain");
    }

    @Test
    public void buildingTwiceOnlyChangesIdAndTime() {
        Event first = factory.createPageDeleteEvent("mediawiki.page-delete", performer(), page(23, "Test"),
                "testreason", 3L);
        clock.advance(Duration.ofSeconds(5));
        Event second = factory.createPageDeleteEvent("mediawiki.page-delete", performer(), page(23, "Test"),
                "testreason", 3L);

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.meta().get("dt")).isNotEqualTo(second.meta().get("dt"));
        assertThat(withoutIdAndTime(first)).isEqualTo(withoutIdAndTime(second));
    }

    @Test
    public void pageDelete() {
        Event event = factory.createPageDeleteEvent("mediawiki.page-delete", performer(), page(23, "Test"),
                "testreason", null);

        assertThat(event.schema()).isEqualTo(EventFactory.PAGE_DELETE_SCHEMA);
        assertThat(event.get("page_id")).isEqualTo(23L);
        assertThat(event.get("page_title")).isEqualTo("Test");
        assertThat(event.get("comment")).isEqualTo("testreason");
        assertThat(event.get("parsedcomment")).isEqualTo("<span>testreason</span>");
        assertThat(event.get("database")).isEqualTo(DB_NAME);
        assertThat(event.get("rev_id")).isEqualTo(1234L);
        assertThat(event.stream()).isEqualTo("mediawiki.page-delete");
        assertThat(event.meta()).containsEntry("uri", "https://test.wikipedia.org/wiki/Test");
        assertThat(event.has("rev_count")).isFalse();
    }

    @Test
    public void pageDeleteWithArchivedRevisions() {
        Event event = factory.createPageDeleteEvent("mediawiki.page-delete", performer(), page(23, "Test"),
                "", 7L);
        assertThat(event.get("rev_count")).isEqualTo(7L);
        assertThat(event.has("comment")).isFalse();
    }

    @Test
    public void performerAttributes() {
        Event event = factory.createPageDeleteEvent("s", performer(), page(1, "A"), null, null);
        Map<String, Object> performer = (Map<String, Object>) event.get("performer");
        assertThat(performer)
                .containsEntry("user_text", "Tester")
                .containsEntry("user_id", 42L)
                .containsEntry("user_is_bot", false)
                .containsEntry("user_edit_count", 10L)
                .containsEntry("user_registration_dt", "2019-01-01T00:00:00Z")
                .containsEntry("user_groups", Arrays.asList("*", "user"));

        Performer anonymous = Performer.builder().userText("127.0.0.1").group("*").bot(true).build();
        Map<String, Object> anon = (Map<String, Object>) factory
                .createPageDeleteEvent("s", anonymous, page(1, "A"), null, null).get("performer");
        assertThat(anon).containsOnlyKeys("user_text", "user_groups", "user_is_bot");
        assertThat(anon).containsEntry("user_is_bot", false);
    }

    @Test
    public void pageUndeleteKeepsPriorPageIdOnlyWhenChanged() {
        Event same = factory.createPageUndeleteEvent("mediawiki.page-undelete", performer(), page(5, "A"),
                "restore", 5);
        assertThat(same.has("prior_state")).isFalse();

        Event changed = factory.createPageUndeleteEvent("mediawiki.page-undelete", performer(), page(5, "A"),
                "restore", 4);
        assertThat((Map<String, Object>) changed.get("prior_state")).containsEntry("page_id", 4L);
        assertThat(changed.schema()).isEqualTo(EventFactory.PAGE_UNDELETE_SCHEMA);
    }

    @Test
    public void pageMove() {
        Revision moved = revision().title(new Title(1, "Talk:New_name")).build();
        Event event = factory.createPageMoveEvent("mediawiki.page-move", new Title(0, "Old_name"), moved,
                performer(), "renaming", 99L, 100L);

        assertThat(event.get("page_title")).isEqualTo("Talk:New_name");
        assertThat(event.get("page_namespace")).isEqualTo(1);
        assertThat((Map<String, Object>) event.get("prior_state"))
                .containsEntry("page_title", "Old_name")
                .containsEntry("page_namespace", 0)
                .containsEntry("rev_id", 1234L);
        assertThat((Map<String, Object>) event.get("new_redirect_page"))
                .containsEntry("page_id", 99L)
                .containsEntry("page_title", "Old_name")
                .containsEntry("rev_id", 100L);
        assertThat(event.meta()).containsEntry("uri", "https://test.wikipedia.org/wiki/Talk:New_name");
    }

    @Test
    public void pageMoveWithSuppressedContentIsNotARedirect() {
        Revision moved = revision().content(() -> {
            throw new SuppressedDataException("hidden");
        }).build();
        Event event = factory.createPageMoveEvent("mediawiki.page-move", new Title(0, "Old"), moved,
                performer(), null, null, null);

        assertThat(event.get("page_is_redirect")).isEqualTo(false);
        assertThat(event.has("new_redirect_page")).isFalse();
    }

    @Test
    public void revisionCreate() {
        Event event = factory.createRevisionCreateEvent("mediawiki.revision-create",
                revision().content(() -> true).build(), true);

        assertThat(event.schema()).isEqualTo(EventFactory.REVISION_CREATE_SCHEMA);
        assertThat(event.get("rev_id")).isEqualTo(1235L);
        assertThat(event.get("rev_parent_id")).isEqualTo(1234L);
        assertThat(event.get("rev_content_changed")).isEqualTo(true);
        assertThat(event.get("page_is_redirect")).isEqualTo(true);
        assertThat(event.get("rev_timestamp")).isEqualTo("2021-03-04T05:06:07Z");
        assertThat(event.get("rev_sha1")).isEqualTo("rdqbbzs3pkhihgbs8qf2q9jsvheag5z");
        assertThat(event.get("comment")).isEqualTo("edit summary");
    }

    @Test
    public void parentIdIsOmittedOnPageCreation() {
        assertThat(factory.createPageCreateEvent("mediawiki.page-create", revision().parentId(0L).build())
                .has("rev_parent_id")).isFalse();
        assertThat(factory.createPageCreateEvent("mediawiki.page-create", revision().parentId(null).build())
                .has("rev_parent_id")).isFalse();
    }

    @Test
    public void hiddenRevisionFieldsAreNotEmitted() {
        Revision hidden = revision()
                .visibility(Revision.DELETED_USER | Revision.DELETED_COMMENT)
                .content(null)
                .build();
        Event event = factory.createRevisionCreateEvent("s", hidden, false);
        assertThat(event.has("performer")).isFalse();
        assertThat(event.has("comment")).isFalse();
        assertThat(event.get("page_is_redirect")).isEqualTo(false);
    }

    @Test
    public void revisionTagsChange() {
        Event event = factory.createRevisionTagsChangeEvent("mediawiki.revision-tags-change", revision().build(),
                ImmutableList.of("a", "b"), ImmutableList.of("c", "a"), ImmutableList.of("b"), null);

        assertThat((List<String>) event.get("tags")).containsExactly("a", "c");
        assertThat((Map<String, Object>) event.get("prior_state")).containsEntry("tags", Arrays.asList("a", "b"));
        assertThat((Map<String, Object>) event.get("performer")).containsEntry("user_text", "Tester");
    }

    @Test
    public void revisionVisibilityChange() {
        Event event = factory.createRevisionVisibilityChangeEvent("mediawiki.revision-visibility-change",
                revision().build(), performer(), 0, Revision.DELETED_TEXT | Revision.DELETED_USER);

        assertThat((Map<String, Object>) event.get("visibility"))
                .containsEntry("text", false)
                .containsEntry("user", false)
                .containsEntry("comment", true);
        Map<String, Object> prior = (Map<String, Object>) event.get("prior_state");
        assertThat((Map<String, Object>) prior.get("visibility"))
                .containsEntry("text", true)
                .containsEntry("user", true)
                .containsEntry("comment", true);
    }

    @Test
    public void pagePropertiesChangeEncodesBinaryValues() {
        byte[] binary = {(byte) 0xFF, (byte) 0xFE, 0x00};
        Event event = factory.createPagePropertiesChangeEvent("mediawiki.page-properties-change", page(3, "P"),
                ImmutableMap.of("wikibase_item", "Q42", "blob", binary), Collections.emptyMap(), performer(), 9L);

        Map<String, Object> added = (Map<String, Object>) event.get("added_properties");
        assertThat(added).containsEntry("wikibase_item", "Q42");
        assertThat(added).containsEntry("blob", BinaryValues.encode(binary));
        assertThat(event.has("removed_properties")).isFalse();
        assertThat(event.get("rev_id")).isEqualTo(9L);
    }

    @Test
    public void pageLinksChange() {
        Event event = factory.createPageLinksChangeEvent("mediawiki.page-links-change", page(3, "P"),
                ImmutableList.of(new Title(0, "Foo/Bar?")), ImmutableList.of("https://example.org"),
                Collections.emptyList(), Collections.emptyList(), null, 9L);

        List<Map<String, Object>> added = (List<Map<String, Object>>) event.get("added_links");
        assertThat(added).hasSize(2);
        assertThat(added.get(0)).containsEntry("link", "/wiki/Foo/Bar%3F").containsEntry("external", false);
        assertThat(added.get(1)).containsEntry("link", "https://example.org").containsEntry("external", true);
        assertThat(event.has("removed_links")).isFalse();
        assertThat(event.has("performer")).isFalse();
    }

    @Test
    public void pageRestrictionsChange() {
        Event event = factory.createPageRestrictionsChangeEvent("mediawiki.page-restrictions-change", performer(),
                page(3, "P"), "vandalism", ImmutableMap.of("edit", "sysop", "move", "sysop"));

        assertThat(event.get("reason")).isEqualTo("vandalism");
        assertThat((Map<String, Object>) event.get("page_restrictions"))
                .containsEntry("edit", "sysop")
                .containsEntry("move", "sysop");
    }

    @Test
    public void userBlockOnRegisteredUser() {
        Block previous = Block.builder().target("Vandal").targetUserId(7L).targetGroups(ImmutableList.of("user"))
                .reason("first").sitewide(true).build();
        Block block = Block.builder().target("Vandal").targetUserId(7L).targetGroups(ImmutableList.of("user"))
                .reason("spam").preventsEmail(true).sitewide(false)
                .restriction(BlockRestriction.namespace(0))
                .restriction(BlockRestriction.page(12))
                .expiry(Instant.parse("2030-01-01T00:00:00Z"))
                .build();
        Event event = factory.createUserBlockChangeEvent("mediawiki.user-blocks-change", performer(), block, previous);

        assertThat(event.get("user_text")).isEqualTo("Vandal");
        assertThat(event.get("user_id")).isEqualTo(7L);
        assertThat(event.get("user_groups")).isEqualTo(Collections.singletonList("user"));
        assertThat(event.meta()).containsEntry("uri", "https://test.wikipedia.org/wiki/User:Vandal");
        Map<String, Object> blocks = (Map<String, Object>) event.get("blocks");
        assertThat(blocks)
                .containsEntry("email", true)
                .containsEntry("sitewide", false)
                .containsEntry("expiry_dt", "2030-01-01T00:00:00Z");
        List<Map<String, Object>> restrictions = (List<Map<String, Object>>) blocks.get("restrictions");
        assertThat(restrictions.get(0)).containsEntry("type", "ns").containsEntry("value", 0L);
        assertThat(restrictions.get(1)).containsEntry("type", "page").containsEntry("value", 12L);
        Map<String, Object> prior = (Map<String, Object>) ((Map<String, Object>) event.get("prior_state")).get("blocks");
        assertThat(prior).containsEntry("sitewide", true).doesNotContainKeys("expiry_dt", "restrictions");
    }

    @Test
    public void userBlockOnIp() {
        Block block = Block.builder().target("10.0.0.1").reason("").sitewide(true).build();
        Event event = factory.createUserBlockChangeEvent("mediawiki.user-blocks-change", performer(), block, null);

        assertThat(event.has("user_id")).isFalse();
        assertThat(event.has("user_groups")).isFalse();
        assertThat(event.has("prior_state")).isFalse();
    }

    @Test
    public void resourceChange() {
        Instant dt = Instant.parse("2021-01-01T00:00:00Z");
        Event event = factory.createResourceChangeEvent("resource-purge", "https://test.wikipedia.org/wiki/X",
                ImmutableList.of("mediawiki"), dt);
        assertThat(event.schema()).isEqualTo(EventFactory.RESOURCE_CHANGE_SCHEMA);
        assertThat(event.get("tags")).isEqualTo(Collections.singletonList("mediawiki"));
        assertThat(event.meta()).containsEntry("dt", "2021-01-01T00:00:00Z");
    }

    @Test
    public void recentChangeHasNoNulls() {
        RecentChange rc = RecentChange.builder()
                .type("log")
                .title(new Title(2, "User:Tester"))
                .comment("hello")
                .timestamp(NOW)
                .user("Tester")
                .logId(77L)
                .logType("block")
                .logAction("block")
                .build();
        Event event = factory.createRecentChangeEvent("mediawiki.recentchange", rc);

        assertNoNulls(event.fields());
        assertThat(event.has("minor")).isFalse();
        assertThat(event.has("length")).isFalse();
        assertThat(event.get("title")).isEqualTo("User:Tester");
        assertThat(event.get("timestamp")).isEqualTo(NOW.getEpochSecond());
        assertThat(event.get("log_type")).isEqualTo("block");
        assertThat(event.get("parsedcomment")).isEqualTo("<span>hello</span>");
    }

    @Test
    public void removeNullsIsRecursive() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("a", null);
        nested.put("b", 1);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("x", null);
        root.put("nested", nested);
        root.put("list", Arrays.asList(null, "v", nested));

        Map<String, Object> pruned = (Map<String, Object>) EventFactory.removeNulls(root);

        assertNoNulls(pruned);
        assertThat(pruned).doesNotContainKey("x");
        assertThat(root).containsKey("x");
    }

    @Test
    public void jobEvent() {
        JobSpecification job = JobSpecification.builder()
                .type("refreshLinks")
                .title(new Title(0, "Main_Page"))
                .param("requestId", "from-job")
                .param("rootJobSignature", "sig")
                .param("rootJobTimestamp", "2020-01-01T00:00:00Z")
                .param("blob", new byte[] {(byte) 0xC3, (byte) 0x28})
                .releaseTimestamp(Instant.parse("2021-03-05T00:00:00Z"))
                .ignoreDuplicates(true)
                .build();
        Event event = factory.createJobEvent("mediawiki.job.refreshLinks", null, job);

        assertThat(event.schema()).isEqualTo(EventFactory.JOB_SCHEMA);
        assertThat(event.get("database")).isEqualTo(DB_NAME);
        assertThat(event.get("type")).isEqualTo("refreshLinks");
        assertThat(event.get("page_title")).isEqualTo("Main_Page");
        assertThat(event.get("delay_until")).isEqualTo("2021-03-05T00:00:00Z");
        assertThat((String) event.get("sha1")).hasSize(40);
        assertThat((Map<String, Object>) event.get("root_event"))
                .containsEntry("signature", "sig")
                .containsEntry("dt", "2020-01-01T00:00:00Z");
        assertThat((Map<String, Object>) event.get("params"))
                .containsEntry("blob", BinaryValues.encode(new byte[] {(byte) 0xC3, (byte) 0x28}));
        assertThat(event.meta()).containsEntry("request_id", "from-job");
        assertThat(event.signature()).isNull();
    }

    @Test
    public void deduplicationIgnoresRootJobAndRequestId() {
        JobSpecification first = JobSpecification.builder().type("t").title(new Title(0, "A"))
                .param("x", 1).param("requestId", "r1").param("rootJobSignature", "s1").build();
        JobSpecification second = JobSpecification.builder().type("t").title(new Title(0, "A"))
                .param("x", 1).param("requestId", "r2").build();
        JobSpecification other = JobSpecification.builder().type("t").title(new Title(0, "A"))
                .param("x", 2).build();

        assertThat(EventFactory.deduplicationHash(first)).isEqualTo(EventFactory.deduplicationHash(second));
        assertThat(EventFactory.deduplicationHash(first)).isNotEqualTo(EventFactory.deduplicationHash(other));
    }

    @Test
    public void deduplicationHashIsTheSha1OfTheSortedJson() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("z", 1);
        nested.put("a", "b");
        JobSpecification job = JobSpecification.builder().type("t").title(new Title(0, "A"))
                .param("y", nested).param("x", 2).param(JobSpecification.REQUEST_ID, "r").build();

        String json = "{\"namespace\":0,\"params\":{\"x\":2,\"y\":{\"a\":\"b\",\"z\":1}},"
                + "\"title\":\"A\",\"type\":\"t\"}";
        assertThat(EventFactory.deduplicationHash(job))
                .isEqualTo(Hashing.sha1().hashBytes(json.getBytes(StandardCharsets.UTF_8)).toString());
    }

    @Test
    public void deduplicationHashDoesNotDependOnParameterOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", 2);
        second.put("a", 1);

        assertThat(EventFactory.deduplicationHash(JobSpecification.builder().type("t").title(new Title(0, "A"))
                .param("nested", first).build()))
                .isEqualTo(EventFactory.deduplicationHash(JobSpecification.builder().type("t")
                        .title(new Title(0, "A")).param("nested", second).build()));
    }

    private static Map<String, Object> withoutIdAndTime(Event event) {
        Map<String, Object> fields = new LinkedHashMap<>(event.fields());
        Map<String, Object> meta = new LinkedHashMap<>(event.meta());
        meta.remove("id");
        meta.remove("dt");
        fields.put(Event.META_FIELD, meta);
        return fields;
    }

    private static void assertNoNulls(Object value) {
        if (value instanceof Map) {
            ((Map<?, ?>) value).values().forEach(v -> {
                assertThat(v).isNotNull();
                assertNoNulls(v);
            });
        } else if (value instanceof List) {
            ((List<?>) value).forEach(v -> {
                assertThat(v).isNotNull();
                assertNoNulls(v);
            });
        }
    }

    @Test
    public void pageWithoutRevisionHasNoRevId() {
        Page deleted = Page.builder().id(3).title(new Title(0, "Gone")).build();
        Event event = factory.createPageDeleteEvent("s", performer(), deleted, null, null);
        assertThat(event.has("rev_id")).isFalse();
    }
}
