package org.wikimedia.eventbus.producer.hooks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.wikimedia.eventbus.producer.ProducerTestUtils.NOW;
import static org.wikimedia.eventbus.producer.ProducerTestUtils.page;
import static org.wikimedia.eventbus.producer.ProducerTestUtils.performer;
import static org.wikimedia.eventbus.producer.ProducerTestUtils.revision;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.PageChangeEventFactory;
import org.wikimedia.eventbus.common.model.Revision;
import org.wikimedia.eventbus.common.model.Title;
import org.wikimedia.eventbus.producer.DeferredUpdates;
import org.wikimedia.eventbus.producer.EventBus;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventType;
import org.wikimedia.eventbus.producer.ProducerTestUtils;
import org.wikimedia.eventbus.producer.SendResult;
import org.wikimedia.eventbus.producer.StreamNameMapper;
import org.wikimedia.eventbus.test.LogCapture;
import org.wikimedia.eventbus.test.ManualClock;

import com.google.common.collect.ImmutableMap;

@SuppressWarnings("unchecked")
public class PageChangeHooksUnitTest {
    private static final String SERVICE = "intake-main";

    @Rule
    public LogCapture logs = LogCapture.forClass(PageChangeHooks.class);

    private final DeferredUpdates updates = new DeferredUpdates();
    private final Map<Long, Revision> revisions = ImmutableMap.of(
            1200L, revision(1200L, "Test").build(),
            1233L, revision(1233L, "Test").build(),
            1234L, revision(1234L, "Test").visibility(Revision.DELETED_TEXT).build());

    private EventBusFactory factory;
    private EventBus bus;
    private PageChangeHooks hooks;

    @Before
    public void mockFactory() {
        factory = mock(EventBusFactory.class);
        bus = mock(EventBus.class);
        when(factory.getEventServiceNameForStream(anyString())).thenReturn(SERVICE);
        when(factory.getInstance(SERVICE)).thenReturn(bus);
        when(bus.send(anyList(), any(EventType.class))).thenReturn(SendResult.ok());
        hooks = new PageChangeHooks(
                new PageChangeEventFactory(ProducerTestUtils.newEventFactory(), new ManualClock(NOW)), factory,
                new StreamNameMapper(ImmutableMap.of(PageChangeHooks.PAGE_CHANGE_STREAM, "rc1.page_change")),
                revisions::get);
    }

    private Event sentEvent() {
        updates.doUpdates();
        ArgumentCaptor<List<Event>> captor = ArgumentCaptor.forClass(List.class);
        verify(bus).send(captor.capture(), eq(EventType.EVENT));
        assertThat(captor.getValue()).hasSize(1);
        return captor.getValue().get(0);
    }

    private void nothingSent() {
        updates.doUpdates();
        verify(bus, never()).send(anyList(), any(EventType.class));
    }

    @Test
    public void creationGoesToTheMappedStream() {
        hooks.onPageSaveComplete(updates, page(23L, "Test"), performer(), revision(1234L, "Test").build(), true,
                false);

        Event event = sentEvent();
        assertThat(event.stream()).isEqualTo("rc1.page_change");
        assertThat(event.schema()).isEqualTo(PageChangeEventFactory.PAGE_CHANGE_SCHEMA);
        assertThat(event.get("page_change_kind")).isEqualTo("create");
        assertThat(event.has("prior_state")).isFalse();
        verify(factory).getEventServiceNameForStream("rc1.page_change");
    }

    @Test
    public void editLoadsTheParentRevision() {
        hooks.onPageSaveComplete(updates, page(23L, "Test"), performer(), revision(1234L, "Test").build(), false,
                false);

        Event event = sentEvent();
        assertThat(event.get("page_change_kind")).isEqualTo("edit");
        Map<String, Object> prior = (Map<String, Object>) event.get("prior_state");
        assertThat((Map<String, Object>) prior.get("revision")).containsEntry("rev_id", 1233L);
    }

    @Test
    public void nullEditsAreNotReported() {
        hooks.onPageSaveComplete(updates, page(23L, "Test"), performer(), revision(1234L, "Test").build(), false,
                true);

        assertThat(updates.size()).isZero();
        nothingSent();
    }

    @Test
    public void move() {
        hooks.onPageMoveComplete(updates, page(23L, "New_title"), performer(), revision(1234L, "New_title").build(),
                new Title(0, "Test"), "rename", null);

        Event event = sentEvent();
        assertThat(event.get("page_change_kind")).isEqualTo("move");
        Map<String, Object> prior = (Map<String, Object>) event.get("prior_state");
        assertThat(prior.get("page")).isEqualTo(ImmutableMap.of("page_title", "Test"));
    }

    @Test
    public void moveWithoutParentRevisionIsRejected() {
        assertThatThrownBy(() -> hooks.onPageMoveComplete(updates, page(23L, "New_title"), performer(),
                revision(1234L, "New_title").parentId(null).build(), new Title(0, "Test"), "rename", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no parent revision");
        assertThat(updates.size()).isZero();
    }

    @Test
    public void suppressedDeletion() {
        hooks.onPageDeleteComplete(updates, page(23L, "Test"), performer(), revision(1234L, "Test").build(),
                "private data", null, 5L, true);

        Event event = sentEvent();
        assertThat(event.get("changelog_kind")).isEqualTo("delete");
        assertThat(event.has("performer")).isFalse();
        assertThat((Map<String, Object>) event.get("revision")).containsEntry("is_content_visible", false);
    }

    @Test
    public void undelete() {
        hooks.onPageUndeleteComplete(updates, page(23L, "Test"), performer(), revision(1234L, "Test").build(),
                "restore", null, 20L);

        Event event = sentEvent();
        assertThat(event.get("page_change_kind")).isEqualTo("undelete");
        assertThat(event.get("dt")).isEqualTo(NOW.toString());
    }

    @Test
    public void onlyTheCurrentRevisionReportsItsVisibility() {
        hooks.onRevisionVisibilitySet(updates, page(23L, "Test"), performer(), Arrays.asList(1200L, 1234L),
                ImmutableMap.of(
                        1200L, new VisibilityChange(0, Revision.DELETED_COMMENT),
                        1234L, new VisibilityChange(0, Revision.DELETED_TEXT)));

        Event event = sentEvent();
        assertThat(event.get("page_change_kind")).isEqualTo("visibility_change");
        assertThat((Map<String, Object>) event.get("revision")).containsEntry("rev_id", 1234L);
        Map<String, Object> prior = (Map<String, Object>) event.get("prior_state");
        assertThat(prior.get("revision")).isEqualTo(ImmutableMap.of("is_content_visible", true));
    }

    @Test
    public void olderRevisionsAreNotReported() {
        hooks.onRevisionVisibilitySet(updates, page(23L, "Test"), performer(), Collections.singletonList(1200L),
                ImmutableMap.of(1200L, new VisibilityChange(0, Revision.DELETED_COMMENT)));

        nothingSent();
    }

    @Test
    public void missingRevisionsAreSkipped() {
        hooks.onRevisionVisibilitySet(updates, page(23L, "Test"), performer(), Arrays.asList(999L, 1233L, 1234L),
                ImmutableMap.of(1234L, new VisibilityChange(0, Revision.DELETED_TEXT)));

        assertThat(logs.warnings()).hasSize(1);
        assertThat(logs.warnings().get(0).getFormattedMessage()).contains("Revision 999 could not be found");
        assertThat(logs.errorMessages()).containsExactly(
                "Revision 1233 not found in the visibility changes. Cannot create a page change event.");
        assertThat(sentEvent().get("page_change_kind")).isEqualTo("visibility_change");
    }

    @Test
    public void currentRevisionMustHaveTheNewVisibility() {
        assertThatThrownBy(() -> hooks.onRevisionVisibilitySet(updates, page(23L, "Test"), performer(),
                Collections.singletonList(1234L),
                ImmutableMap.of(1234L, new VisibilityChange(0, Revision.DELETED_USER))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Current revision 1234");
    }

    @Test
    public void unchangedVisibilityIsStillReported() {
        hooks.onRevisionVisibilitySet(updates, page(23L, "Test"), performer(), Collections.singletonList(1234L),
                ImmutableMap.of(1234L, new VisibilityChange(Revision.DELETED_TEXT, Revision.DELETED_TEXT)));

        assertThat(logs.warnings()).hasSize(1);
        Map<String, Object> prior = (Map<String, Object>) sentEvent().get("prior_state");
        assertThat((Map<String, Object>) prior.get("revision")).isEmpty();
    }
}
