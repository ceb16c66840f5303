package org.wikimedia.eventbus.producer.hooks;

import java.util.Collections;
import java.util.Optional;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.CampaignChangeType;
import org.wikimedia.eventbus.common.Event;
import org.wikimedia.eventbus.common.EventFactory;
import org.wikimedia.eventbus.common.SiteInfo;
import org.wikimedia.eventbus.common.model.CampaignSettings;
import org.wikimedia.eventbus.common.model.Performer;
import org.wikimedia.eventbus.producer.DeferredUpdates;
import org.wikimedia.eventbus.producer.EventBusFactory;
import org.wikimedia.eventbus.producer.EventBusSendUpdate;
import org.wikimedia.eventbus.producer.StreamNameMapper;

/**
 * Produces events for changes to CentralNotice campaigns.
 */
public class CampaignChangeHooks {
    private final EventFactory eventFactory;
    private final EventBusFactory eventBusFactory;
    private final StreamNameMapper streamNameMapper;

    public CampaignChangeHooks(EventFactory eventFactory, EventBusFactory eventBusFactory,
                               StreamNameMapper streamNameMapper) {
        this.eventFactory = eventFactory;
        this.eventBusFactory = eventBusFactory;
        this.streamNameMapper = streamNameMapper;
    }

    /**
     * @param changeType {@code created}, {@code modified} or {@code removed}
     * @param before settings before the change, null for a new campaign
     * @param after settings after the change, null for a removed campaign
     * @throws IllegalArgumentException on an unknown change type
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public void onCentralNoticeCampaignChange(DeferredUpdates updates, String changeType, String campaignName,
                                              Performer performer, @Nullable CampaignSettings before,
                                              @Nullable CampaignSettings after, @Nullable String summary) {
        CampaignChangeType type = CampaignChangeType.fromName(changeType);
        String stream = streamNameMapper.resolve(type.defaultStream());
        Optional<Event> event = type.toEvent(eventFactory, stream, campaignName, performer, before, after, summary,
                campaignUrl(campaignName));
        event.ifPresent(e ->
                updates.add(EventBusSendUpdate.newForStream(eventBusFactory, stream, Collections.singletonList(e))));
    }

    private String campaignUrl(String campaignName) {
        return eventFactory.site().articleUrl("Special:CentralNotice")
                + "?method=listNoticeDetail&notice=" + SiteInfo.urlencode(campaignName);
    }
}
