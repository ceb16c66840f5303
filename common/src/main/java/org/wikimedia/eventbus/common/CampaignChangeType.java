package org.wikimedia.eventbus.common;

import java.util.Locale;
import java.util.Optional;

import javax.annotation.Nullable;

import org.wikimedia.eventbus.common.model.CampaignSettings;
import org.wikimedia.eventbus.common.model.Performer;

/**
 * Kinds of CentralNotice campaign changes, each knowing which event describes it.
 */
public enum CampaignChangeType {
    CREATED("mediawiki.centralnotice.campaign-create") {
        @Override
        public Optional<Event> toEvent(EventFactory factory, String stream, String campaignName, Performer performer,
                                       @Nullable CampaignSettings before, @Nullable CampaignSettings after,
                                       @Nullable String summary, String campaignUrl) {
            return factory.createCampaignCreateEvent(stream, campaignName, performer, after, summary, campaignUrl);
        }
    },
    MODIFIED("mediawiki.centralnotice.campaign-change") {
        @Override
        public Optional<Event> toEvent(EventFactory factory, String stream, String campaignName, Performer performer,
                                       @Nullable CampaignSettings before, @Nullable CampaignSettings after,
                                       @Nullable String summary, String campaignUrl) {
            return factory.createCampaignChangeEvent(stream, campaignName, performer, after, before, summary,
                    campaignUrl);
        }
    },
    REMOVED("mediawiki.centralnotice.campaign-delete") {
        @Override
        public Optional<Event> toEvent(EventFactory factory, String stream, String campaignName, Performer performer,
                                       @Nullable CampaignSettings before, @Nullable CampaignSettings after,
                                       @Nullable String summary, String campaignUrl) {
            return Optional.of(factory.createCampaignDeleteEvent(stream, campaignName, performer, before, summary,
                    campaignUrl));
        }
    };

    private final String defaultStream;

    CampaignChangeType(String defaultStream) {
        this.defaultStream = defaultStream;
    }

    public String defaultStream() {
        return defaultStream;
    }

    /**
     * Build the event for this change, empty when there is nothing to report.
     */
    public abstract Optional<Event> toEvent(EventFactory factory, String stream, String campaignName,
                                            Performer performer, @Nullable CampaignSettings before,
                                            @Nullable CampaignSettings after, @Nullable String summary,
                                            String campaignUrl);

    /**
     * Parse the change type as reported by CentralNotice ({@code created}, {@code modified}, {@code removed}).
     */
    public static CampaignChangeType fromName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Bad CentralNotice change type: " + name, e);
        }
    }
}
