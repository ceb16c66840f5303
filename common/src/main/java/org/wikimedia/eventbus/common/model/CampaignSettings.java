package org.wikimedia.eventbus.common.model;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Settings of a CentralNotice campaign at one point in time.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class CampaignSettings {
    Instant start;
    Instant end;
    boolean enabled;
    boolean archived;
    @Singular
    List<String> banners;
}
