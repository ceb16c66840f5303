package org.wikimedia.eventbus.common.model;

import java.time.Instant;
import java.util.List;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A block placed on a user account, an IP or an IP range.
 */
@Value
@Builder
@Accessors(fluent = true)
public class Block {
    /** User name, IP or range the block applies to. */
    String target;
    /** Id of the blocked account, null for IPs and ranges. */
    @Nullable
    Long targetUserId;
    /** Groups of the blocked account, null when the target is not a user. */
    @Nullable
    List<String> targetGroups;
    String reason;
    boolean hideName;
    boolean preventsEmail;
    boolean preventsUserTalk;
    boolean preventsAccountCreation;
    boolean sitewide;
    @Singular
    List<BlockRestriction> restrictions;
    /** Null for infinite blocks. */
    @Nullable
    Instant expiry;

    public boolean targetsUser() {
        return targetGroups != null;
    }
}
