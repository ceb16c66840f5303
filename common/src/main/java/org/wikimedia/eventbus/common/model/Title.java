package org.wikimedia.eventbus.common.model;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A page title as stored in the database: namespace number and prefixed DB key.
 */
@Value
@Accessors(fluent = true)
public class Title {
    int namespace;
    /** Title with namespace prefix and underscores, for example {@code Talk:Main_Page}. */
    String prefixedDbKey;
}
