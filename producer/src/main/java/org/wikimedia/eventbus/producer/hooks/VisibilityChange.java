package org.wikimedia.eventbus.producer.hooks;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Visibility bits of a revision before and after a change.
 */
@Value
@Accessors(fluent = true)
public class VisibilityChange {
    int oldBits;
    int newBits;
}
