package org.wikimedia.eventbus.common.model;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A partial block restriction, on a namespace or on a single page.
 */
@Value
@Accessors(fluent = true)
public class BlockRestriction {
    Type type;
    long value;

    public enum Type {
        NAMESPACE("ns"),
        PAGE("page");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public static BlockRestriction namespace(int namespace) {
        return new BlockRestriction(Type.NAMESPACE, namespace);
    }

    public static BlockRestriction page(long pageId) {
        return new BlockRestriction(Type.PAGE, pageId);
    }
}
