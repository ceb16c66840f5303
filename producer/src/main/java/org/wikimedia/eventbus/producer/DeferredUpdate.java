package org.wikimedia.eventbus.producer;

/**
 * Work postponed until the end of the request that registered it.
 */
@FunctionalInterface
public interface DeferredUpdate {
    void doUpdate();
}
