package org.wikimedia.eventbus.producer;

/**
 * A {@link DeferredUpdate} that can absorb another pending update of the same class,
 * so that it runs once for the whole request.
 */
public interface MergeableUpdate extends DeferredUpdate {
    /**
     * Merge the other update into this one.
     *
     * @param update an update of the same class as this one
     */
    void merge(MergeableUpdate update);
}
