package org.wikimedia.eventbus.producer;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Updates pending for one request, run once its main work is done.
 *
 * A new instance is created for each request and flushed by whoever handles
 * it with {@link #doUpdates()}. Failures of an update are logged and do not
 * prevent the others from running.
 */
@NotThreadSafe
public class DeferredUpdates {
    private static final Logger LOG = LoggerFactory.getLogger(DeferredUpdates.class);

    private final List<DeferredUpdate> pending = new ArrayList<>();

    /**
     * Queue an update. A {@link MergeableUpdate} is merged into the pending
     * update of the same class when there is one.
     */
    public void add(DeferredUpdate update) {
        if (update instanceof MergeableUpdate) {
            for (DeferredUpdate existing : pending) {
                if (existing.getClass() == update.getClass()) {
                    ((MergeableUpdate) existing).merge((MergeableUpdate) update);
                    return;
                }
            }
        }
        pending.add(update);
    }

    public int size() {
        return pending.size();
    }

    /**
     * Run all pending updates in the order they were added, including those
     * added while running.
     */
    public void doUpdates() {
        while (!pending.isEmpty()) {
            List<DeferredUpdate> updates = new ArrayList<>(pending);
            pending.clear();
            for (DeferredUpdate update : updates) {
                try {
                    update.doUpdate();
                } catch (RuntimeException e) {
                    LOG.error("Deferred update {} failed", update, e);
                }
            }
        }
    }
}
