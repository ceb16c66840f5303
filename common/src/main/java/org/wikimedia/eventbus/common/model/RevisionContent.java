package org.wikimedia.eventbus.common.model;

/**
 * Lazy access to the main slot content of a revision.
 */
@FunctionalInterface
public interface RevisionContent {
    /**
     * @throws SuppressedDataException if the content is hidden
     */
    boolean isRedirect() throws SuppressedDataException;
}
