package org.wikimedia.eventbus.producer;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Jobs could not be enqueued.
 */
public class JobQueueException extends Exception {
    private final List<String> errors;

    public JobQueueException(String message, List<String> errors) {
        super(message + ": " + String.join("; ", errors));
        this.errors = ImmutableList.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
