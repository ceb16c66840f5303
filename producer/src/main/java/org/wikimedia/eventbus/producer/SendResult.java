package org.wikimedia.eventbus.producer;

import java.util.List;

import com.google.common.collect.ImmutableList;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Outcome of a send. Delivery is best effort, callers are free to ignore it.
 */
@Value
@Accessors(fluent = true)
public class SendResult {
    private static final SendResult OK = new SendResult(true, ImmutableList.of());

    boolean success;
    /** One message per failed POST. */
    List<String> errors;

    public static SendResult ok() {
        return OK;
    }

    public static SendResult failure(String error) {
        return new SendResult(false, ImmutableList.of(error));
    }

    public static SendResult failure(List<String> errors) {
        return new SendResult(false, ImmutableList.copyOf(errors));
    }
}
