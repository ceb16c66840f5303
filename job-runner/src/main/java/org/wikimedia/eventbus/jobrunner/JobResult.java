package org.wikimedia.eventbus.jobrunner;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Outcome of a job execution, returned as is to the caller.
 */
@Value
@Accessors(fluent = true)
public class JobResult {
    @JsonProperty("status")
    boolean status;
    /** The job failed because the database is read-only. */
    @JsonProperty("readonly")
    boolean readonly;
    @JsonProperty("message")
    String message;
    @Nullable
    @JsonProperty("error")
    String error;
    @JsonProperty("timeMs")
    long timeMs;
}
