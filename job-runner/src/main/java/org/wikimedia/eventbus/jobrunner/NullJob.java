package org.wikimedia.eventbus.jobrunner;

import java.util.Map;

/**
 * Job doing nothing, used to check that jobs get executed.
 *
 * Parameters: {@code failure} to make it fail, {@code allowRetries} to
 * forbid retries of failures.
 */
public class NullJob extends Job {
    public static final String TYPE = "null";

    public NullJob(Map<String, Object> params) {
        super(TYPE, params);
    }

    @Override
    public boolean run() {
        if (Boolean.TRUE.equals(params().get("failure"))) {
            setLastError("Failing as requested");
            return false;
        }
        return true;
    }

    @Override
    public boolean allowRetries() {
        return !Boolean.FALSE.equals(params().get("allowRetries"));
    }
}
