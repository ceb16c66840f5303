package org.wikimedia.eventbus.jobrunner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

/**
 * A unit of deferred work, rebuilt from a job event.
 *
 * Parameters are the decoded {@code params} of the event, binary values are
 * byte arrays again.
 */
public abstract class Job {
    public static final String REQUEST_ID_PARAM = "requestId";

    private final String type;
    private final Map<String, Object> params;
    @Nullable
    private String lastError;

    protected Job(String type, Map<String, Object> params) {
        this.type = type;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Do the work.
     *
     * @return false when the job failed, {@link #lastError()} should then say why
     */
    public abstract boolean run();

    /**
     * Called once {@link #run()} is over, whatever its outcome.
     */
    public void teardown(boolean status) {
    }

    /**
     * Whether the job should be attempted again when it fails.
     */
    public boolean allowRetries() {
        return true;
    }

    public String type() {
        return type;
    }

    public Map<String, Object> params() {
        return params;
    }

    /**
     * Id of the request that pushed the job, null when it was not recorded.
     */
    @Nullable
    public String requestId() {
        Object requestId = params.get(REQUEST_ID_PARAM);
        return requestId instanceof String ? (String) requestId : null;
    }

    @Nullable
    public String lastError() {
        return lastError;
    }

    protected void setLastError(@Nullable String lastError) {
        this.lastError = lastError;
    }

    @Override
    public String toString() {
        return type + " " + params;
    }
}
