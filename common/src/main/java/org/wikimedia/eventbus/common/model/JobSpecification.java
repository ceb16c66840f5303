package org.wikimedia.eventbus.common.model;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A job to push to the queue: its type, the page it relates to and its parameters.
 */
@Value
@Builder
@Accessors(fluent = true)
public class JobSpecification {
    public static final String ROOT_JOB_SIGNATURE = "rootJobSignature";
    public static final String ROOT_JOB_TIMESTAMP = "rootJobTimestamp";
    public static final String REQUEST_ID = "requestId";

    String type;
    Title title;
    @Singular
    Map<String, Object> params;
    /** Do not run before this time, null to run as soon as possible. */
    @Nullable
    Instant releaseTimestamp;
    /** Whether identical jobs may be collapsed into one. */
    boolean ignoreDuplicates;

    /**
     * What identifies this job for de-duplication: type, page and parameters,
     * without the root job and request bookkeeping.
     */
    public Map<String, Object> deduplicationInfo() {
        Map<String, Object> info = new TreeMap<>();
        info.put("type", type);
        info.put("namespace", title.namespace());
        info.put("title", title.prefixedDbKey());
        Map<String, Object> dedupParams = new TreeMap<>(params);
        dedupParams.remove(ROOT_JOB_SIGNATURE);
        dedupParams.remove(ROOT_JOB_TIMESTAMP);
        dedupParams.remove(REQUEST_ID);
        info.put("params", dedupParams);
        return info;
    }
}
