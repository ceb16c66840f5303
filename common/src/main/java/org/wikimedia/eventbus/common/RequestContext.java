package org.wikimedia.eventbus.common;

import java.util.UUID;

import javax.annotation.Nullable;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * What is known about the request that triggered event production.
 */
@Value
@Accessors(fluent = true)
public class RequestContext {
    /** Id propagated from the x-request-id header or generated. */
    String requestId;
    /** IP address of the client, null when running outside of a web request. */
    @Nullable
    String clientIp;

    /**
     * A context for work not attached to a client request (maintenance, jobs).
     */
    public static RequestContext detached() {
        return new RequestContext(UUID.randomUUID().toString(), null);
    }

    public static RequestContext fromHeaders(@Nullable String xRequestId, @Nullable String clientIp) {
        String requestId = xRequestId == null || xRequestId.isEmpty() ? UUID.randomUUID().toString() : xRequestId;
        return new RequestContext(requestId, clientIp);
    }
}
