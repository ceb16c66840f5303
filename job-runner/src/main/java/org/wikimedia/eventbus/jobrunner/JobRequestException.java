package org.wikimedia.eventbus.jobrunner;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * A job request that cannot be served, with the HTTP status to answer and
 * details about what went wrong.
 */
public class JobRequestException extends Exception {
    private final int status;
    private final Map<String, Object> details;

    public JobRequestException(String message, int status) {
        this(message, status, ImmutableMap.of());
    }

    public JobRequestException(String message, int status, Map<String, Object> details) {
        super(message);
        this.status = status;
        this.details = ImmutableMap.copyOf(details);
    }

    public int status() {
        return status;
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Body of the error response: the message, the status and the details.
     */
    public Map<String, Object> responseBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", getMessage());
        body.put("httpCode", status);
        body.putAll(details);
        return body;
    }
}
