package org.wikimedia.eventbus.jobrunner;

import java.util.Map;

import javax.annotation.Nullable;

/**
 * Builds jobs from their type and parameters.
 */
@FunctionalInterface
public interface JobFactory {
    /**
     * @return the job, null if none could be built from these parameters
     * @throws IllegalArgumentException if the type is unknown or the parameters are invalid
     */
    @Nullable
    Job create(String type, Map<String, Object> params);
}
