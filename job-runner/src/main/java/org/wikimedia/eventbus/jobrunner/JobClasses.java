package org.wikimedia.eventbus.jobrunner;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import com.google.common.collect.ImmutableMap;

/**
 * {@link JobFactory} knowing a fixed set of job types.
 */
public final class JobClasses implements JobFactory {
    private final Map<String, Function<Map<String, Object>, Job>> constructors;

    private JobClasses(Map<String, Function<Map<String, Object>, Job>> constructors) {
        this.constructors = constructors;
    }

    /**
     * Only the job types every wiki has.
     */
    public static JobClasses defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder().register(NullJob.TYPE, NullJob::new);
    }

    @Override
    public Job create(String type, Map<String, Object> params) {
        Function<Map<String, Object>, Job> constructor = constructors.get(type);
        if (constructor == null) {
            throw new IllegalArgumentException("Invalid job command '" + type + "'");
        }
        return constructor.apply(params);
    }

    public static final class Builder {
        private final Map<String, Function<Map<String, Object>, Job>> constructors = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a job type, replacing any previous registration of it.
         */
        public Builder register(String type, Function<Map<String, Object>, Job> constructor) {
            constructors.put(type, constructor);
            return this;
        }

        public JobClasses build() {
            return new JobClasses(ImmutableMap.copyOf(constructors));
        }
    }
}
