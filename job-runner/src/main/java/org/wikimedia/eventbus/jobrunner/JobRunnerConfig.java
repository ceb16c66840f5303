package org.wikimedia.eventbus.jobrunner;

import javax.annotation.Nullable;
import javax.servlet.ServletConfig;

/**
 * Settings of the job runner, read from the servlet init parameters and
 * falling back to system properties prefixed with the name of this class.
 */
public final class JobRunnerConfig {

    private final ServletConfig servletConfig;

    static final String SYSTEM_PROPERTY_PREFIX = JobRunnerConfig.class.getName() + ".";
    static final String SECRET_KEY_PROPERTY = "secretKey";
    static final String ENABLE_RUN_JOB_API_PROPERTY = "enableRunJobApi";
    static final String READ_ONLY_PROPERTY = "readOnly";

    public JobRunnerConfig(@Nullable ServletConfig servletConfig) {
        this.servletConfig = servletConfig;
    }

    /**
     * Secret shared with the job producers to sign job events.
     *
     * @throws IllegalStateException if it is not set
     */
    public String secretKey() {
        String secretKey = loadStringParam(SECRET_KEY_PROPERTY);
        if (secretKey == null || secretKey.isEmpty()) {
            throw new IllegalStateException("The " + SECRET_KEY_PROPERTY + " of the job runner must be set");
        }
        return secretKey;
    }

    public boolean enableRunJobApi() {
        return Boolean.parseBoolean(loadStringParam(ENABLE_RUN_JOB_API_PROPERTY, "false"));
    }

    /**
     * Read on every call, the wiki can be switched to read-only while running.
     */
    public boolean readOnly() {
        return Boolean.parseBoolean(loadStringParam(READ_ONLY_PROPERTY, "false"));
    }

    private String loadStringParam(String property) {
        return loadStringParam(property, null);
    }

    private String loadStringParam(String property, String def) {
        String value = servletConfig != null ? servletConfig.getInitParameter(property) : null;
        return value != null ? value : System.getProperty(SYSTEM_PROPERTY_PREFIX + property, def);
    }
}
