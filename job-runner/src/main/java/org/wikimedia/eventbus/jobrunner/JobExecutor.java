package org.wikimedia.eventbus.jobrunner;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Runs a single job.
 *
 * Failures never escape: a job returning false or throwing is reported as a
 * failed {@link JobResult}, and {@link Job#teardown(boolean)} is attempted in
 * every case. Failures caused by a read-only database are flagged as such so
 * that the caller can retry later.
 *
 * Jobs that do not {@link Job#allowRetries() allow retries} are always
 * reported as successful, even when they failed: reporting the failure would
 * only make the caller retry a job that asked not to be retried. The failure
 * is still logged and carried in the message and error of the result.
 *
 * Execution time is reported to the {@code jobexecutor.<type>.exec} timer.
 */
public class JobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(JobExecutor.class);

    public static final String REQUEST_ID_MDC_KEY = "request_id";

    private final MetricRegistry metrics;

    public JobExecutor(MetricRegistry metrics) {
        this.metrics = metrics;
    }

    public static String timerName(String jobType) {
        return MetricRegistry.name("jobexecutor", jobType, "exec");
    }

    public JobResult execute(Job job) {
        try (MDC.MDCCloseable requestId = MDC.putCloseable(REQUEST_ID_MDC_KEY, job.requestId())) {
            return doExecute(job);
        }
    }

    @SuppressWarnings("checkstyle:IllegalCatch")
    private JobResult doExecute(Job job) {
        LOG.debug("Beginning job execution {}", job);
        Timer.Context timer = metrics.timer(timerName(job.type())).time();
        boolean status;
        boolean readonly = false;
        String message;
        String error = null;
        try {
            status = job.run();
            if (status) {
                message = "success";
            } else {
                message = job.lastError() != null ? job.lastError() : "Job failed without giving a reason";
                error = message;
                LOG.error("Failed executing job: {}. Error: {}", job, message);
            }
        } catch (DatabaseReadOnlyException e) {
            status = false;
            readonly = true;
            message = "Database is in read-only mode";
            error = message;
            LOG.warn("Job {} could not run, the database is read-only", job.type());
        } catch (RuntimeException e) {
            status = false;
            message = "Exception executing job: " + job + " : " + e.getClass().getName() + ": " + e.getMessage();
            error = message;
            LOG.error(message, e);
        }

        try {
            job.teardown(status);
        } catch (RuntimeException e) {
            message = "Exception tearing down job: " + job + " : " + e.getClass().getName() + ": " + e.getMessage();
            error = message;
            LOG.error(message, e);
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(timer.stop());
        LOG.info("Finished job execution {}: status {} in {}ms", job.type(), status, durationMs);

        if (!job.allowRetries()) {
            status = true;
        }
        return new JobResult(status, readonly, message, error, durationMs);
    }
}
