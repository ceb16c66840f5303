package org.wikimedia.eventbus.jobrunner;

import static javax.ws.rs.core.MediaType.APPLICATION_JSON_TYPE;

import java.util.function.BooleanSupplier;

import javax.annotation.Nullable;
import javax.annotation.PostConstruct;
import javax.inject.Singleton;
import javax.servlet.ServletConfig;
import javax.ws.rs.HeaderParam;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikimedia.eventbus.common.EventSerializer;
import org.wikimedia.eventbus.common.EventSignature;
import org.wikimedia.eventbus.common.JacksonUtil;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.SharedMetricRegistries;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * Internal endpoint executing one job sent by the job queue.
 *
 * The request body is a signed job event. The job is executed right away
 * and its {@link JobResult} returned with a 200 when it succeeded. Errors are
 * answered with a JSON body holding a {@code message}, the {@code httpCode}
 * and details:
 * <ul>
 * <li>501 the endpoint is not enabled
 * <li>423 the wiki is read-only
 * <li>415 the body is not JSON
 * <li>400, 403 and 500 the event is invalid, see {@link EventBodyValidator}
 * <li>500 the job failed, with its {@code error}
 * </ul>
 *
 * A {@link JobFactory} or a {@link MetricRegistry} stored as servlet context
 * attribute under their class name replace the default ones.
 */
@SuppressWarnings("checkstyle:classfanoutcomplexity")
@Path("/eventbus/v0/internal/job")
@Singleton
public class RunSingleJobService {
    private static final Logger LOG = LoggerFactory.getLogger(RunSingleJobService.class);

    public static final String METRIC_REGISTRY_NAME = "eventbus-job-runner";

    @Context
    private ServletConfig servletConfig;

    private boolean enabled;
    private BooleanSupplier readOnly;
    private EventBodyValidator validator;
    private JobExecutor executor;

    @PostConstruct
    public void init() {
        JobRunnerConfig config = new JobRunnerConfig(servletConfig);
        JobFactory jobFactory = contextAttribute(JobFactory.class);
        MetricRegistry metrics = contextAttribute(MetricRegistry.class);
        init(config,
                jobFactory != null ? jobFactory : JobClasses.defaults(),
                metrics != null ? metrics : SharedMetricRegistries.getOrCreate(METRIC_REGISTRY_NAME),
                config::readOnly);
    }

    @VisibleForTesting
    public void init(JobRunnerConfig config, JobFactory jobFactory, MetricRegistry metrics, BooleanSupplier readOnly) {
        enabled = config.enableRunJobApi();
        this.readOnly = readOnly;
        if (enabled) {
            EventSerializer serializer = new EventSerializer();
            validator = new EventBodyValidator(serializer, new EventSignature(config.secretKey(), serializer),
                    jobFactory);
        }
        executor = new JobExecutor(metrics);
    }

    @POST
    @Path("/execute")
    public Response execute(@HeaderParam(HttpHeaders.CONTENT_TYPE) String contentType, byte[] body) {
        try {
            checkAcceptable(contentType);
            JobResult result = executor.execute(validator.validateBody(body));
            if (!result.status()) {
                throw new JobRequestException("Internal Server Error", 500,
                        ImmutableMap.of("error", Strings.nullToEmpty(result.error())));
            }
            return json(200, result);
        } catch (JobRequestException e) {
            LOG.debug("Job request failed with {}: {}", e.status(), e.getMessage());
            return json(e.status(), e.responseBody());
        }
    }

    private void checkAcceptable(@Nullable String contentType) throws JobRequestException {
        if (!enabled) {
            throw new JobRequestException("Set " + JobRunnerConfig.ENABLE_RUN_JOB_API_PROPERTY
                    + " to true to enable the internal EventBus API", 501);
        }
        if (readOnly.getAsBoolean()) {
            throw new JobRequestException("Wiki is in read-only mode.", 423);
        }
        if (!isJson(contentType)) {
            throw new JobRequestException("Unsupported Content-Type", 415,
                    ImmutableMap.of("content_type", Strings.nullToEmpty(contentType)));
        }
    }

    private static boolean isJson(@Nullable String contentType) {
        if (contentType == null) return false;
        try {
            MediaType mediaType = MediaType.valueOf(contentType);
            return APPLICATION_JSON_TYPE.getType().equalsIgnoreCase(mediaType.getType())
                    && APPLICATION_JSON_TYPE.getSubtype().equalsIgnoreCase(mediaType.getSubtype());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static Response json(int status, Object entity) {
        String body;
        try {
            body = JacksonUtil.DEFAULT_OBJECT_WRITER.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            LOG.error("Cannot serialize the response", e);
            return Response.serverError().build();
        }
        return Response.status(status).type(APPLICATION_JSON_TYPE).entity(body).build();
    }

    @Nullable
    private <T> T contextAttribute(Class<T> type) {
        if (servletConfig == null) return null;
        Object attribute = servletConfig.getServletContext().getAttribute(type.getName());
        return type.isInstance(attribute) ? type.cast(attribute) : null;
    }
}
