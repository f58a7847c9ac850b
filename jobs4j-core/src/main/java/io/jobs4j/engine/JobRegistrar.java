package io.jobs4j.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.Dispatchable;
import io.jobs4j.LoggerAware;
import io.jobs4j.Schedulable;
import io.jobs4j.core.HandlerDescriptor;
import io.jobs4j.core.HandlerKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Installs worker callbacks and cron schedules with the {@link QueueEngine}.
 *
 * <p>A worker callback processes the delivered batch sequentially: for every job it resolves a fresh
 * handler instance from the {@link HandlerFactory} and awaits {@code handle} before moving on.
 * Handler exceptions propagate to the engine so its retry policy applies.
 *
 * <p>No deduplication happens here: registering the same job name twice replaces the previous worker
 * at the engine level.
 */
public class JobRegistrar {
    private static final Logger log = LoggerFactory.getLogger(JobRegistrar.class);

    private final QueueEngine engine;
    private final HandlerFactory handlerFactory;
    private final ObjectMapper objectMapper;

    public JobRegistrar(QueueEngine engine, HandlerFactory handlerFactory, ObjectMapper objectMapper) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.handlerFactory = Objects.requireNonNull(handlerFactory, "handlerFactory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Registers a worker, invoking the handler as a {@link Dispatchable} when it is one and as a
     * {@link Schedulable} otherwise.
     */
    public void registerWorker(String jobName, HandlerDescriptor descriptor, Map<String, Object> workOptions) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        HandlerKind kind = descriptor.supports(HandlerKind.DISPATCHABLE) ? HandlerKind.DISPATCHABLE : HandlerKind.SCHEDULABLE;
        registerWorker(jobName, descriptor, kind, workOptions);
    }

    public void registerWorker(String jobName, HandlerDescriptor descriptor, HandlerKind kind, Map<String, Object> workOptions) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (!descriptor.supports(kind)) {
            throw new IllegalArgumentException(descriptor.type().getName() + " does not implement " + kind.contract().getSimpleName());
        }

        Class<?> type = descriptor.type();
        Class<?> payloadType = descriptor.payloadType();
        Map<String, Object> options = workOptions == null ? Map.of() : workOptions;

        engine.work(jobName, options, jobs -> {
            for (QueuedJob job : jobs) {
                log.debug("Job started name={} id={} type={}", jobName, job.id(), type.getName());
                invoke(type, kind, payloadType, job);
                log.debug("Job finished name={} id={}", jobName, job.id());
            }
        });
        log.info("Worker registered for job name={} type={} options={}", jobName, type.getName(), options);
    }

    /**
     * Installs the schedule; {@code scheduleOptions} are handed to the engine verbatim.
     */
    public void registerSchedule(String jobName, String cron, Map<String, Object> scheduleOptions) {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(cron, "cron must not be null");
        engine.schedule(jobName, cron, Map.of(), scheduleOptions == null ? Map.of() : scheduleOptions);
        log.info("Scheduled job name={} cron={}", jobName, cron);
    }

    private void invoke(Class<?> type, HandlerKind kind, Class<?> payloadType, QueuedJob job) throws Exception {
        Object instance = handlerFactory.create(type);
        if (instance instanceof LoggerAware aware) {
            aware.setLogger(LoggerFactory.getLogger(type));
        }

        switch (kind) {
            case DISPATCHABLE -> dispatch((Dispatchable<?>) instance, payloadType, job.data());
            case SCHEDULABLE -> ((Schedulable) instance).handle();
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void dispatch(Dispatchable<T> handler, Class<?> payloadType, Object rawData) throws Exception {
        Object data;
        if (rawData == null || payloadType.isInstance(rawData)) {
            data = rawData;
        } else {
            data = objectMapper.convertValue(rawData, payloadType);
        }
        handler.handle((T) data);
    }
}
