package io.jobs4j;

import io.jobs4j.core.JobNames;
import io.jobs4j.engine.QueueEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Client-facing API for enqueuing work.
 *
 * <p>Jobs are addressed either by handler type (the job name is resolved the same way discovery
 * resolves it) or by raw job name. Dispatching does not require discovery to have run; it only needs
 * a worker to be registered for the name by the time the engine delivers the job.
 *
 * <p>Typical usage:
 * <pre>{@code
 * dispatcher.dispatch(SendEmailJob.class, Map.of("to", "user@example.com"));
 * dispatcher.sendAfter("send-email", Duration.ofMinutes(5), payload);
 * }</pre>
 *
 * <p>Engine failures propagate to the caller. Nothing is retried here; retry and backoff are engine
 * options passed through {@code options}.
 */
public class JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    public static final String START_AFTER_OPTION = "startAfter";

    private final QueueEngine engine;

    public JobDispatcher(QueueEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public String dispatch(Class<?> handlerType, Object payload) {
        return dispatch(handlerType, payload, Map.of());
    }

    /**
     * @return the id assigned by the engine (opaque, for correlation only)
     */
    public String dispatch(Class<?> handlerType, Object payload, Map<String, Object> options) {
        Objects.requireNonNull(handlerType, "handlerType must not be null");
        return send(JobNames.resolve(handlerType), payload, options);
    }

    public String send(String name, Object payload) {
        return send(name, payload, Map.of());
    }

    public String send(String name, Object payload, Map<String, Object> options) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        String id = engine.send(name, payload == null ? Map.of() : payload, options == null ? Map.of() : options);
        log.debug("Job sent name={} id={}", name, id);
        return id;
    }

    /**
     * Send a job that becomes available after {@code delay}.
     */
    public String sendAfter(String name, Duration delay, Object payload) {
        return sendAfter(name, delay, payload, Map.of());
    }

    public String sendAfter(String name, Duration delay, Object payload, Map<String, Object> options) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return sendAfter(name, Instant.now().plus(delay), payload, options);
    }

    /**
     * Send a job that becomes available at {@code startAfter}.
     */
    public String sendAfter(String name, Instant startAfter, Object payload) {
        return sendAfter(name, startAfter, payload, Map.of());
    }

    public String sendAfter(String name, Instant startAfter, Object payload, Map<String, Object> options) {
        Objects.requireNonNull(startAfter, "startAfter must not be null");
        Map<String, Object> merged = new LinkedHashMap<>();
        if (options != null) {
            merged.putAll(options);
        }
        merged.put(START_AFTER_OPTION, startAfter);
        return send(name, payload, merged);
    }

    /**
     * Install an ad-hoc schedule for a handler type. Cron handlers found by discovery are scheduled
     * automatically and do not need this.
     */
    public void schedule(Class<?> handlerType, String cron) {
        schedule(handlerType, cron, Map.of(), Map.of());
    }

    public void schedule(Class<?> handlerType, String cron, Object payload, Map<String, Object> options) {
        Objects.requireNonNull(handlerType, "handlerType must not be null");
        Objects.requireNonNull(cron, "cron must not be null");
        String name = JobNames.resolve(handlerType);
        engine.schedule(name, cron, payload == null ? Map.of() : payload, options == null ? Map.of() : options);
        log.info("Scheduled job name={} cron={}", name, cron);
    }
}
