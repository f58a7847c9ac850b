package io.jobs4j.engine;

import java.util.Map;

/**
 * Durable work-queue primitives jobs4j builds on (modelled after pg-boss).
 *
 * <p>Implementations provide at-least-once delivery and persistence and must be safe for concurrent
 * use by the registrar and the dispatcher; jobs4j adds no synchronization of its own.
 */
public interface QueueEngine {

    void start();

    void stop();

    /**
     * Enqueue a job.
     *
     * @return engine job id, or {@code null} if the engine declined the job (e.g. singleton conflict)
     */
    String send(String name, Object data, Map<String, Object> options);

    /**
     * Install the worker callback for {@code name}. A second call for the same name replaces the
     * first (last registration wins).
     */
    void work(String name, Map<String, Object> options, WorkHandler handler);

    /**
     * Create or replace the cron schedule for {@code name}. Each trigger sends a job with {@code data}.
     */
    void schedule(String name, String cron, Object data, Map<String, Object> options);

    void unschedule(String name);
}
