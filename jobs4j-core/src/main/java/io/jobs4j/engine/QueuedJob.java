package io.jobs4j.engine;

/**
 * A job as delivered by the engine to a worker callback.
 *
 * @param id   engine-assigned identifier
 * @param name job name the job was sent to
 * @param data stored payload (typically a {@code Map} as produced by the engine)
 */
public record QueuedJob(
        String id,
        String name,
        Object data
) {
}
