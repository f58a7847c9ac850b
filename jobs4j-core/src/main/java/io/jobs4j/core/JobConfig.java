package io.jobs4j.core;

import java.util.Map;
import java.util.Objects;

/**
 * Resolved configuration of a dispatchable handler.
 *
 * @param workOptions options for the engine's work call; always contains at least {@code queue}
 */
public record JobConfig(
        String jobName,
        String queue,
        Map<String, Object> workOptions
) {
    public JobConfig {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(queue, "queue must not be null");
        workOptions = workOptions == null ? Map.of() : workOptions;
    }
}
