package io.jobs4j.core;

import java.util.Map;
import java.util.Objects;

/**
 * Resolved configuration of a cron handler.
 *
 * @param schedule        cron expression, never blank
 * @param scheduleOptions options for the engine's schedule call; always contains at least {@code queue}
 * @param workOptions     options for the worker that executes the scheduled job
 */
public record CronConfig(
        String jobName,
        String queue,
        String schedule,
        Map<String, Object> scheduleOptions,
        Map<String, Object> workOptions
) {
    public CronConfig {
        Objects.requireNonNull(jobName, "jobName must not be null");
        Objects.requireNonNull(queue, "queue must not be null");
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("schedule must not be blank");
        }
        scheduleOptions = scheduleOptions == null ? Map.of() : scheduleOptions;
        workOptions = workOptions == null ? Map.of() : workOptions;
    }
}
