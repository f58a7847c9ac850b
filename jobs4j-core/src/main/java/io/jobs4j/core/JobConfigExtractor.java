package io.jobs4j.core;

import io.jobs4j.exception.InvalidQueueException;
import io.jobs4j.exception.InvalidScheduleException;
import io.jobs4j.exception.MissingScheduleException;
import io.jobs4j.utils.CronSchedules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns handler descriptors into validated job and cron configurations.
 *
 * <p>Queue resolution: the handler's own queue, then the configured default queue, then
 * {@code "default"}. The resolved queue is seeded into the options bag under {@code queue}
 * before the handler's own options are merged on top, so a handler can still override it.
 */
public class JobConfigExtractor {

    public static final String QUEUE_OPTION = "queue";

    private final JobsSettings settings;

    public JobConfigExtractor(JobsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public JobConfig extractJobConfig(HandlerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        String queue = resolveQueue(descriptor.queue());
        return new JobConfig(
                JobNames.resolve(descriptor),
                queue,
                options(queue, descriptor.workOptions())
        );
    }

    /**
     * @throws MissingScheduleException if the descriptor carries no schedule
     */
    public CronConfig extractCronConfig(HandlerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        String schedule = descriptor.schedule();
        if (schedule == null || schedule.isBlank()) {
            throw new MissingScheduleException(descriptor.typeName());
        }
        String queue = resolveQueue(descriptor.queue());
        return new CronConfig(
                JobNames.resolve(descriptor),
                queue,
                schedule.trim(),
                options(queue, descriptor.scheduleOptions()),
                options(queue, descriptor.workOptions())
        );
    }

    /**
     * @param source file path (or other origin) reported in the error message
     * @throws InvalidQueueException if a queue list is configured and does not contain the queue
     */
    public void validateJobConfig(JobConfig config, String source) {
        Objects.requireNonNull(config, "config must not be null");
        validateQueue(config.queue(), source);
    }

    /**
     * Same queue check as {@link #validateJobConfig}, plus the cron expression must be evaluable.
     *
     * @throws InvalidScheduleException if the schedule is malformed
     */
    public void validateCronConfig(CronConfig config, String source) {
        Objects.requireNonNull(config, "config must not be null");
        validateQueue(config.queue(), source);
        try {
            CronSchedules.validate(config.schedule());
        } catch (IllegalArgumentException ex) {
            throw new InvalidScheduleException(config.schedule(), source, ex);
        }
    }

    public String resolveQueue(String specifiedQueue) {
        if (specifiedQueue != null && !specifiedQueue.isBlank()) {
            return specifiedQueue;
        }
        return settings.defaultQueue() != null ? settings.defaultQueue() : JobsSettings.FALLBACK_QUEUE;
    }

    private void validateQueue(String queue, String source) {
        if (settings.hasQueues() && !settings.queues().contains(queue)) {
            throw new InvalidQueueException(queue, source, settings.queues());
        }
    }

    private static Map<String, Object> options(String queue, Map<String, Object> own) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put(QUEUE_OPTION, queue);
        if (own != null) {
            options.putAll(own);
        }
        return Collections.unmodifiableMap(options);
    }
}
