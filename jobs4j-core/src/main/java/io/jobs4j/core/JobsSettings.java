package io.jobs4j.core;

import io.jobs4j.exception.InvalidDefaultQueueException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Process-wide settings consulted by discovery and config extraction.
 *
 * <ul>
 *   <li>jobsPath: directory scanned for dispatchable handlers (default {@code app/jobs})</li>
 *   <li>cronPath: directory scanned for cron handlers (default {@code app/cron})</li>
 *   <li>queues: allowed queue names in declaration order; empty means any queue is accepted</li>
 *   <li>defaultQueue: queue for handlers without an explicit one; null falls back to {@code "default"}</li>
 * </ul>
 */
public final class JobsSettings {

    public static final String DEFAULT_JOBS_PATH = "app/jobs";
    public static final String DEFAULT_CRON_PATH = "app/cron";
    public static final String FALLBACK_QUEUE = "default";

    private final Path jobsPath;
    private final Path cronPath;
    private final List<String> queues;
    private final String defaultQueue;

    private JobsSettings(Builder b) {
        this.jobsPath = b.jobsPath;
        this.cronPath = b.cronPath;
        this.queues = List.copyOf(b.queues);
        this.defaultQueue = (b.defaultQueue == null || b.defaultQueue.isBlank()) ? null : b.defaultQueue;
    }

    public static JobsSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path jobsPath() {
        return jobsPath;
    }

    public Path cronPath() {
        return cronPath;
    }

    public List<String> queues() {
        return queues;
    }

    public boolean hasQueues() {
        return !queues.isEmpty();
    }

    public String defaultQueue() {
        return defaultQueue;
    }

    /**
     * Fails if both a default queue and a queue list are configured and the default is not listed.
     *
     * @throws InvalidDefaultQueueException on violation
     */
    public void validate() {
        if (defaultQueue != null && hasQueues() && !queues.contains(defaultQueue)) {
            throw new InvalidDefaultQueueException(defaultQueue, queues);
        }
    }

    @Override
    public String toString() {
        return "JobsSettings{jobsPath=" + jobsPath + ", cronPath=" + cronPath
                + ", queues=" + queues + ", defaultQueue=" + defaultQueue + '}';
    }

    public static final class Builder {
        private Path jobsPath = Path.of(DEFAULT_JOBS_PATH);
        private Path cronPath = Path.of(DEFAULT_CRON_PATH);
        private final List<String> queues = new ArrayList<>();
        private String defaultQueue;

        public Builder jobsPath(Path jobsPath) {
            this.jobsPath = Objects.requireNonNull(jobsPath, "jobsPath must not be null");
            return this;
        }

        public Builder cronPath(Path cronPath) {
            this.cronPath = Objects.requireNonNull(cronPath, "cronPath must not be null");
            return this;
        }

        public Builder queues(Collection<String> queues) {
            this.queues.clear();
            if (queues != null) {
                for (String q : queues) {
                    queue(q);
                }
            }
            return this;
        }

        public Builder queue(String queue) {
            Objects.requireNonNull(queue, "queue must not be null");
            if (queue.isBlank()) {
                throw new IllegalArgumentException("queue must not be blank");
            }
            if (!this.queues.contains(queue)) {
                this.queues.add(queue);
            }
            return this;
        }

        public Builder defaultQueue(String defaultQueue) {
            this.defaultQueue = defaultQueue;
            return this;
        }

        public JobsSettings build() {
            return new JobsSettings(this);
        }
    }
}
