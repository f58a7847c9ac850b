package io.jobs4j.internal.memory;

/**
 * Snapshot of a job held by {@link InMemoryQueueEngine}.
 *
 * @param attempts number of times a worker has been invoked with the job
 */
public record QueuedJobState(String id, String name, JobState state, int attempts) {
}
