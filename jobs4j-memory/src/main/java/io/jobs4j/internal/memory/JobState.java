package io.jobs4j.internal.memory;

public enum JobState {
    CREATED,
    RETRY,
    ACTIVE,
    COMPLETED,
    FAILED
}
