package io.jobs4j.discovery;

public enum DiscoveryState {
    NOT_STARTED,
    VALIDATING,
    SCANNING_JOBS,
    SCANNING_CRON,
    COMPLETE,
    FAILED
}
