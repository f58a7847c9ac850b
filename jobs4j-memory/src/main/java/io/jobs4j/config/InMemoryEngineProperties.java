package io.jobs4j.config;

import java.time.Duration;

/**
 * Runtime configuration for the in-memory queue engine.
 */
public class InMemoryEngineProperties {
    private int maxConcurrency = 10; // global
    private Duration processEvery = Duration.ofSeconds(1);
    private int retryLimit = 2; // retries after the first attempt
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean cleanupFinishedJobs = false;
    private int maxFinishedJobs = 1000; // kept for inspection when not cleaned up

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getRetryLimit() {
        return retryLimit;
    }

    public void setRetryLimit(int retryLimit) {
        this.retryLimit = retryLimit;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isCleanupFinishedJobs() {
        return cleanupFinishedJobs;
    }

    public void setCleanupFinishedJobs(boolean cleanupFinishedJobs) {
        this.cleanupFinishedJobs = cleanupFinishedJobs;
    }

    public int getMaxFinishedJobs() {
        return maxFinishedJobs;
    }

    public void setMaxFinishedJobs(int maxFinishedJobs) {
        this.maxFinishedJobs = maxFinishedJobs;
    }
}
