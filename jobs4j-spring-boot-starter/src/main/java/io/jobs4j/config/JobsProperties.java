package io.jobs4j.config;

import io.jobs4j.core.JobsSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for job discovery and the default queue engine.
 */
@ConfigurationProperties(prefix = "jobs")
public class JobsProperties {
    private boolean enabled = true;
    private boolean autoStart = true;
    private String jobsPath = JobsSettings.DEFAULT_JOBS_PATH;
    private String cronPath = JobsSettings.DEFAULT_CRON_PATH;
    private List<String> queues = new ArrayList<>();
    private String defaultQueue;
    private boolean failOnDiscoveryError = true;
    private InMemoryEngineProperties memory = new InMemoryEngineProperties();

    public JobsSettings toSettings() {
        return JobsSettings.builder()
                .jobsPath(Path.of(jobsPath))
                .cronPath(Path.of(cronPath))
                .queues(queues)
                .defaultQueue(defaultQueue)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getJobsPath() {
        return jobsPath;
    }

    public void setJobsPath(String jobsPath) {
        this.jobsPath = jobsPath;
    }

    public String getCronPath() {
        return cronPath;
    }

    public void setCronPath(String cronPath) {
        this.cronPath = cronPath;
    }

    public List<String> getQueues() {
        return queues;
    }

    public void setQueues(List<String> queues) {
        this.queues = queues;
    }

    public String getDefaultQueue() {
        return defaultQueue;
    }

    public void setDefaultQueue(String defaultQueue) {
        this.defaultQueue = defaultQueue;
    }

    public boolean isFailOnDiscoveryError() {
        return failOnDiscoveryError;
    }

    public void setFailOnDiscoveryError(boolean failOnDiscoveryError) {
        this.failOnDiscoveryError = failOnDiscoveryError;
    }

    public InMemoryEngineProperties getMemory() {
        return memory;
    }

    public void setMemory(InMemoryEngineProperties memory) {
        this.memory = memory;
    }
}
