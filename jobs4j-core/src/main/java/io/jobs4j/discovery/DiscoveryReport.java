package io.jobs4j.discovery;

import java.util.List;

/**
 * Job names registered by one discovery pass, in registration order.
 */
public record DiscoveryReport(List<String> jobNames, List<String> cronNames) {

    public DiscoveryReport {
        jobNames = jobNames == null ? List.of() : List.copyOf(jobNames);
        cronNames = cronNames == null ? List.of() : List.copyOf(cronNames);
    }

    public int total() {
        return jobNames.size() + cronNames.size();
    }
}
