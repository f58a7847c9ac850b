package io.jobs4j.exception;

import java.util.List;

public class InvalidDefaultQueueException extends JobsConfigurationException {

    private final String defaultQueue;
    private final List<String> allowedQueues;

    public InvalidDefaultQueueException(String defaultQueue, List<String> allowedQueues) {
        super("Invalid defaultQueue \"" + defaultQueue + "\". Must be one of: " + String.join(", ", allowedQueues));
        this.defaultQueue = defaultQueue;
        this.allowedQueues = List.copyOf(allowedQueues);
    }

    public String defaultQueue() {
        return defaultQueue;
    }

    public List<String> allowedQueues() {
        return allowedQueues;
    }
}
