package io.jobs4j.exception;

import java.util.List;

/**
 * A handler resolved to a queue that is not part of the configured queue list.
 */
public class InvalidQueueException extends JobsConfigurationException {

    private final String queue;
    private final String source;
    private final List<String> allowedQueues;

    public InvalidQueueException(String queue, String source, List<String> allowedQueues) {
        super("Invalid queue \"" + queue + "\" in " + source + ". Available queues: " + String.join(", ", allowedQueues));
        this.queue = queue;
        this.source = source;
        this.allowedQueues = List.copyOf(allowedQueues);
    }

    public String queue() {
        return queue;
    }

    /**
     * File path (or other origin) of the offending handler.
     */
    public String source() {
        return source;
    }

    /**
     * Configured queues, in declaration order.
     */
    public List<String> allowedQueues() {
        return allowedQueues;
    }
}
