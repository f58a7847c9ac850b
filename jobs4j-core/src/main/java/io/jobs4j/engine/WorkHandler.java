package io.jobs4j.engine;

import java.util.List;

/**
 * Worker callback installed with {@link QueueEngine#work}. Throwing marks the delivered jobs as
 * failed, leaving retry and dead-lettering to the engine.
 */
@FunctionalInterface
public interface WorkHandler {

    void handle(List<QueuedJob> jobs) throws Exception;
}
