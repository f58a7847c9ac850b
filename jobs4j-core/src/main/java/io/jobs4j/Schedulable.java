package io.jobs4j;

/**
 * A job handler triggered by a cron schedule. Cron jobs do not receive payload data.
 *
 * <p>The schedule itself is declared with {@link io.jobs4j.annotation.Schedule}.
 */
public interface Schedulable {

    void handle() throws Exception;
}
