package io.jobs4j.core;

import io.jobs4j.Dispatchable;
import io.jobs4j.Schedulable;

/**
 * Handler capabilities recognised by discovery.
 */
public enum HandlerKind {
    /**
     * Single-argument {@code handle(payload)}, invoked on demand.
     */
    DISPATCHABLE(Dispatchable.class),
    /**
     * Zero-argument {@code handle()}, triggered by a cron schedule.
     */
    SCHEDULABLE(Schedulable.class);

    private final Class<?> contract;

    HandlerKind(Class<?> contract) {
        this.contract = contract;
    }

    public Class<?> contract() {
        return contract;
    }

    public boolean matches(Class<?> type) {
        return type != null && contract.isAssignableFrom(type);
    }
}
