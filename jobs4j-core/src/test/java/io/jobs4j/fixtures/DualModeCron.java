package io.jobs4j.fixtures;

import io.jobs4j.Dispatchable;
import io.jobs4j.Schedulable;
import io.jobs4j.annotation.Schedule;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cron handler that can also be dispatched; under the cron path only the scheduled entry point counts.
 */
@Schedule("*/15 * * * *")
public class DualModeCron implements Dispatchable<String>, Schedulable {

    public static final AtomicInteger RUNS = new AtomicInteger();
    public static final List<String> DISPATCHED = new CopyOnWriteArrayList<>();

    @Override
    public void handle() {
        RUNS.incrementAndGet();
    }

    @Override
    public void handle(String payload) {
        DISPATCHED.add(payload);
    }
}
