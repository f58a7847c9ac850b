package io.jobs4j.fixtures;

import io.jobs4j.Schedulable;

public class UnscheduledCron implements Schedulable {

    @Override
    public void handle() {
    }
}
