package io.jobs4j.fixtures;

import io.jobs4j.Schedulable;
import io.jobs4j.annotation.Schedule;

@Schedule("every day at noon")
public class BrokenScheduleCron implements Schedulable {

    @Override
    public void handle() {
    }
}
