package io.jobs4j.fixtures;

import io.jobs4j.Dispatchable;

public abstract class AbstractReportJob implements Dispatchable<Object> {
}
