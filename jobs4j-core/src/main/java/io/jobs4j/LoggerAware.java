package io.jobs4j;

import org.slf4j.Logger;

/**
 * Implemented by handlers that want a logger injected before each invocation of {@code handle}.
 */
public interface LoggerAware {

    void setLogger(Logger logger);
}
