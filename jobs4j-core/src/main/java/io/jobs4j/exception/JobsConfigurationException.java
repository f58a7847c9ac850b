package io.jobs4j.exception;

/**
 * A static misconfiguration. Always fatal to the current discovery pass.
 */
public class JobsConfigurationException extends JobsException {

    public JobsConfigurationException(String message) {
        super(message);
    }
}
