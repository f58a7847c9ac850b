package io.jobs4j.exception;

/**
 * Two distinct handler types resolved to the same job name within one discovery pass.
 */
public class DuplicateJobNameException extends JobsConfigurationException {

    private final String jobName;

    public DuplicateJobNameException(String jobName, Class<?> existing, Class<?> duplicate, String source) {
        super("Duplicate job name \"" + jobName + "\" in " + source + ": " + duplicate.getName()
                + " conflicts with already registered " + existing.getName());
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }
}
