package io.jobs4j.discovery;

/**
 * File naming conventions for handler class files.
 *
 * <p>Only compiled top-level classes are candidates: nested and anonymous class files
 * ({@code Outer$Inner.class}) never match.
 */
public enum HandlerFileConvention {
    JOB("Job"),
    CRON("Cron");

    private static final String CLASS_EXTENSION = ".class";

    private final String suffix;

    HandlerFileConvention(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Class name suffix, e.g. {@code "Job"} for {@code SendEmailJob.class}.
     */
    public String suffix() {
        return suffix;
    }

    public boolean matches(String fileName) {
        if (fileName == null || fileName.indexOf('$') >= 0) {
            return false;
        }
        return fileName.endsWith(suffix + CLASS_EXTENSION);
    }
}
