package io.jobs4j.exception;

public class InvalidScheduleException extends JobsException {

    private final String schedule;

    public InvalidScheduleException(String schedule, String source, Throwable cause) {
        super("Invalid schedule \"" + schedule + "\" in " + source
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.schedule = schedule;
    }

    public String schedule() {
        return schedule;
    }
}
