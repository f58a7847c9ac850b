package io.jobs4j.exception;

public class MissingScheduleException extends JobsException {

    private final String typeName;

    public MissingScheduleException(String typeName) {
        super("Schedulable class " + typeName + " must declare a schedule");
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
