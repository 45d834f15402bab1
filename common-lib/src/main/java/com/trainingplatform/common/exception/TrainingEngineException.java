package com.trainingplatform.common.exception;

/**
 * Raised only for structurally unusable requests (e.g. no target date).
 * Numeric or empty-data problems are handled inside the engines with local
 * defaults and never surface as exceptions.
 *
 * <p>Carries the engine component, the operation that rejected the input and,
 * when one specific input was at fault, its field name.
 */
public class TrainingEngineException extends RuntimeException {
    private final String component;
    private final String operation;
    private final String field;

    public TrainingEngineException(String component, String operation, String field, String message) {
        super("[" + component + "." + operation + "] " + message);
        this.component = component;
        this.operation = operation;
        this.field = field;
    }

    /** {@code field} was absent. */
    public static TrainingEngineException missing(String component, String operation, String field) {
        return new TrainingEngineException(component, operation, field, field + " is required");
    }

    public String getComponent() {
        return component;
    }

    public String getOperation() {
        return operation;
    }

    /** Offending input field, or {@code null} when the request as a whole was rejected. */
    public String getField() {
        return field;
    }
}
