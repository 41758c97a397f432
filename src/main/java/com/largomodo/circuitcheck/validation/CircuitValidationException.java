package com.largomodo.circuitcheck.validation;

/**
 * Thrown when a circuit batch cannot run on the given architecture snapshot.
 * <p>
 * RuntimeException enables fail-fast validation without catch blocks at every call site.
 * The structured {@link ValidationFailure} carries the reason code and context.
 */
public class CircuitValidationException extends RuntimeException {

    private final transient ValidationFailure failure;

    /**
     * Constructs exception from a structured failure.
     *
     * @param failure Details about the violated rule
     */
    public CircuitValidationException(ValidationFailure failure) {
        super(failure.describe());
        this.failure = failure;
    }

    /**
     * Constructs exception with failure and underlying cause.
     */
    public CircuitValidationException(ValidationFailure failure, Throwable cause) {
        super(failure.describe(), cause);
        this.failure = failure;
    }

    public ValidationFailure failure() {
        return failure;
    }

    public FailureReason reason() {
        return failure.reason();
    }

    /**
     * Re-raises this failure attributed to the circuit at {@code index}.
     */
    public CircuitValidationException atCircuit(int index) {
        CircuitValidationException located = new CircuitValidationException(failure.atCircuit(index), getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }
}
