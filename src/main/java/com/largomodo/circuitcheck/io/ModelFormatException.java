package com.largomodo.circuitcheck.io;

/**
 * Thrown when an architecture, circuit batch or qubit mapping document cannot be turned into the model.
 * <p>
 * Unchecked, like the validation failures it precedes; the CLI maps both to exit code 1.
 */
public class ModelFormatException extends RuntimeException {

    public ModelFormatException(String message) {
        super(message);
    }

    public ModelFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
