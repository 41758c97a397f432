package com.largomodo.circuitcheck.operation;

/**
 * Semantic role of a native operation.
 * <p>
 * Validation rules that single out operations (measurement keys, MOVE sandwiches and what may
 * run inside them) match on the role, so renaming a gate only touches {@link SupportedOperations}.
 */
public enum OperationRole {
    BARRIER,
    DELAY,
    MEASUREMENT,
    RESET,
    SINGLE_QUBIT_ROTATION,
    CONDITIONAL_ROTATION,
    TWO_QUBIT_ENTANGLER,
    MOVE
}
