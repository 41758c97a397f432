package com.largomodo.circuitcheck.validation;

/**
 * Caller-selected validation settings.
 *
 * @param moveValidation      MOVE sandwich checking mode
 * @param mustCloseSandwiches whether a circuit may end while a qubit state is still parked in a resonator
 */
public record ValidationOptions(MoveGateValidationMode moveValidation, boolean mustCloseSandwiches) {

    public ValidationOptions {
        if (moveValidation == null) {
            throw new IllegalArgumentException("moveValidation must not be null");
        }
    }

    /**
     * Settings for a final, executable circuit batch: strict MOVE checks, sandwiches must be closed.
     */
    public static ValidationOptions forExecution() {
        return new ValidationOptions(MoveGateValidationMode.STRICT, true);
    }

    /**
     * Settings used while assembling a run request; open sandwiches are tolerated.
     */
    public static ValidationOptions forRunRequest(MoveGateValidationMode moveValidation) {
        return new ValidationOptions(moveValidation, false);
    }

    public ValidationOptions withMoveValidation(MoveGateValidationMode moveValidation) {
        return new ValidationOptions(moveValidation, mustCloseSandwiches);
    }
}
