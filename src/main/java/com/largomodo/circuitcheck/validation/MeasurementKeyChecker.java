package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.circuit.Instruction;
import com.largomodo.circuitcheck.operation.OperationRole;
import com.largomodo.circuitcheck.operation.SupportedOperations;

import java.util.Set;

/**
 * Ensures measurement result labels are unique within one circuit.
 * Keys may repeat across circuits of the same batch, so callers pass a fresh key set per circuit.
 */
public class MeasurementKeyChecker {

    /**
     * Records the key of a measurement instruction; other instructions are ignored.
     * <p>
     * Non-string keys never reach this check when the static pass ran first, and are skipped here.
     *
     * @param instruction instruction as written in the circuit
     * @param seenKeys    keys already used by earlier measurements of the same circuit, updated in place
     * @throws CircuitValidationException if the key was already used in this circuit
     */
    public void check(Instruction instruction, Set<String> seenKeys) {
        if (!SupportedOperations.hasRole(instruction.name(), OperationRole.MEASUREMENT)) {
            return;
        }
        Object key = instruction.args().get(SupportedOperations.MEASUREMENT_KEY);
        if (!(key instanceof String)) {
            return;
        }
        if (!seenKeys.add((String) key)) {
            throw ValidationFailure.builder(FailureReason.DUPLICATE_MEASUREMENT_KEY,
                            instruction + " has a non-unique measurement key.")
                    .instruction(instruction)
                    .operation(instruction.name())
                    .toException();
        }
    }
}
