package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.circuit.Circuit;
import com.largomodo.circuitcheck.circuit.Instruction;
import com.largomodo.circuitcheck.operation.NativeOperation;
import com.largomodo.circuitcheck.operation.ParameterKind;
import com.largomodo.circuitcheck.operation.SupportedOperations;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Architecture-independent checks of instruction shape against the native operation table:
 * operation name, arity, repeated locus components, and arguments.
 * <p>
 * Runs before any architecture-dependent rule, so later rules may rely on well-formed
 * instructions (e.g. a measurement always has a string key).
 */
public class StaticCircuitValidator implements CircuitRule {

    @Override
    public void check(ValidationContext context, Circuit circuit) {
        for (Instruction instruction : circuit.instructions()) {
            validate(instruction);
        }
    }

    /**
     * @throws CircuitValidationException if the instruction is malformed
     */
    public void validate(Instruction instruction) {
        NativeOperation op = SupportedOperations.find(instruction.name())
                .orElseThrow(() -> ValidationFailure.builder(FailureReason.UNKNOWN_OPERATION,
                                "Unknown quantum operation '" + instruction.name() + "'.")
                        .instruction(instruction)
                        .operation(instruction.name())
                        .toException());

        int size = instruction.qubits().size();
        if (size == 0 || (op.hasFixedArity() && size != op.arity())) {
            String expected = op.hasFixedArity() ? String.valueOf(op.arity()) : "at least 1";
            throw ValidationFailure.builder(FailureReason.INVALID_ARITY,
                            instruction + ": operation '" + op.name() + "' acts on " + expected
                                    + " component(s), got " + size + ".")
                    .instruction(instruction)
                    .operation(op.name())
                    .toException();
        }

        Set<String> seen = new HashSet<>();
        for (String qubit : instruction.qubits()) {
            if (!seen.add(qubit)) {
                throw ValidationFailure.builder(FailureReason.DUPLICATE_LOCUS_COMPONENT,
                                instruction + ": component " + qubit + " appears more than once in the locus.")
                        .instruction(instruction)
                        .operation(op.name())
                        .component(qubit)
                        .toException();
            }
        }

        for (String required : op.params().keySet()) {
            if (!instruction.args().containsKey(required)) {
                throw ValidationFailure.builder(FailureReason.MISSING_ARGUMENT,
                                instruction + ": operation '" + op.name() + "' requires argument '" + required + "'.")
                        .instruction(instruction)
                        .operation(op.name())
                        .toException();
            }
        }

        for (Map.Entry<String, Object> arg : instruction.args().entrySet()) {
            ParameterKind kind = op.parameterKind(arg.getKey());
            if (kind == null) {
                throw ValidationFailure.builder(FailureReason.UNEXPECTED_ARGUMENT,
                                instruction + ": operation '" + op.name() + "' does not accept argument '"
                                        + arg.getKey() + "'.")
                        .instruction(instruction)
                        .operation(op.name())
                        .toException();
            }
            if (!kind.accepts(arg.getValue())) {
                throw ValidationFailure.builder(FailureReason.INVALID_ARGUMENT,
                                instruction + ": argument '" + arg.getKey() + "' of '" + op.name()
                                        + "' must be a " + kind.name().toLowerCase() + ".")
                        .instruction(instruction)
                        .operation(op.name())
                        .toException();
            }
        }
    }
}
