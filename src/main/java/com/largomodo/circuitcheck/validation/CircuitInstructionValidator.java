package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.circuit.Circuit;
import com.largomodo.circuitcheck.circuit.Instruction;

import java.util.HashSet;
import java.util.Set;

/**
 * Walks a circuit's instructions in order, checking each one's locus and implementation and
 * then its measurement key, so the first offending instruction is the one reported.
 */
public class CircuitInstructionValidator implements CircuitRule {

    private final InstructionValidator instructionValidator;
    private final MeasurementKeyChecker keyChecker;

    public CircuitInstructionValidator() {
        this(new InstructionValidator(), new MeasurementKeyChecker());
    }

    public CircuitInstructionValidator(InstructionValidator instructionValidator, MeasurementKeyChecker keyChecker) {
        this.instructionValidator = instructionValidator;
        this.keyChecker = keyChecker;
    }

    @Override
    public void check(ValidationContext context, Circuit circuit) {
        Set<String> seenKeys = new HashSet<>();
        for (Instruction instruction : circuit.instructions()) {
            instructionValidator.validate(context.architecture(), instruction, context.mapping());
            keyChecker.check(instruction, seenKeys);
        }
    }
}
