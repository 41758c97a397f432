package com.largomodo.circuitcheck.circuit;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Named quantum circuit. Instruction order is execution order.
 *
 * @param name         circuit name, used in diagnostics
 * @param instructions instructions in execution order (unmodifiable)
 */
public record Circuit(String name, List<Instruction> instructions) {

    public Circuit {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        if (instructions == null) {
            throw new IllegalArgumentException("instructions must not be null");
        }
        instructions = List.copyOf(instructions);
    }

    /**
     * Every qubit name referenced by any instruction, in first-use order.
     */
    public Set<String> allQubits() {
        Set<String> qubits = new LinkedHashSet<>();
        for (Instruction instruction : instructions) {
            qubits.addAll(instruction.qubits());
        }
        return qubits;
    }
}
