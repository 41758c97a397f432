package com.largomodo.circuitcheck.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One native quantum operation applied to a locus.
 *
 * @param name           native operation name, e.g. {@code prx}, {@code cz}, {@code move}
 * @param qubits         locus as written in the circuit (logical names when a qubit mapping is used)
 * @param args           operation arguments, e.g. the measurement {@code key} (unmodifiable)
 * @param implementation requested implementation, or {@code null} for the hardware default
 */
public record Instruction(String name, List<String> qubits, Map<String, Object> args, String implementation) {

    public Instruction {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (qubits == null) {
            throw new IllegalArgumentException("qubits must not be null");
        }
        for (String qubit : qubits) {
            if (qubit == null) {
                throw new IllegalArgumentException("Instruction '" + name + "' has a null qubit name: " + qubits);
            }
        }
        qubits = List.copyOf(qubits);
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static Instruction of(String name, List<String> qubits, Map<String, Object> args) {
        return new Instruction(name, qubits, args, null);
    }

    public static Instruction of(String name, String... qubits) {
        return new Instruction(name, List.of(qubits), Map.of(), null);
    }

    public Instruction withImplementation(String implementation) {
        return new Instruction(name, qubits, args, implementation);
    }

    public Instruction withQubits(List<String> qubits) {
        return new Instruction(name, qubits, args, implementation);
    }

    public Optional<String> implementationName() {
        return Optional.ofNullable(implementation);
    }

    @Override
    public String toString() {
        String impl = implementation == null ? "" : ", implementation='" + implementation + "'";
        return "Instruction(name='" + name + "', qubits=" + qubits + ", args=" + args + impl + ")";
    }
}
