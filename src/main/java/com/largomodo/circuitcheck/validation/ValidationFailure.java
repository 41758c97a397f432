package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.circuit.Instruction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured description of the first validation rule a circuit batch broke.
 * <p>
 * Fields that do not apply to a given reason are {@code null} (or empty for collections).
 *
 * @param reason       reason code
 * @param circuitIndex index of the failing circuit in the batch, {@code null} for batch-wide failures
 * @param message      human-readable description, without the circuit prefix
 * @param instruction  offending instruction as written in the circuit
 * @param operation    resolved operation name, {@code op} or {@code op.implementation}
 * @param locus        locus as written in the circuit
 * @param mappedLocus  locus after applying the qubit mapping, {@code null} if no mapping was given
 * @param component    single offending component (physical or logical, see message)
 * @param qubits       offending qubit set, e.g. unmapped qubits or parked qubits touched
 */
public record ValidationFailure(FailureReason reason,
                                Integer circuitIndex,
                                String message,
                                Instruction instruction,
                                String operation,
                                List<String> locus,
                                List<String> mappedLocus,
                                String component,
                                Set<String> qubits) {

    public ValidationFailure {
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        locus = locus == null ? null : List.copyOf(locus);
        mappedLocus = mappedLocus == null ? null : List.copyOf(mappedLocus);
        qubits = qubits == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(qubits));
    }

    public static Builder builder(FailureReason reason, String message) {
        return new Builder(reason, message);
    }

    public ValidationFailure atCircuit(int index) {
        return new ValidationFailure(reason, index, message, instruction, operation,
                locus, mappedLocus, component, qubits);
    }

    /**
     * Message with the circuit prefix, as shown to end users.
     */
    public String describe() {
        return circuitIndex == null ? message : "Circuit " + circuitIndex + ": " + message;
    }

    public static final class Builder {
        private final FailureReason reason;
        private final String message;
        private Integer circuitIndex;
        private Instruction instruction;
        private String operation;
        private List<String> locus;
        private List<String> mappedLocus;
        private String component;
        private Set<String> qubits;

        private Builder(FailureReason reason, String message) {
            this.reason = reason;
            this.message = message;
        }

        public Builder circuitIndex(int circuitIndex) {
            this.circuitIndex = circuitIndex;
            return this;
        }

        /**
         * Records the instruction together with its written locus.
         */
        public Builder instruction(Instruction instruction) {
            this.instruction = instruction;
            this.locus = instruction.qubits();
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder mappedLocus(List<String> mappedLocus) {
            this.mappedLocus = mappedLocus;
            return this;
        }

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public Builder qubits(Set<String> qubits) {
            this.qubits = qubits;
            return this;
        }

        public ValidationFailure build() {
            return new ValidationFailure(reason, circuitIndex, message, instruction, operation,
                    locus, mappedLocus, component, qubits);
        }

        public CircuitValidationException toException() {
            return new CircuitValidationException(build());
        }
    }
}
