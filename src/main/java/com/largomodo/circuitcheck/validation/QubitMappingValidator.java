package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;
import com.largomodo.circuitcheck.circuit.Circuit;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a logical to physical qubit mapping once for the whole batch.
 * <p>
 * Checks, in order: injectivity, coverage of every qubit used by every circuit, and that
 * each target is a component of the architecture. Stops at the first violation.
 */
public class QubitMappingValidator {

    /**
     * @throws CircuitValidationException on the first mapping violation; no-op without a mapping
     */
    public void validate(DynamicArchitecture architecture, List<Circuit> circuits, QubitMapping mapping) {
        if (!mapping.isPresent()) {
            return;
        }

        Map<String, String> physicalToLogical = new HashMap<>();
        for (Map.Entry<String, String> entry : mapping.asMap().entrySet()) {
            String previous = physicalToLogical.putIfAbsent(entry.getValue(), entry.getKey());
            if (previous != null) {
                throw ValidationFailure.builder(FailureReason.NON_INJECTIVE_MAPPING,
                                "Multiple logical qubits map to the same physical qubit.")
                        .component(entry.getValue())
                        .qubits(Set.of(previous, entry.getKey()))
                        .toException();
            }
        }

        for (int i = 0; i < circuits.size(); i++) {
            Circuit circuit = circuits.get(i);
            Set<String> missing = new LinkedHashSet<>(circuit.allQubits());
            missing.removeAll(mapping.logicalQubits());
            if (!missing.isEmpty()) {
                throw ValidationFailure.builder(FailureReason.UNMAPPED_QUBITS,
                                "The qubits " + missing + " in circuit '" + circuit.name() + "' at index " + i
                                        + " are not found in the provided qubit mapping.")
                        .circuitIndex(i)
                        .qubits(missing)
                        .toException();
            }
        }

        for (String physical : mapping.asMap().values()) {
            if (!architecture.components().contains(physical)) {
                throw ValidationFailure.builder(FailureReason.UNMAPPED_TARGET_MISSING,
                                "Component " + physical + " not present in dynamic quantum architecture")
                        .component(physical)
                        .toException();
            }
        }
    }
}
