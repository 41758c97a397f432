package com.largomodo.circuitcheck.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Logical to physical qubit name translation shared by every circuit in a batch.
 * <p>
 * {@link #NONE} stands for "circuits already use physical names". Every check that needs the
 * physical view of a locus goes through {@link #apply(List)}, so all rules see the same names.
 */
public final class QubitMapping {

    public static final QubitMapping NONE = new QubitMapping(Map.of(), false);

    private final Map<String, String> logicalToPhysical;
    private final boolean present;

    private QubitMapping(Map<String, String> logicalToPhysical, boolean present) {
        this.logicalToPhysical = logicalToPhysical;
        this.present = present;
    }

    /**
     * Wraps a logical to physical map. A {@code null} map yields {@link #NONE}; an empty map is
     * a real mapping that covers no qubits.
     */
    public static QubitMapping of(Map<String, String> logicalToPhysical) {
        if (logicalToPhysical == null) {
            return NONE;
        }
        Map<String, String> copy = new LinkedHashMap<>();
        logicalToPhysical.forEach((logical, physical) -> {
            if (logical == null || physical == null) {
                throw new IllegalArgumentException("Qubit mapping entries must not be null: " + logical + " -> " + physical);
            }
            copy.put(logical, physical);
        });
        return new QubitMapping(Collections.unmodifiableMap(copy), true);
    }

    public boolean isPresent() {
        return present;
    }

    public Map<String, String> asMap() {
        return logicalToPhysical;
    }

    public Set<String> logicalQubits() {
        return logicalToPhysical.keySet();
    }

    public boolean covers(String logicalQubit) {
        return !present || logicalToPhysical.containsKey(logicalQubit);
    }

    /**
     * Translates a locus to physical component names. Without a mapping the locus is returned unchanged.
     *
     * @throws CircuitValidationException with {@link FailureReason#UNMAPPED_QUBITS} if a qubit has no mapping
     */
    public List<String> apply(List<String> locus) {
        if (!present) {
            return locus;
        }
        List<String> mapped = new ArrayList<>(locus.size());
        for (String qubit : locus) {
            String physical = logicalToPhysical.get(qubit);
            if (physical == null) {
                throw ValidationFailure.builder(FailureReason.UNMAPPED_QUBITS,
                                "Qubit " + qubit + " is not found in the provided qubit mapping.")
                        .qubits(Set.of(qubit))
                        .toException();
            }
            mapped.add(physical);
        }
        return List.copyOf(mapped);
    }

    @Override
    public String toString() {
        return present ? "QubitMapping" + logicalToPhysical : "QubitMapping[none]";
    }
}
