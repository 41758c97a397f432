package com.largomodo.circuitcheck.architecture;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Snapshot of the quantum architecture valid for one calibration set.
 * <p>
 * Which gates exist and on which loci they may run changes with every recalibration, so
 * circuits are validated against whichever snapshot the caller hands in. Instances are
 * immutable and may be shared by concurrent validations.
 */
public final class DynamicArchitecture {

    private final UUID calibrationSetId;
    private final List<String> qubits;
    private final List<String> computationalResonators;
    private final Map<String, GateInfo> gates;
    private final Set<String> qubitSet;
    private final Set<String> resonatorSet;
    private final Set<String> components;

    /**
     * @param calibrationSetId        calibration set this snapshot describes
     * @param qubits                  physical qubit names
     * @param computationalResonators computational resonator names, disjoint from {@code qubits}
     * @param gates                   operation name to calibrated implementations
     * @throws IllegalArgumentException if a name is both a qubit and a resonator
     */
    public DynamicArchitecture(UUID calibrationSetId,
                               List<String> qubits,
                               List<String> computationalResonators,
                               Map<String, GateInfo> gates) {
        if (calibrationSetId == null) {
            throw new IllegalArgumentException("calibrationSetId must not be null");
        }
        if (qubits == null || computationalResonators == null || gates == null) {
            throw new IllegalArgumentException("qubits, computationalResonators and gates must not be null");
        }
        this.calibrationSetId = calibrationSetId;
        this.qubits = List.copyOf(qubits);
        this.computationalResonators = List.copyOf(computationalResonators);
        this.gates = Collections.unmodifiableMap(new LinkedHashMap<>(gates));

        this.qubitSet = Collections.unmodifiableSet(new LinkedHashSet<>(this.qubits));
        this.resonatorSet = Collections.unmodifiableSet(new LinkedHashSet<>(this.computationalResonators));

        Set<String> overlap = new LinkedHashSet<>(qubitSet);
        overlap.retainAll(resonatorSet);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Components cannot be both qubits and resonators: " + overlap);
        }

        Set<String> all = new LinkedHashSet<>(qubitSet);
        all.addAll(resonatorSet);
        this.components = Collections.unmodifiableSet(all);
    }

    public UUID calibrationSetId() {
        return calibrationSetId;
    }

    public List<String> qubits() {
        return qubits;
    }

    public List<String> computationalResonators() {
        return computationalResonators;
    }

    public Map<String, GateInfo> gates() {
        return gates;
    }

    /**
     * All addressable components: qubits first, then computational resonators.
     */
    public Set<String> components() {
        return components;
    }

    public boolean isQubit(String component) {
        return qubitSet.contains(component);
    }

    public boolean isResonator(String component) {
        return resonatorSet.contains(component);
    }

    public Optional<GateInfo> gate(String operationName) {
        return Optional.ofNullable(gates.get(operationName));
    }

    public boolean supports(String operationName) {
        return gates.containsKey(operationName);
    }

    @Override
    public String toString() {
        return "DynamicArchitecture[calibrationSetId=" + calibrationSetId
                + ", qubits=" + qubits
                + ", computationalResonators=" + computationalResonators
                + ", gates=" + gates.keySet() + "]";
    }
}
