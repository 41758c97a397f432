package com.largomodo.circuitcheck.architecture;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calibrated implementations of one quantum operation.
 * <p>
 * Implementations keep their declaration order. Each implementation carries its own loci;
 * {@link #loci()} is the union used when an instruction does not ask for a specific implementation.
 *
 * @param implementations               implementation name to its loci (unmodifiable, insertion ordered)
 * @param defaultImplementation         implementation used when the instruction names none
 * @param overrideDefaultImplementation per-locus replacement for the default implementation
 */
public record GateInfo(Map<String, GateImplementationInfo> implementations,
                       String defaultImplementation,
                       Map<List<String>, String> overrideDefaultImplementation) {

    public GateInfo {
        if (implementations == null || implementations.isEmpty()) {
            throw new IllegalArgumentException("A gate must declare at least one implementation");
        }
        implementations = Collections.unmodifiableMap(new LinkedHashMap<>(implementations));
        if (defaultImplementation == null || !implementations.containsKey(defaultImplementation)) {
            throw new IllegalArgumentException(
                    "Default implementation '" + defaultImplementation + "' is not among " + implementations.keySet());
        }

        Map<List<String>, String> overrides = new LinkedHashMap<>();
        if (overrideDefaultImplementation != null) {
            for (Map.Entry<List<String>, String> entry : overrideDefaultImplementation.entrySet()) {
                if (!implementations.containsKey(entry.getValue())) {
                    throw new IllegalArgumentException("Override for locus " + entry.getKey()
                            + " names unknown implementation '" + entry.getValue() + "'");
                }
                overrides.put(List.copyOf(entry.getKey()), entry.getValue());
            }
        }
        overrideDefaultImplementation = Collections.unmodifiableMap(overrides);
    }

    /**
     * Convenience factory for a gate without per-locus overrides.
     */
    public static GateInfo of(String defaultImplementation, Map<String, GateImplementationInfo> implementations) {
        return new GateInfo(implementations, defaultImplementation, Map.of());
    }

    /**
     * All loci of all implementations, de-duplicated, in implementation declaration order.
     */
    public List<List<String>> loci() {
        Set<List<String>> loci = new LinkedHashSet<>();
        implementations.values().forEach(impl -> loci.addAll(impl.loci()));
        return List.copyOf(loci);
    }

    /**
     * Implementation the hardware would pick for the given locus when the instruction names none.
     */
    public String defaultImplementationFor(List<String> locus) {
        return overrideDefaultImplementation.getOrDefault(locus, defaultImplementation);
    }
}
