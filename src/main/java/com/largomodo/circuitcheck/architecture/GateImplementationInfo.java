package com.largomodo.circuitcheck.architecture;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loci on which one implementation of a gate has been calibrated.
 *
 * @param loci allowed loci, each an ordered tuple of component names (unmodifiable)
 */
public record GateImplementationInfo(List<List<String>> loci) {

    public GateImplementationInfo {
        if (loci == null) {
            throw new IllegalArgumentException("loci must not be null");
        }
        loci = loci.stream().map(List::copyOf).toList();
        for (List<String> locus : loci) {
            if (locus.isEmpty()) {
                throw new IllegalArgumentException("locus must contain at least one component");
            }
        }
    }

    /**
     * Union of all components appearing in any allowed locus, in first-seen order.
     */
    public Set<String> components() {
        Set<String> components = new LinkedHashSet<>();
        loci.forEach(components::addAll);
        return components;
    }
}
