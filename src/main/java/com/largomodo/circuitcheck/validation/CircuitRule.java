package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.circuit.Circuit;

/**
 * One admissibility rule applied to a single circuit.
 * <p>
 * Rules are stateless between calls; any state a rule needs lives in locals of one
 * {@link #check} invocation, so a rule instance may be shared across threads.
 */
public interface CircuitRule {

    /**
     * Validates a circuit against the architecture and settings in {@code context}.
     * <p>
     * Failures do not carry a circuit index; the batch validator attaches it.
     *
     * @param context architecture, qubit mapping and options of the current batch
     * @param circuit circuit to check
     * @throws CircuitValidationException on the first violation found
     */
    void check(ValidationContext context, Circuit circuit) throws CircuitValidationException;
}
