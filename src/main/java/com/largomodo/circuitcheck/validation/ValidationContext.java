package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.architecture.DynamicArchitecture;

/**
 * Read-only inputs shared by all rules during one batch validation.
 *
 * @param architecture architecture snapshot to validate against
 * @param mapping      logical to physical qubit mapping, {@link QubitMapping#NONE} if circuits use physical names
 * @param options      caller-selected settings
 */
public record ValidationContext(DynamicArchitecture architecture, QubitMapping mapping, ValidationOptions options) {

    public ValidationContext {
        if (architecture == null) {
            throw new IllegalArgumentException("architecture must not be null");
        }
        mapping = mapping == null ? QubitMapping.NONE : mapping;
        options = options == null ? ValidationOptions.forExecution() : options;
    }
}
