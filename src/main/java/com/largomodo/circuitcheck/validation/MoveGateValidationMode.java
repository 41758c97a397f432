package com.largomodo.circuitcheck.validation;

import com.largomodo.circuitcheck.operation.OperationRole;

import java.util.EnumSet;
import java.util.Set;

/**
 * How strictly MOVE sandwiches are checked.
 * <p>
 * The mode only changes which operations may touch a qubit whose state is parked in a resonator.
 * Open/close pairing is enforced identically by every mode except {@link #NONE}.
 */
public enum MoveGateValidationMode {
    NONE(EnumSet.noneOf(OperationRole.class)),     // MOVE tracking disabled
    STRICT(EnumSet.of(OperationRole.BARRIER)),
    ALLOW_PRX(EnumSet.of(OperationRole.BARRIER, OperationRole.SINGLE_QUBIT_ROTATION));

    private final Set<OperationRole> allowedInSandwich;

    MoveGateValidationMode(Set<OperationRole> allowedInSandwich) {
        this.allowedInSandwich = allowedInSandwich;
    }

    public boolean isEnabled() {
        return this != NONE;
    }

    /**
     * Whether operations with the given role may act on a qubit whose state is parked in a resonator.
     */
    public boolean allowsInSandwich(OperationRole role) {
        return allowedInSandwich.contains(role);
    }
}
