package com.largomodo.circuitcheck.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Architecture-independent description of a native quantum operation.
 *
 * @param name                native operation name as used in instructions
 * @param arity               number of locus components, or {@code 0} for any positive number
 * @param role                semantic role used by role-based validation rules
 * @param params              required arguments and their value kinds
 * @param optionalParams      arguments that may be present
 * @param symmetric           any permutation of an allowed locus is also allowed
 * @param factorizable        locus components are checked one by one instead of as a tuple
 * @param noCalibrationNeeded runs on any component of the architecture without a gate entry
 */
public record NativeOperation(String name,
                              int arity,
                              OperationRole role,
                              Map<String, ParameterKind> params,
                              Map<String, ParameterKind> optionalParams,
                              boolean symmetric,
                              boolean factorizable,
                              boolean noCalibrationNeeded) {

    public NativeOperation {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (arity < 0) {
            throw new IllegalArgumentException("arity must be non-negative, got: " + arity);
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        optionalParams = optionalParams == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(optionalParams));
    }

    public boolean hasFixedArity() {
        return arity > 0;
    }

    /**
     * Kind of the named argument, whether required or optional, or {@code null} if unknown.
     */
    public ParameterKind parameterKind(String argName) {
        ParameterKind kind = params.get(argName);
        return kind != null ? kind : optionalParams.get(argName);
    }
}
