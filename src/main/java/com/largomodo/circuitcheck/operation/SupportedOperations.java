package com.largomodo.circuitcheck.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of the native operations a circuit may contain.
 * <p>
 * Static utility: the table does not depend on the architecture and never changes at runtime.
 * Whether an operation is actually calibrated, and where, is decided by the dynamic architecture.
 */
public final class SupportedOperations {

    public static final String MEASUREMENT_KEY = "key";

    private static final Map<String, NativeOperation> OPERATIONS;

    static {
        Map<String, NativeOperation> ops = new LinkedHashMap<>();
        register(ops, new NativeOperation("barrier", 0, OperationRole.BARRIER,
                Map.of(), Map.of(), true, false, true));
        register(ops, new NativeOperation("delay", 0, OperationRole.DELAY,
                Map.of("duration", ParameterKind.NUMBER), Map.of(), true, false, true));
        register(ops, new NativeOperation("measure", 0, OperationRole.MEASUREMENT,
                Map.of(MEASUREMENT_KEY, ParameterKind.STRING),
                Map.of("feedback_key", ParameterKind.STRING), false, true, false));
        register(ops, new NativeOperation("prx", 1, OperationRole.SINGLE_QUBIT_ROTATION,
                ordered("angle_t", ParameterKind.NUMBER, "phase_t", ParameterKind.NUMBER),
                Map.of(), false, true, false));
        Map<String, ParameterKind> ccPrxParams = ordered("angle_t", ParameterKind.NUMBER, "phase_t", ParameterKind.NUMBER);
        ccPrxParams.put("feedback_qubit", ParameterKind.STRING);
        ccPrxParams.put("feedback_key", ParameterKind.STRING);
        register(ops, new NativeOperation("cc_prx", 1, OperationRole.CONDITIONAL_ROTATION,
                ccPrxParams, Map.of(), false, true, false));
        register(ops, new NativeOperation("reset", 0, OperationRole.RESET,
                Map.of(), Map.of(), true, true, false));
        register(ops, new NativeOperation("cz", 2, OperationRole.TWO_QUBIT_ENTANGLER,
                Map.of(), Map.of(), true, false, false));
        register(ops, new NativeOperation("move", 2, OperationRole.MOVE,
                Map.of(), Map.of(), false, false, false));
        OPERATIONS = Collections.unmodifiableMap(ops);
    }

    private SupportedOperations() {
    }

    public static Optional<NativeOperation> find(String name) {
        return Optional.ofNullable(OPERATIONS.get(name));
    }

    /**
     * Names of all operations with the given role.
     */
    public static Set<String> namesWithRole(OperationRole role) {
        return OPERATIONS.values().stream()
                .filter(op -> op.role() == role)
                .map(NativeOperation::name)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static boolean hasRole(String name, OperationRole role) {
        NativeOperation op = OPERATIONS.get(name);
        return op != null && op.role() == role;
    }

    private static void register(Map<String, NativeOperation> ops, NativeOperation op) {
        ops.put(op.name(), op);
    }

    private static Map<String, ParameterKind> ordered(String k1, ParameterKind v1, String k2, ParameterKind v2) {
        Map<String, ParameterKind> map = new LinkedHashMap<>();
        map.put(k1, v1);
        map.put(k2, v2);
        return map;
    }
}
