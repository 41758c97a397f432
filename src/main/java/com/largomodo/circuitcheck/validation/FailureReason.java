package com.largomodo.circuitcheck.validation;

/**
 * Reason code of a circuit validation failure. Callers match on this, not on message text.
 */
public enum FailureReason {
    UNKNOWN_OPERATION("unknown-operation"),
    UNSUPPORTED_OPERATION("unsupported-operation"),
    UNSUPPORTED_IMPLEMENTATION("unsupported-implementation"),
    LOCUS_NOT_ALLOWED("locus-not-allowed"),
    INVALID_ARITY("invalid-arity"),
    DUPLICATE_LOCUS_COMPONENT("duplicate-locus-component"),
    MISSING_ARGUMENT("missing-argument"),
    UNEXPECTED_ARGUMENT("unexpected-argument"),
    INVALID_ARGUMENT("invalid-argument"),
    NON_INJECTIVE_MAPPING("non-injective-mapping"),
    UNMAPPED_QUBITS("unmapped-qubits"),
    UNMAPPED_TARGET_MISSING("unmapped-target-missing"),
    DUPLICATE_MEASUREMENT_KEY("duplicate-measurement-key"),
    MOVE_INVALID_LOCUS("move-invalid-locus"),
    MOVE_SPLIT_STATE("move-split-state"),
    MOVE_MISMATCHED_CLOSE("move-mismatched-close"),
    MOVE_QUBIT_IN_USE("move-qubit-in-use"),
    MOVE_UNSUPPORTED("move-unsupported"),
    MOVE_UNCLOSED_SANDWICH("move-unclosed-sandwich");

    private final String code;

    FailureReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
