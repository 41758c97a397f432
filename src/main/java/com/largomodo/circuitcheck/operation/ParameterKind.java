package com.largomodo.circuitcheck.operation;

/**
 * Value kind accepted for an operation argument.
 */
public enum ParameterKind {
    NUMBER,
    STRING;

    public boolean accepts(Object value) {
        return switch (this) {
            case NUMBER -> value instanceof Number;
            case STRING -> value instanceof String;
        };
    }
}
