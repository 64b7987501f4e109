package io.quyaml.core.error;

/** Thrown when a classical condition is malformed or references values outside the register. */
public final class ConditionSemanticException extends QuyamlException {

    private static final long serialVersionUID = 1L;

    public ConditionSemanticException(String message, String location) {
        super(message, Category.SEMANTIC, location);
    }

    public ConditionSemanticException(String message, Throwable cause, String location) {
        super(message, cause, Category.SEMANTIC, location);
    }
}
