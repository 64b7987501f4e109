package io.quyaml.core.error;

/** Thrown when the guardrail scanner rejects an oversized, over-nested or unsafe document. */
public final class GuardrailViolationException extends QuyamlException {

    private static final long serialVersionUID = 1L;

    public GuardrailViolationException(String message, String location) {
        super(message, Category.SECURITY, location);
    }

    public GuardrailViolationException(String message, Throwable cause, String location) {
        super(message, cause, Category.SECURITY, location);
    }
}
