package io.quyaml.core.error;

/** Thrown when a parameter expression uses a disallowed construct or has no finite real value. */
public final class ExpressionEvalException extends QuyamlException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message, String location) {
        super(message, Category.EVALUATION, location);
    }

    public ExpressionEvalException(String message, Throwable cause, String location) {
        super(message, cause, Category.EVALUATION, location);
    }
}
