package io.quyaml.core.error;

/** Thrown for an unsupported version, a missing or invalid field, or an unknown structured op. */
public final class SchemaViolationException extends QuyamlException {

    private static final long serialVersionUID = 1L;

    public SchemaViolationException(String message, String location) {
        super(message, Category.SCHEMA, location);
    }

    public SchemaViolationException(String message, Throwable cause, String location) {
        super(message, cause, Category.SCHEMA, location);
    }
}
