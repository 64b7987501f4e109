package io.quyaml.core.error;

/** Thrown for an undefined parameter or an out-of-bounds qubit, clbit or register reference. */
public final class UnresolvedReferenceException extends QuyamlException {

    private static final long serialVersionUID = 1L;

    public UnresolvedReferenceException(String message, String location) {
        super(message, Category.REFERENCE, location);
    }

    public UnresolvedReferenceException(String message, Throwable cause, String location) {
        super(message, cause, Category.REFERENCE, location);
    }
}
