package io.quyaml.core.error;

/** Thrown when the document or an instruction string is malformed. */
public final class DocumentSyntaxException extends QuyamlException {

    private static final long serialVersionUID = 1L;

    public DocumentSyntaxException(String message, String location) {
        super(message, Category.SYNTAX, location);
    }

    public DocumentSyntaxException(String message, Throwable cause, String location) {
        super(message, cause, Category.SYNTAX, location);
    }
}
