package io.quyaml.core.error;

/**
 * Abstract base for all QuYAML compilation errors. Never thrown directly; use one of the concrete
 * subclasses, one per {@link Category}.
 *
 * <p>Every compile attempt fails with at most one of these. No partial circuit or job is ever
 * returned alongside it.
 */
public abstract class QuyamlException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Error taxonomy shared by every pipeline stage. */
    public enum Category {
        SYNTAX,
        SCHEMA,
        REFERENCE,
        SECURITY,
        SEMANTIC,
        EVALUATION
    }

    private final Category category;
    private final String location;

    protected QuyamlException(String message, Category category, String location) {
        super(message);
        this.category = category;
        this.location = location;
    }

    protected QuyamlException(String message, Throwable cause, Category category, String location) {
        super(message, cause);
        this.category = category;
        this.location = location;
    }

    /** The error category. */
    public Category category() {
        return category;
    }

    /**
     * The offending field or instruction (e.g. {@code line 3}, {@code execution.shots}), or
     * {@code null} when the error concerns the document as a whole.
     */
    public String location() {
        return location;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
