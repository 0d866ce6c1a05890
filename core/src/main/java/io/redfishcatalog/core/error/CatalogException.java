package io.redfishcatalog.core.error;

/**
 * Abstract base for all catalog exceptions. Never thrown directly; use the concrete subclasses
 * grouped by {@link Phase}.
 */
public abstract class CatalogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        RESOLUTION,
        VALIDATION
    }

    private final String name;
    private final Phase phase;

    protected CatalogException(String message, String name, Phase phase) {
        super(message);
        this.name = name;
        this.phase = phase;
    }

    protected CatalogException(String message, Throwable cause, String name, Phase phase) {
        super(message, cause);
        this.name = name;
        this.phase = phase;
    }

    /**
     * The qualified type, namespace or property name the error is about, or {@code null} when the
     * error is not tied to a single name (e.g. an unreadable directory).
     */
    public String name() {
        return name;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
