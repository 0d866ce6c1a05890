package io.redfishcatalog.core.error;

/**
 * Thrown when a single schema document is not well-formed XML or lacks a required attribute.
 * Collected per document by {@code DocumentCatalog.load()}, so one bad file never hides the rest.
 */
public final class SchemaParseException extends CatalogException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaParseException(String message, String source) {
        super(message, null, Phase.LOAD);
        this.source = source;
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.LOAD);
        this.source = source;
    }

    /** The schema file name that failed to parse. */
    public String source() {
        return source;
    }
}
