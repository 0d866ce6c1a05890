package io.redfishcatalog.core.error;

/** Thrown when no document in the catalog declares the requested namespace or type. */
public final class MissingSchemaException extends SchemaResolveException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public MissingSchemaException(String name) {
        this(name, null);
    }

    public MissingSchemaException(String name, String source) {
        super(source == null
                ? "Schema not found in catalog: " + name
                : "Schema not found in catalog: " + name + " (referenced from " + source + ")",
                name);
        this.source = source;
    }

    /** The document the lookup started from, or {@code null} for catalog-wide lookups. */
    public String source() {
        return source;
    }
}
