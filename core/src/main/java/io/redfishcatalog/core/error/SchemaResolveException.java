package io.redfishcatalog.core.error;

/**
 * Abstract parent for resolution errors: a reference or type that cannot be located, or an
 * inheritance chain that loops. Fatal for the single resolution request that raised it.
 */
public abstract class SchemaResolveException extends CatalogException {

    private static final long serialVersionUID = 1L;

    protected SchemaResolveException(String message, String name) {
        super(message, name, Phase.RESOLUTION);
    }
}
