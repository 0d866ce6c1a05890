package io.redfishcatalog.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An {@code edmx:Reference} declaration: the namespaces a document imports from another file.
 *
 * @param uri      the {@code Uri} attribute as written
 * @param includes the {@code edmx:Include} children
 */
public record SchemaReference(String uri, List<Include> includes) {

    /** One included namespace, optionally under an alias. */
    public record Include(String namespace, String alias) {

        public Include {
            Objects.requireNonNull(namespace, "namespace must not be null");
        }
    }

    public SchemaReference {
        Objects.requireNonNull(uri, "uri must not be null");
        includes = List.copyOf(includes);
    }

    /** Last path segment of the URI, e.g. {@code Resource_v1.xml}. */
    public String fileName() {
        String path = uri;
        int hash = path.indexOf('#');
        if (hash >= 0) {
            path = path.substring(0, hash);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /** True if this reference includes any namespace with the given base name, or that alias. */
    public boolean covers(String baseNameOrAlias) {
        for (Include include : includes) {
            if (baseNameOrAlias.equals(include.alias())
                    || NamespaceName.parse(include.namespace()).baseName().equals(baseNameOrAlias)) {
                return true;
            }
        }
        return false;
    }
}
