package io.redfishcatalog.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.redfishcatalog.core.catalog.DocumentCatalog;
import io.redfishcatalog.core.catalog.ReferenceResolver;
import io.redfishcatalog.core.catalog.TypeCatalog;
import io.redfishcatalog.core.config.CatalogConfig;
import io.redfishcatalog.core.engine.ObjectEngine;
import io.redfishcatalog.core.engine.RedfishObject;
import io.redfishcatalog.core.engine.ValidationMode;
import io.redfishcatalog.core.model.NamespaceDefinition;
import io.redfishcatalog.core.model.ResolvedType;
import io.redfishcatalog.core.model.SchemaDocument;
import io.redfishcatalog.core.model.TypeDefinition;
import io.redfishcatalog.core.spi.CatalogListener;
import java.util.Objects;

/**
 * Entry point for drivers: one loaded schema directory with its resolver, type catalog and object
 * engine wired together.
 *
 * <p>
 * Immutable after construction and safe to share between threads.
 *
 * <pre>{@code
 * SchemaCatalog catalog = SchemaCatalog.load(CatalogConfigLoader.load(configFile));
 * RedfishObject system = catalog.populate("ComputerSystem.v1_5_0.ComputerSystem", payload);
 * Set<URI> next = system.getLinks();
 * }</pre>
 */
public final class SchemaCatalog {

    private final CatalogConfig config;
    private final DocumentCatalog documents;
    private final ReferenceResolver resolver;
    private final TypeCatalog types;
    private final ObjectEngine objects;

    private SchemaCatalog(DocumentCatalog documents, CatalogConfig config, CatalogListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.documents = Objects.requireNonNull(documents, "documents must not be null");
        this.resolver = new ReferenceResolver(documents);
        this.types = new TypeCatalog(documents, resolver, Objects.requireNonNull(listener, "listener must not be null"));
        this.objects = new ObjectEngine(types, config);
    }

    /**
     * Loads {@link CatalogConfig#schemaDirectory()}.
     *
     * @throws io.redfishcatalog.core.error.CatalogLoadException if the directory is unreadable or
     *         a document is malformed; the exception carries the partially loaded catalog, which
     *         {@link #of} can wrap
     */
    public static SchemaCatalog load(CatalogConfig config) {
        return load(config, CatalogListener.NONE);
    }

    public static SchemaCatalog load(CatalogConfig config, CatalogListener listener) {
        Objects.requireNonNull(config, "config must not be null");
        if (config.schemaDirectory() == null) {
            throw new IllegalArgumentException("CatalogConfig has no schema directory");
        }
        return new SchemaCatalog(DocumentCatalog.load(config.schemaDirectory(), config, listener), config, listener);
    }

    /** Wraps an already built document catalog, e.g. a partial one recovered from a load failure. */
    public static SchemaCatalog of(DocumentCatalog documents, CatalogConfig config, CatalogListener listener) {
        return new SchemaCatalog(documents, config, listener);
    }

    public static SchemaCatalog of(DocumentCatalog documents) {
        return new SchemaCatalog(documents, CatalogConfig.defaults(), CatalogListener.NONE);
    }

    public CatalogConfig config() {
        return config;
    }

    public DocumentCatalog documents() {
        return documents;
    }

    public TypeCatalog types() {
        return types;
    }

    // --- Catalog queries ---

    public SchemaDocument getSchemaDocByClass(String qualifiedOrBareName) {
        return documents.getSchemaDocByClass(qualifiedOrBareName);
    }

    public NamespaceDefinition getSchemaInCatalog(String qualifiedNamespaceOrType) {
        return documents.getSchemaInCatalog(qualifiedNamespaceOrType);
    }

    public NamespaceDefinition resolveReference(SchemaDocument from, String referenceName) {
        return resolver.resolve(from, referenceName);
    }

    public ResolvedType getTypeInCatalog(String qualifiedTypeName) {
        return types.getTypeInCatalog(qualifiedTypeName);
    }

    public TypeDefinition getTypeInSchemaDoc(SchemaDocument document, String name) {
        return types.getTypeInSchemaDoc(document, name);
    }

    // --- Population ---

    /** Populates {@code typeName} from {@code payload} with the configured validation mode. */
    public RedfishObject populate(String typeName, JsonNode payload) {
        return objects.populate(types.getTypeInCatalog(typeName), payload);
    }

    public RedfishObject populate(String typeName, JsonNode payload, ValidationMode mode) {
        return objects.populate(types.getTypeInCatalog(typeName), payload, mode);
    }

    /** All-absent instance of {@code typeName}. */
    public RedfishObject skeleton(String typeName) {
        return objects.skeleton(types.getTypeInCatalog(typeName));
    }
}
