package io.redfishcatalog.core.catalog;

import io.redfishcatalog.core.error.MissingSchemaException;
import io.redfishcatalog.core.model.NamespaceDefinition;
import io.redfishcatalog.core.model.NamespaceName;
import io.redfishcatalog.core.model.SchemaDocument;
import io.redfishcatalog.core.model.SchemaReference;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a symbolic namespace reference, as written inside one document, to the namespace that
 * defines it.
 *
 * <p>
 * A reference may be bare ({@code ExampleResource}), versioned ({@code ExampleResource.v1_0_1})
 * or an alias declared by the document. Candidates are the document's own namespaces when it
 * declares the base name, otherwise the namespaces of the document named by the covering
 * {@code edmx:Reference}. Among them {@link VersionFallback} picks the exact version, else the
 * highest version not above the request, else the unversioned namespace. Well-known namespaces
 * ({@link WellKnownNamespaces}) always resolve, with or without a declaration.
 *
 * <p>
 * Results are cached per (document, reference name). Thread-safe: a race on a first resolution
 * computes the same answer twice and keeps the first.
 */
public final class ReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    private record CacheKey(String fileName, String referenceName) {}

    private final DocumentCatalog catalog;
    private final Map<CacheKey, NamespaceDefinition> cache = new ConcurrentHashMap<>();

    public ReferenceResolver(DocumentCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * Resolves {@code referenceName} as seen from {@code fromDocument}.
     *
     * @throws MissingSchemaException if the name is neither local, nor covered by a declared
     *                                reference that leads to a matching namespace, nor well-known
     */
    public NamespaceDefinition resolve(SchemaDocument fromDocument, String referenceName) {
        Objects.requireNonNull(fromDocument, "fromDocument must not be null");
        Objects.requireNonNull(referenceName, "referenceName must not be null");

        CacheKey key = new CacheKey(fromDocument.fileName(), referenceName);
        NamespaceDefinition cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        NamespaceDefinition resolved = doResolve(fromDocument, referenceName);
        NamespaceDefinition previous = cache.putIfAbsent(key, resolved);
        return previous != null ? previous : resolved;
    }

    /** Number of cached (document, reference) resolutions. */
    public int cacheSize() {
        return cache.size();
    }

    private NamespaceDefinition doResolve(SchemaDocument from, String referenceName) {
        NamespaceName requested = dealias(from, NamespaceName.parse(referenceName.strip()));
        String base = requested.baseName();

        if (from.declaresBase(base)) {
            Optional<NamespaceDefinition> local = VersionFallback.select(from.namespacesOf(base), requested.version());
            if (local.isPresent()) {
                log(from, referenceName, local.get());
                return local.get();
            }
        }

        Optional<SchemaReference> reference = from.referenceFor(base);
        if (reference.isPresent()) {
            Optional<NamespaceDefinition> external = catalog.documentFor(reference.get(), base)
                    .flatMap(target -> VersionFallback.select(target.namespacesOf(base), requested.version()));
            if (external.isPresent()) {
                log(from, referenceName, external.get());
                return external.get();
            }
        }

        if (WellKnownNamespaces.isWellKnown(base)) {
            List<NamespaceDefinition> declared = catalog.namespacesOf(base);
            NamespaceDefinition wellKnown = VersionFallback.select(declared, requested.version())
                    .orElseGet(() -> NamespaceDefinition.builtin(requested));
            log(from, referenceName, wellKnown);
            return wellKnown;
        }

        throw new MissingSchemaException(referenceName, from.fileName());
    }

    /** Replaces an alias base name by the namespace it stands for, keeping an explicit version. */
    private static NamespaceName dealias(SchemaDocument from, NamespaceName requested) {
        String target = from.aliases().get(requested.baseName());
        if (target == null) {
            return requested;
        }
        NamespaceName aliased = NamespaceName.parse(target);
        return requested.isVersioned() ? aliased.withVersion(requested.version()) : aliased;
    }

    private static void log(SchemaDocument from, String referenceName, NamespaceDefinition resolved) {
        LOG.debug(
                "Reference resolved: file={}, reference={}, namespace={}, builtin={}",
                from.fileName(),
                referenceName,
                resolved.name(),
                resolved.builtin());
    }
}
