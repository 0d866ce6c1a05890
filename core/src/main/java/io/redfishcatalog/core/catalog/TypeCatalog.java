package io.redfishcatalog.core.catalog;

import io.redfishcatalog.core.error.CircularReferenceException;
import io.redfishcatalog.core.error.MissingSchemaException;
import io.redfishcatalog.core.model.ActionDefinition;
import io.redfishcatalog.core.model.EdmPrimitive;
import io.redfishcatalog.core.model.NamespaceDefinition;
import io.redfishcatalog.core.model.NamespaceName;
import io.redfishcatalog.core.model.PropertyDefinition;
import io.redfishcatalog.core.model.PropertyType;
import io.redfishcatalog.core.model.QualifiedName;
import io.redfishcatalog.core.model.ResolvedType;
import io.redfishcatalog.core.model.SchemaDocument;
import io.redfishcatalog.core.model.SchemaVersion;
import io.redfishcatalog.core.model.TypeDefinition;
import io.redfishcatalog.core.spi.CatalogListener;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves qualified, versioned type names to merged {@link ResolvedType}s on top of a
 * {@link DocumentCatalog}.
 *
 * <p>
 * Resolution locates the owning document, finds the type in it (following the document's
 * references when the namespace lives elsewhere), then merges the base-type chain, which may cross
 * documents and drop from versioned to unversioned namespaces. A base chain that loops raises
 * {@link CircularReferenceException}.
 *
 * <p>
 * Resolved types are cached under both the requested and the canonical name. Thread-safe: the
 * catalog is immutable and a race on a first resolution only repeats identical work.
 */
public final class TypeCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(TypeCatalog.class);

    private final DocumentCatalog documents;
    private final ReferenceResolver resolver;
    private final CatalogListener listener;
    private final Map<String, ResolvedType> cache = new ConcurrentHashMap<>();

    public TypeCatalog(DocumentCatalog documents) {
        this(documents, new ReferenceResolver(documents), CatalogListener.NONE);
    }

    public TypeCatalog(DocumentCatalog documents, ReferenceResolver resolver, CatalogListener listener) {
        this.documents = Objects.requireNonNull(documents, "documents must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    public DocumentCatalog documents() {
        return documents;
    }

    public ReferenceResolver resolver() {
        return resolver;
    }

    // --- Catalog-wide resolution ---

    /**
     * Resolves a qualified type name, e.g. {@code Example.v1_7_0.Example}, to its merged form.
     *
     * @throws MissingSchemaException      if the namespace or type is not in the catalog
     * @throws CircularReferenceException if the base-type chain loops
     */
    public ResolvedType getTypeInCatalog(String qualifiedTypeName) {
        Objects.requireNonNull(qualifiedTypeName, "qualifiedTypeName must not be null");
        ResolvedType cached = cache.get(qualifiedTypeName);
        if (cached != null) {
            return cached;
        }
        SchemaDocument owner = documents.getSchemaDocByClass(qualifiedTypeName);
        TypeDefinition definition = getTypeInSchemaDoc(owner, qualifiedTypeName);
        ResolvedType resolved = resolve(definition, new LinkedHashSet<>());
        ResolvedType previous = cache.putIfAbsent(qualifiedTypeName, resolved);
        if (previous == null && !qualifiedTypeName.equals(resolved.name().toString())) {
            LOG.debug("Type resolved by fallback: requested={}, resolved={}", qualifiedTypeName, resolved.name());
        }
        return previous != null ? previous : resolved;
    }

    /** Pass-through for an already resolved type. */
    public ResolvedType getTypeInCatalog(ResolvedType type) {
        return Objects.requireNonNull(type, "type must not be null");
    }

    /** Merges the base chain of a type definition obtained from a document. */
    public ResolvedType getTypeInCatalog(TypeDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        return resolve(definition, new LinkedHashSet<>());
    }

    /** Number of distinct names currently cached. */
    public int cacheSize() {
        return cache.size();
    }

    // --- Document-local resolution ---

    /**
     * Finds a type as seen from one document: in the document's own namespaces (highest version
     * not above the request that declares the type), else through the document's declared
     * references, recursively.
     *
     * @throws MissingSchemaException if no document reachable from {@code document} defines it
     */
    public TypeDefinition getTypeInSchemaDoc(SchemaDocument document, String name) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(name, "name must not be null");
        QualifiedName requested;
        try {
            requested = QualifiedName.parse(name);
        } catch (IllegalArgumentException e) {
            throw new MissingSchemaException(name, document.fileName());
        }
        return findType(document, name, requested, new HashSet<>());
    }

    /** Pass-through for an already resolved definition; no lookup takes place. */
    public TypeDefinition getTypeInSchemaDoc(SchemaDocument document, TypeDefinition type) {
        return Objects.requireNonNull(type, "type must not be null");
    }

    private TypeDefinition findType(SchemaDocument document, String name, QualifiedName requested, Set<String> visited) {
        if (!visited.add(document.fileName())) {
            throw new MissingSchemaException(name, document.fileName());
        }
        QualifiedName qualified = dealias(document, requested);
        String base = qualified.namespace().baseName();

        if (document.declaresBase(base)) {
            TypeDefinition local = selectDeclaring(
                    document.namespacesOf(base), qualified.namespace().version(), qualified.typeName());
            if (local != null) {
                return local;
            }
            throw new MissingSchemaException(name, document.fileName());
        }

        NamespaceDefinition namespace = resolver.resolve(document, qualified.namespace().toString());
        if (namespace.builtin()) {
            throw new MissingSchemaException(name, document.fileName());
        }
        SchemaDocument target = documents.documentOf(namespace.name())
                .orElseThrow(() -> new MissingSchemaException(name, document.fileName()));
        return findType(target, name, qualified, visited);
    }

    /**
     * First namespace, newest first and not above {@code requested}, that declares the type. An
     * unversioned request prefers the unversioned namespace, then the newest version.
     */
    private static TypeDefinition selectDeclaring(
            List<NamespaceDefinition> newestFirst, SchemaVersion requested, String typeName) {
        if (requested == null) {
            for (NamespaceDefinition ns : newestFirst) {
                if (!ns.name().isVersioned() && ns.declares(typeName)) {
                    return ns.type(typeName);
                }
            }
        }
        for (NamespaceDefinition ns : newestFirst) {
            SchemaVersion version = ns.name().version();
            boolean eligible = version == null || requested == null || version.isAtMost(requested);
            if (eligible && ns.declares(typeName)) {
                return ns.type(typeName);
            }
        }
        return null;
    }

    private static QualifiedName dealias(SchemaDocument document, QualifiedName name) {
        String target = document.aliases().get(name.namespace().baseName());
        if (target == null) {
            return name;
        }
        NamespaceName aliased = NamespaceName.parse(target);
        if (name.namespace().isVersioned()) {
            aliased = aliased.withVersion(name.namespace().version());
        }
        return name.withNamespace(aliased);
    }

    // --- Inheritance merge ---

    private ResolvedType resolve(TypeDefinition definition, LinkedHashSet<String> chain) {
        String canonical = definition.name().toString();
        ResolvedType cached = cache.get(canonical);
        if (cached != null) {
            return cached;
        }
        if (!chain.add(canonical)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String link : chain) {
                inCycle = inCycle || link.equals(canonical);
                if (inCycle) {
                    cycle.add(link);
                }
            }
            cycle.add(canonical);
            throw new CircularReferenceException(cycle);
        }

        ResolvedType resolved;
        if (definition.baseType() == null || !definition.isStructured()) {
            resolved = new ResolvedType(
                    definition, List.of(definition.name()), definition.properties(), definition.actions());
        } else {
            SchemaDocument owner = documents.document(definition.sourceFile())
                    .orElseThrow(() -> new MissingSchemaException(canonical));
            TypeDefinition baseDefinition = getTypeInSchemaDoc(owner, definition.baseType());
            ResolvedType base = resolve(baseDefinition, chain);

            List<QualifiedName> inheritance = new ArrayList<>();
            inheritance.add(definition.name());
            inheritance.addAll(base.inheritanceChain());

            Map<String, PropertyDefinition> properties = new LinkedHashMap<>(base.properties());
            properties.putAll(definition.properties());

            List<ActionDefinition> actions = new ArrayList<>(base.actions());
            actions.addAll(definition.actions());

            resolved = new ResolvedType(definition, inheritance, properties, actions);
        }
        chain.remove(canonical);

        ResolvedType previous = cache.putIfAbsent(canonical, resolved);
        if (previous != null) {
            return previous;
        }
        LOG.debug(
                "Type resolved: type={}, chain={}, properties={}",
                canonical,
                resolved.inheritanceChain().size(),
                resolved.properties().size());
        notifyResolved(canonical, resolved);
        return resolved;
    }

    // --- Property types ---

    /**
     * Resolves a property's declared type, looked up from the document that declares the property.
     *
     * @throws MissingSchemaException if the property's type cannot be found
     */
    public PropertyType resolvePropertyType(PropertyDefinition property) {
        Objects.requireNonNull(property, "property must not be null");
        String typeName = property.typeName();
        Optional<EdmPrimitive> primitive = EdmPrimitive.fromTypeName(typeName);
        if (primitive.isPresent()) {
            return PropertyType.primitive(typeName, primitive.get());
        }

        SchemaDocument from = property.declaringType() != null
                ? documents.documentOf(QualifiedName.parse(property.declaringType()).namespace())
                        .orElseGet(() -> documents.getSchemaDocByClass(typeName))
                : documents.getSchemaDocByClass(typeName);
        TypeDefinition definition = getTypeInSchemaDoc(from, typeName);

        return switch (definition.kind()) {
            case ENUM -> PropertyType.enumeration(definition);
            case TYPE_DEFINITION -> PropertyType.primitive(
                    typeName,
                    EdmPrimitive.fromTypeName(definition.underlyingType()).orElse(EdmPrimitive.ANY));
            case ENTITY, COMPLEX -> {
                ResolvedType resolved = getTypeInCatalog(definition);
                yield property.navigation() && !property.autoExpand()
                        ? PropertyType.reference(resolved)
                        : PropertyType.structured(resolved);
            }
        };
    }

    /**
     * For an abstract type in an unversioned namespace, returns the newest concrete versioned
     * definition of the same name; any other type is returned unchanged.
     */
    public ResolvedType concreteVersionOf(ResolvedType type) {
        TypeDefinition definition = type.definition();
        if (!definition.isAbstract() || definition.name().namespace().isVersioned()) {
            return type;
        }
        String typeName = definition.name().typeName();
        for (NamespaceDefinition ns : documents.namespacesOf(definition.name().namespace().baseName())) {
            TypeDefinition candidate = ns.type(typeName);
            if (ns.name().isVersioned() && candidate != null && !candidate.isAbstract()) {
                return getTypeInCatalog(candidate);
            }
        }
        return type;
    }

    private void notifyResolved(String requested, ResolvedType resolved) {
        try {
            listener.onTypeResolved(new CatalogListener.TypeResolvedEvent(
                    requested, resolved.name().toString(), resolved.properties().size()));
        } catch (Exception e) {
            LOG.warn("CatalogListener.onTypeResolved failed", e);
        }
    }
}
