package io.redfishcatalog.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One parsed schema file. Immutable once built by the document parser and owned by the document
 * catalog.
 *
 * @param fileName    file name within the schema directory
 * @param namespaces  namespaces in document order
 * @param references  {@code edmx:Reference} declarations in document order
 * @param diagnostics non-fatal remarks collected while parsing (unknown elements and the like)
 */
public record SchemaDocument(
        String fileName, List<NamespaceDefinition> namespaces, List<SchemaReference> references, List<String> diagnostics) {

    public SchemaDocument {
        Objects.requireNonNull(fileName, "fileName must not be null");
        namespaces = List.copyOf(namespaces);
        references = List.copyOf(references);
        diagnostics = List.copyOf(diagnostics);
    }

    /** Namespaces of the given base name declared here, highest version first, unversioned last. */
    public List<NamespaceDefinition> namespacesOf(String baseName) {
        List<NamespaceDefinition> result = new ArrayList<>();
        for (NamespaceDefinition ns : namespaces) {
            if (ns.name().baseName().equals(baseName)) {
                result.add(ns);
            }
        }
        result.sort(NEWEST_FIRST);
        return result;
    }

    /** Exact lookup of a declared namespace. */
    public Optional<NamespaceDefinition> namespace(NamespaceName name) {
        return namespaces.stream().filter(ns -> ns.name().equals(name)).findFirst();
    }

    public boolean declaresBase(String baseName) {
        return namespaces.stream().anyMatch(ns -> ns.name().baseName().equals(baseName));
    }

    /**
     * Alias to namespace map, from both {@code edmx:Include Alias} and {@code Schema Alias}
     * attributes.
     */
    public Map<String, String> aliases() {
        Map<String, String> aliases = new HashMap<>();
        for (SchemaReference reference : references) {
            for (SchemaReference.Include include : reference.includes()) {
                if (include.alias() != null) {
                    aliases.put(include.alias(), include.namespace());
                }
            }
        }
        for (NamespaceDefinition ns : namespaces) {
            if (ns.alias() != null) {
                aliases.put(ns.alias(), ns.name().toString());
            }
        }
        return aliases;
    }

    /** The first reference that includes the given base name or alias. */
    public Optional<SchemaReference> referenceFor(String baseNameOrAlias) {
        return references.stream().filter(r -> r.covers(baseNameOrAlias)).findFirst();
    }

    /** Orders versioned namespaces by descending version, with the unversioned namespace last. */
    public static final Comparator<NamespaceDefinition> NEWEST_FIRST = (a, b) -> {
        SchemaVersion va = a.name().version();
        SchemaVersion vb = b.name().version();
        if (va == null && vb == null) {
            return 0;
        }
        if (va == null) {
            return 1;
        }
        if (vb == null) {
            return -1;
        }
        return vb.compareTo(va);
    };
}
