package io.redfishcatalog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One {@code Schema} element of a document: a namespace and the types it declares.
 *
 * @param name       the namespace name
 * @param alias      the {@code Alias} attribute, or {@code null}
 * @param types      declared types keyed by simple name, in declaration order
 * @param actions    all actions declared in the namespace
 * @param sourceFile file name of the declaring document, {@code null} for built-in namespaces
 * @param builtin    true for the pseudo-namespaces that resolve without any document
 */
public record NamespaceDefinition(
        NamespaceName name,
        String alias,
        Map<String, TypeDefinition> types,
        List<ActionDefinition> actions,
        String sourceFile,
        boolean builtin) {

    public NamespaceDefinition {
        Objects.requireNonNull(name, "name must not be null");
        types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        actions = List.copyOf(actions);
    }

    /** A well-known namespace with no backing document and no types. */
    public static NamespaceDefinition builtin(NamespaceName name) {
        return new NamespaceDefinition(name, null, Map.of(), List.of(), null, true);
    }

    /** Returns the type with the given simple name, or {@code null}. */
    public TypeDefinition type(String simpleName) {
        return types.get(simpleName);
    }

    public boolean declares(String simpleName) {
        return types.containsKey(simpleName);
    }
}
