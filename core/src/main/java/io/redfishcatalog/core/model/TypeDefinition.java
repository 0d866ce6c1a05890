package io.redfishcatalog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A type as declared in one namespace, before inheritance is applied. See {@link ResolvedType}
 * for the merged form.
 *
 * @param name           qualified name, e.g. {@code Example.v1_0_0.Example}
 * @param kind           entity, complex, enum or type definition
 * @param baseType       {@code BaseType} reference as written, or {@code null}
 * @param isAbstract     {@code Abstract="true"}
 * @param properties     own properties keyed by name, in declaration order
 * @param members        enum member names (empty for other kinds)
 * @param underlyingType primitive behind a {@link TypeKind#TYPE_DEFINITION}, or {@code null}
 * @param actions        actions bound to this type
 * @param sourceFile     file name of the declaring document
 */
public record TypeDefinition(
        QualifiedName name,
        TypeKind kind,
        String baseType,
        boolean isAbstract,
        Map<String, PropertyDefinition> properties,
        List<String> members,
        String underlyingType,
        List<ActionDefinition> actions,
        String sourceFile) {

    public TypeDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        members = List.copyOf(members);
        actions = List.copyOf(actions);
    }

    public boolean isStructured() {
        return kind == TypeKind.ENTITY || kind == TypeKind.COMPLEX;
    }

    /** Copy with the given bound actions, used once the whole namespace has been read. */
    public TypeDefinition withActions(List<ActionDefinition> boundActions) {
        return new TypeDefinition(
                name, kind, baseType, isAbstract, properties, members, underlyingType, boundActions, sourceFile);
    }
}
