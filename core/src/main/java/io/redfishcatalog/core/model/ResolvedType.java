package io.redfishcatalog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A type with its base-type chain merged in. Produced and cached by the type catalog; two
 * resolutions of the same name yield equal instances.
 *
 * @param definition       the type's own declaration
 * @param inheritanceChain qualified names from this type up to the root base type
 * @param properties       own and inherited properties; a redeclared name keeps the most derived
 *                         definition, base properties come first
 * @param actions          own and inherited bound actions
 */
public record ResolvedType(
        TypeDefinition definition,
        List<QualifiedName> inheritanceChain,
        Map<String, PropertyDefinition> properties,
        List<ActionDefinition> actions) {

    public ResolvedType {
        Objects.requireNonNull(definition, "definition must not be null");
        inheritanceChain = List.copyOf(inheritanceChain);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        actions = List.copyOf(actions);
    }

    public QualifiedName name() {
        return definition.name();
    }

    public TypeKind kind() {
        return definition.kind();
    }

    public PropertyDefinition property(String propertyName) {
        return properties.get(propertyName);
    }

    /**
     * True if {@code other} is this type or one of its base types. Versions are ignored, so
     * {@code Example.v1_2_0.Example} is assignable to {@code Example.Example}.
     */
    public boolean isAssignableTo(QualifiedName other) {
        for (QualifiedName link : inheritanceChain) {
            if (link.typeName().equals(other.typeName())
                    && link.namespace().baseName().equals(other.namespace().baseName())) {
                return true;
            }
        }
        return false;
    }
}
