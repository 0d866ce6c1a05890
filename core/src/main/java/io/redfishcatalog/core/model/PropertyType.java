package io.redfishcatalog.core.model;

import java.util.List;
import java.util.Objects;

/**
 * What a declared property type resolves to, as needed to check a value against it.
 *
 * @param kind      how values are checked
 * @param typeName  the declared type name, e.g. {@code Edm.Int64} or {@code Resource.Health}
 * @param primitive the primitive rule for {@link Kind#PRIMITIVE}, otherwise {@code null}
 * @param members   allowed members for {@link Kind#ENUM}, otherwise empty
 * @param structure the merged type for {@link Kind#STRUCTURED} and {@link Kind#REFERENCE}
 */
public record PropertyType(
        Kind kind, String typeName, EdmPrimitive primitive, List<String> members, ResolvedType structure) {

    /** Value-checking categories. */
    public enum Kind {
        /** Leaf value coerced by an {@link EdmPrimitive} rule. */
        PRIMITIVE,
        /** String that must be one of the enum's members. */
        ENUM,
        /** Nested entity or complex object populated recursively. */
        STRUCTURED,
        /** Navigation link object carrying {@code @odata.id}. */
        REFERENCE
    }

    public PropertyType {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
        members = List.copyOf(members);
    }

    public static PropertyType primitive(String typeName, EdmPrimitive primitive) {
        return new PropertyType(Kind.PRIMITIVE, typeName, Objects.requireNonNull(primitive), List.of(), null);
    }

    public static PropertyType enumeration(TypeDefinition enumType) {
        return new PropertyType(Kind.ENUM, enumType.name().toString(), null, enumType.members(), null);
    }

    public static PropertyType structured(ResolvedType type) {
        return new PropertyType(Kind.STRUCTURED, type.name().toString(), null, List.of(), type);
    }

    public static PropertyType reference(ResolvedType type) {
        return new PropertyType(Kind.REFERENCE, type.name().toString(), null, List.of(), type);
    }

    /** Short description of the expected value, used in coercion diagnostics. */
    public String expectedKind() {
        return switch (kind) {
            case PRIMITIVE -> primitive.canonicalName();
            case ENUM -> "enum " + typeName;
            case STRUCTURED -> "object " + typeName;
            case REFERENCE -> "link to " + typeName;
        };
    }
}
