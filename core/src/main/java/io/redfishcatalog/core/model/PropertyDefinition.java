package io.redfishcatalog.core.model;

import java.util.Objects;

/**
 * One declared property of an entity or complex type.
 *
 * <p>
 * Immutable and thread-safe; created at parse time.
 *
 * @param name          property name as declared
 * @param typeName      element type reference ({@code Edm.String}, {@code Resource.Status}, ...),
 *                      with any {@code Collection(...)} wrapper removed
 * @param collection    whether the declared type was {@code Collection(...)}
 * @param nullable      {@code Nullable} facet; CSDL defaults it to true
 * @param navigation    declared as a {@code NavigationProperty}
 * @param autoExpand    navigation property annotated {@code OData.AutoExpand}
 * @param declaringType qualified name of the type that declares the property
 */
public record PropertyDefinition(
        String name,
        String typeName,
        boolean collection,
        boolean nullable,
        boolean navigation,
        boolean autoExpand,
        String declaringType) {

    private static final String COLLECTION_PREFIX = "Collection(";

    public PropertyDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
    }

    /**
     * Builds a definition from a raw CSDL {@code Type} attribute, unwrapping {@code Collection(...)}.
     */
    public static PropertyDefinition of(
            String name, String rawType, boolean nullable, boolean navigation, boolean autoExpand, String declaringType) {
        boolean collection = isCollection(rawType);
        return new PropertyDefinition(
                name, elementType(rawType), collection, nullable, navigation, autoExpand, declaringType);
    }

    /** Standalone scalar definition, named after its type. Used to populate loose values. */
    public static PropertyDefinition scalar(String rawType) {
        return of(rawType, rawType, true, false, false, null);
    }

    public static boolean isCollection(String rawType) {
        return rawType.startsWith(COLLECTION_PREFIX) && rawType.endsWith(")");
    }

    public static String elementType(String rawType) {
        return isCollection(rawType) ? rawType.substring(COLLECTION_PREFIX.length(), rawType.length() - 1) : rawType;
    }

    /** Definition of a single element of this collection property. */
    public PropertyDefinition element() {
        return new PropertyDefinition(name, typeName, false, nullable, navigation, autoExpand, declaringType);
    }

    /** Same definition under a dotted path name, used for nested diagnostics. */
    public PropertyDefinition withPath(String path) {
        return new PropertyDefinition(path, typeName, collection, nullable, navigation, autoExpand, declaringType);
    }
}
