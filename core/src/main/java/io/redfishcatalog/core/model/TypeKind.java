package io.redfishcatalog.core.model;

/** Kinds of named type a schema namespace can declare. */
public enum TypeKind {
    ENTITY,
    COMPLEX,
    ENUM,
    /** A named alias of a primitive, e.g. {@code Resource.UUID} over {@code Edm.Guid}. */
    TYPE_DEFINITION
}
