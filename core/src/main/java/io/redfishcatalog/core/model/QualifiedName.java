package io.redfishcatalog.core.model;

import java.util.Objects;

/**
 * Fully qualified type name {@code Namespace[.Version].TypeName}.
 *
 * <p>
 * A bare name without any dot, e.g. {@code Example}, is read as the unversioned alias
 * {@code Example.Example}, the usual home of a resource's abstract definition.
 */
public record QualifiedName(NamespaceName namespace, String typeName) {

    public QualifiedName {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
    }

    public static QualifiedName parse(String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        String name = qualifiedName.strip();
        if (name.startsWith("#")) {
            name = name.substring(1);
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return new QualifiedName(NamespaceName.unversioned(name), name);
        }
        if (dot == 0 || dot == name.length() - 1) {
            throw new IllegalArgumentException("Malformed qualified name: " + qualifiedName);
        }
        return new QualifiedName(NamespaceName.parse(name.substring(0, dot)), name.substring(dot + 1));
    }

    public QualifiedName withNamespace(NamespaceName newNamespace) {
        return new QualifiedName(newNamespace, typeName);
    }

    @Override
    public String toString() {
        return namespace + "." + typeName;
    }
}
