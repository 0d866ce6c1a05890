package io.redfishcatalog.core.model;

import java.util.Objects;

/**
 * Namespace name split into its base name and optional version, e.g. {@code Example.v1_2_0} is
 * base {@code Example} at {@code v1_2_0}, while {@code Example} is the unversioned namespace.
 * Namespaces sharing a base name form a version chain.
 *
 * @param baseName the namespace without its version segment
 * @param version  the version, or {@code null} for the unversioned namespace
 */
public record NamespaceName(String baseName, SchemaVersion version) {

    public NamespaceName {
        Objects.requireNonNull(baseName, "baseName must not be null");
        if (baseName.isBlank()) {
            throw new IllegalArgumentException("baseName must not be blank");
        }
    }

    /** Parses a namespace name; a trailing {@code vN_N_N} segment becomes the version. */
    public static NamespaceName parse(String namespace) {
        Objects.requireNonNull(namespace, "namespace must not be null");
        int dot = namespace.lastIndexOf('.');
        if (dot > 0 && SchemaVersion.isVersionSegment(namespace.substring(dot + 1))) {
            return new NamespaceName(namespace.substring(0, dot), SchemaVersion.parse(namespace.substring(dot + 1)));
        }
        return new NamespaceName(namespace, null);
    }

    public static NamespaceName unversioned(String baseName) {
        return new NamespaceName(baseName, null);
    }

    public boolean isVersioned() {
        return version != null;
    }

    public NamespaceName withVersion(SchemaVersion newVersion) {
        return new NamespaceName(baseName, newVersion);
    }

    @Override
    public String toString() {
        return version == null ? baseName : baseName + "." + version;
    }
}
