package io.redfishcatalog.core.catalog;

import io.redfishcatalog.core.model.NamespaceDefinition;
import io.redfishcatalog.core.model.SchemaVersion;
import java.util.List;
import java.util.Optional;

/**
 * Version selection over one namespace's version chain.
 *
 * <p>
 * For a versioned request: the exact version, else the highest declared version not exceeding it,
 * else the unversioned namespace. For an unversioned request: the unversioned namespace, else the
 * highest declared version.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
final class VersionFallback {

    private VersionFallback() {}

    /**
     * Picks from {@code candidates}, which must be ordered newest first with the unversioned
     * namespace last (see {@link io.redfishcatalog.core.model.SchemaDocument#NEWEST_FIRST}).
     */
    static Optional<NamespaceDefinition> select(List<NamespaceDefinition> candidates, SchemaVersion requested) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        NamespaceDefinition unversioned = null;
        for (NamespaceDefinition candidate : candidates) {
            if (!candidate.name().isVersioned()) {
                unversioned = candidate;
            }
        }
        if (requested == null) {
            return Optional.of(unversioned != null ? unversioned : candidates.get(0));
        }
        for (NamespaceDefinition candidate : candidates) {
            SchemaVersion version = candidate.name().version();
            if (version != null && version.isAtMost(requested)) {
                return Optional.of(candidate);
            }
        }
        return Optional.ofNullable(unversioned);
    }
}
