package io.redfishcatalog.core.catalog;

import java.util.Set;

/**
 * Pseudo-namespaces that every document may use without declaring a reference: the base protocol
 * namespace {@code Redfish} and its extension namespace {@code RedfishExtensions}. The singular
 * {@code RedfishExtension} spelling found in older documents is accepted as well.
 */
public final class WellKnownNamespaces {

    private static final Set<String> BASE_NAMES = Set.of("Redfish", "RedfishExtensions", "RedfishExtension");

    private WellKnownNamespaces() {}

    public static boolean isWellKnown(String baseName) {
        return BASE_NAMES.contains(baseName);
    }
}
