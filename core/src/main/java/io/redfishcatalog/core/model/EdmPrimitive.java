package io.redfishcatalog.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Primitive value kinds of the {@code Edm} namespace, grouped by the coercion rule that applies to
 * them.
 */
public enum EdmPrimitive {
    INT("Edm.Int"),
    DECIMAL("Edm.Decimal"),
    STRING("Edm.String"),
    GUID("Edm.Guid"),
    BOOLEAN("Edm.Boolean"),
    DATE_TIME_OFFSET("Edm.DateTimeOffset"),
    DATE("Edm.Date"),
    TIME_OF_DAY("Edm.TimeOfDay"),
    DURATION("Edm.Duration"),
    /** {@code Edm.PrimitiveType} and primitive names without a dedicated rule: any value. */
    ANY("Edm.PrimitiveType");

    private static final Map<String, EdmPrimitive> BY_NAME = Map.ofEntries(
            Map.entry("edm.int", INT),
            Map.entry("edm.int16", INT),
            Map.entry("edm.int32", INT),
            Map.entry("edm.int64", INT),
            Map.entry("edm.byte", INT),
            Map.entry("edm.sbyte", INT),
            Map.entry("edm.decimal", DECIMAL),
            Map.entry("edm.double", DECIMAL),
            Map.entry("edm.single", DECIMAL),
            Map.entry("edm.string", STRING),
            Map.entry("edm.guid", GUID),
            Map.entry("edm.boolean", BOOLEAN),
            Map.entry("edm.datetimeoffset", DATE_TIME_OFFSET),
            Map.entry("edm.date", DATE),
            Map.entry("edm.timeofday", TIME_OF_DAY),
            Map.entry("edm.duration", DURATION),
            Map.entry("edm.primitivetype", ANY));

    private final String canonicalName;

    EdmPrimitive(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public String canonicalName() {
        return canonicalName;
    }

    /** True for any name in the {@code Edm} namespace. */
    public static boolean isEdm(String typeName) {
        return typeName != null && typeName.startsWith("Edm.");
    }

    /**
     * Maps an {@code Edm.*} type name to its kind. Unrecognised {@code Edm} names such as
     * {@code Edm.Binary} map to {@link #ANY}; non-Edm names yield empty.
     */
    public static Optional<EdmPrimitive> fromTypeName(String typeName) {
        if (!isEdm(typeName)) {
            return Optional.empty();
        }
        return Optional.of(BY_NAME.getOrDefault(typeName.toLowerCase(Locale.ROOT), ANY));
    }
}
