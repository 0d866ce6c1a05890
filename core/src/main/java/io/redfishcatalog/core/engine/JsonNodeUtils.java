package io.redfishcatalog.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * Shared payload value helpers for the property and object engines.
 *
 * <p>
 * Thread-safe; stateless utility class.
 */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /** Absent means "declared by the schema, missing from the payload". A Java null counts too. */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode();
    }

    /**
     * Short description of a payload value's kind for diagnostics.
     *
     * <ul>
     * <li>{@code MissingNode} → {@code absent}</li>
     * <li>integral numbers → {@code integer}, other numbers → {@code decimal}</li>
     * <li>otherwise the lower-case JSON type: {@code string}, {@code boolean}, {@code null},
     * {@code object}, {@code array}</li>
     * </ul>
     */
    public static String kindOf(JsonNode node) {
        if (isAbsent(node)) {
            return "absent";
        }
        if (node.isNumber()) {
            return node.isIntegralNumber() ? "integer" : "decimal";
        }
        return switch (node.getNodeType()) {
            case STRING -> "string";
            case BOOLEAN -> "boolean";
            case NULL -> "null";
            case OBJECT, POJO -> "object";
            case ARRAY -> "array";
            default -> node.getNodeType().name().toLowerCase(Locale.ROOT);
        };
    }

    /**
     * Parses a numeric string, tolerating surrounding whitespace. Returns {@code null} when the
     * text is not a number.
     */
    public static BigDecimal parseNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(text.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** True when the number has no fractional part, e.g. {@code 1}, {@code 1.0} or {@code 1e3}. */
    public static boolean isIntegral(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }
}
