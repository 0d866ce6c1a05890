package io.redfishcatalog.core.engine;

import java.util.Locale;

/**
 * How payload values are checked against their declared kinds.
 *
 * <ul>
 * <li>{@link #STRICT}: a non-conforming value raises
 * {@link io.redfishcatalog.core.error.PropertyCoercionException}.</li>
 * <li>{@link #LENIENT}: values are coerced where possible and never fail; non-conforming values
 * are kept and flagged as invalid (default).</li>
 * </ul>
 */
public enum ValidationMode {
    /** Reject non-conforming values. */
    STRICT,

    /** Accept and flag non-conforming values (default). */
    LENIENT;

    /** Parses {@code strict} / {@code lenient}, case-insensitively. */
    public static ValidationMode fromString(String value) {
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "strict" -> STRICT;
            case "lenient" -> LENIENT;
            default -> throw new IllegalArgumentException(
                    "Invalid validation mode '" + value + "': must be 'strict' or 'lenient'");
        };
    }
}
