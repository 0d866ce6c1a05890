package io.redfishcatalog.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version triple of a versioned namespace. The lexical form used in namespace names is
 * {@code v<major>_<minor>_<errata>}, e.g. {@code v1_2_0}.
 *
 * <p>
 * Immutable; ordered by major, then minor, then errata.
 */
public record SchemaVersion(int major, int minor, int errata) implements Comparable<SchemaVersion> {

    private static final Pattern LEXICAL = Pattern.compile("v(\\d+)_(\\d+)_(\\d+)");

    public SchemaVersion {
        if (major < 0 || minor < 0 || errata < 0) {
            throw new IllegalArgumentException(
                    "Version components must not be negative: " + major + "." + minor + "." + errata);
        }
    }

    /** Returns {@code true} if the segment has the {@code vN_N_N} form. */
    public static boolean isVersionSegment(String segment) {
        return segment != null && LEXICAL.matcher(segment).matches();
    }

    /**
     * Parses a {@code vN_N_N} segment.
     *
     * @throws IllegalArgumentException if the segment is not a version
     */
    public static SchemaVersion parse(String segment) {
        Matcher m = segment == null ? null : LEXICAL.matcher(segment);
        if (m == null || !m.matches()) {
            throw new IllegalArgumentException("Not a schema version segment: " + segment);
        }
        return new SchemaVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    }

    /** Returns {@code true} when this version does not exceed {@code other}. */
    public boolean isAtMost(SchemaVersion other) {
        return compareTo(other) <= 0;
    }

    @Override
    public int compareTo(SchemaVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(errata, other.errata);
    }

    @Override
    public String toString() {
        return "v" + major + "_" + minor + "_" + errata;
    }
}
