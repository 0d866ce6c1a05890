package io.redfishcatalog.core.engine;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a declared property name to the payload key that most plausibly carries it, tolerating
 * minor naming drift such as a different case or a one-letter typo.
 *
 * <p>
 * Priority order:
 * <ol>
 * <li>a verbatim key equal to the expected name;</li>
 * <li>a key equal to it ignoring case;</li>
 * <li>the key with the highest similarity at or above {@link #minSimilarity()}; ties keep the
 * first key in iteration order.</li>
 * </ol>
 * Keys in the exclude list are never chosen in steps 2 and 3. When nothing qualifies the expected
 * name is returned unchanged, and the caller then finds no value under it.
 *
 * <p>
 * Similarity is {@code 1 - levenshtein(a, b) / max(|a|, |b|)} on lower-cased keys. Pure and
 * thread-safe.
 */
public final class FuzzyKeyMatcher {

    /** Default minimum similarity for a partial match. */
    public static final double DEFAULT_MIN_SIMILARITY = 0.70;

    private final double minSimilarity;

    public FuzzyKeyMatcher() {
        this(DEFAULT_MIN_SIMILARITY);
    }

    public FuzzyKeyMatcher(double minSimilarity) {
        if (Double.isNaN(minSimilarity) || minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be within [0, 1], got " + minSimilarity);
        }
        this.minSimilarity = minSimilarity;
    }

    public double minSimilarity() {
        return minSimilarity;
    }

    public String matchKey(String expected, Collection<String> payloadKeys) {
        return matchKey(expected, payloadKeys, Set.of());
    }

    /**
     * @param expected    the declared property name
     * @param payloadKeys keys present in the payload object
     * @param exclude     keys that must not be chosen, typically the other declared property names
     * @return the chosen payload key, or {@code expected} when no key qualifies
     */
    public String matchKey(String expected, Collection<String> payloadKeys, Collection<String> exclude) {
        Objects.requireNonNull(expected, "expected must not be null");
        if (payloadKeys == null || payloadKeys.isEmpty()) {
            return expected;
        }
        if (payloadKeys.contains(expected)) {
            return expected;
        }
        Collection<String> excluded = exclude != null ? exclude : Set.of();

        String lowerExpected = expected.toLowerCase(Locale.ROOT);
        String best = null;
        double bestScore = -1.0;
        for (String key : payloadKeys) {
            if (key == null || excluded.contains(key)) {
                continue;
            }
            String lowerKey = key.toLowerCase(Locale.ROOT);
            if (lowerKey.equals(lowerExpected)) {
                return key;
            }
            double score = similarity(lowerExpected, lowerKey);
            if (score > bestScore) {
                bestScore = score;
                best = key;
            }
        }
        return best != null && bestScore >= minSimilarity ? best : expected;
    }

    /** Normalized Levenshtein similarity in [0, 1]; 1 means equal. Case-sensitive. */
    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / longest;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
