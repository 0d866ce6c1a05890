package io.redfishcatalog.core.config;

import io.redfishcatalog.core.engine.ValidationMode;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for building a catalog and validating payloads against it.
 *
 * <p>
 * All fields have defaults except {@code schemaDirectory}. Use {@link #builder()} to construct
 * instances.
 *
 * @param schemaDirectory  directory holding the CSDL schema documents
 * @param schemaSuffix     file-name suffix used to find a namespace's document when no reference
 *                         names its file, e.g. {@code Resource} + {@code _v1.xml}
 * @param validationMode   strict or lenient value checking
 * @param oemCheck         validate {@code Oem} properties; when false they are carried through
 *                         as untyped values
 * @param fuzzyEnabled     look up payload keys with the fuzzy matcher when the exact key is absent
 * @param fuzzyMinSimilarity minimum similarity (0..1) a key must reach to be chosen by the matcher
 */
public record CatalogConfig(
        Path schemaDirectory,
        String schemaSuffix,
        ValidationMode validationMode,
        boolean oemCheck,
        boolean fuzzyEnabled,
        double fuzzyMinSimilarity) {

    public static final String DEFAULT_SCHEMA_SUFFIX = "_v1.xml";
    public static final double DEFAULT_FUZZY_MIN_SIMILARITY = 0.70;

    public CatalogConfig {
        Objects.requireNonNull(schemaSuffix, "schemaSuffix must not be null");
        Objects.requireNonNull(validationMode, "validationMode must not be null");
        if (fuzzyMinSimilarity < 0.0 || fuzzyMinSimilarity > 1.0) {
            throw new IllegalArgumentException("fuzzyMinSimilarity must be within [0, 1], got: " + fuzzyMinSimilarity);
        }
    }

    /** Defaults with no schema directory; enough for populating loose values. */
    public static CatalogConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CatalogConfig}. */
    public static final class Builder {
        private Path schemaDirectory;
        private String schemaSuffix = DEFAULT_SCHEMA_SUFFIX;
        private ValidationMode validationMode = ValidationMode.LENIENT;
        private boolean oemCheck = true;
        private boolean fuzzyEnabled = true;
        private double fuzzyMinSimilarity = DEFAULT_FUZZY_MIN_SIMILARITY;

        Builder() {}

        public Builder schemaDirectory(Path schemaDirectory) {
            this.schemaDirectory = schemaDirectory;
            return this;
        }

        public Builder schemaSuffix(String schemaSuffix) {
            this.schemaSuffix = schemaSuffix;
            return this;
        }

        public Builder validationMode(ValidationMode validationMode) {
            this.validationMode = validationMode;
            return this;
        }

        public Builder oemCheck(boolean oemCheck) {
            this.oemCheck = oemCheck;
            return this;
        }

        public Builder fuzzyEnabled(boolean fuzzyEnabled) {
            this.fuzzyEnabled = fuzzyEnabled;
            return this;
        }

        public Builder fuzzyMinSimilarity(double fuzzyMinSimilarity) {
            this.fuzzyMinSimilarity = fuzzyMinSimilarity;
            return this;
        }

        public CatalogConfig build() {
            return new CatalogConfig(
                    schemaDirectory, schemaSuffix, validationMode, oemCheck, fuzzyEnabled, fuzzyMinSimilarity);
        }
    }
}
