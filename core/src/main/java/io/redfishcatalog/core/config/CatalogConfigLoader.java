package io.redfishcatalog.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.redfishcatalog.core.engine.ValidationMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link CatalogConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>
 * Example file:
 *
 * <pre>
 * schema:
 *   directory: ./SchemaFiles/metadata
 *   suffix: _v1.xml
 * validation:
 *   mode: lenient
 *   oem-check: true
 * fuzzy:
 *   enabled: true
 *   min-similarity: 0.7
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code RFC_SCHEMA_DIRECTORY},
 * {@code RFC_SCHEMA_SUFFIX}, {@code RFC_VALIDATION_MODE}, {@code RFC_VALIDATION_OEM_CHECK},
 * {@code RFC_FUZZY_ENABLED}, {@code RFC_FUZZY_MIN_SIMILARITY}). An env var counts as set only if
 * it is defined and non-blank after trimming; otherwise the YAML value (or default) stands.
 * Relative schema directories are resolved against the config file's directory.
 */
public final class CatalogConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private CatalogConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath} with overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds invalid
     *                             values
     */
    public static CatalogConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath} with overrides from the supplied lookup.
     * Returning {@code null} from {@code envLookup} means the variable is not defined.
     */
    public static CatalogConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            Path baseDir = configPath.toAbsolutePath().getParent();
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup, baseDir);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static CatalogConfig mapToConfig(JsonNode root, Function<String, String> envLookup, Path baseDir) {
        CatalogConfig.Builder builder = CatalogConfig.builder();

        // --- YAML mapping ---
        JsonNode schema = root.path("schema");
        String directory = textOrNull(schema, "directory");
        if (schema.has("suffix")) builder.schemaSuffix(schema.get("suffix").asText());

        JsonNode validation = root.path("validation");
        if (validation.has("mode")) builder.validationMode(ValidationMode.fromString(validation.get("mode").asText()));
        if (validation.has("oem-check")) builder.oemCheck(validation.get("oem-check").asBoolean());

        JsonNode fuzzy = root.path("fuzzy");
        if (fuzzy.has("enabled")) builder.fuzzyEnabled(fuzzy.get("enabled").asBoolean());
        if (fuzzy.has("min-similarity")) builder.fuzzyMinSimilarity(fuzzy.get("min-similarity").asDouble());

        // --- Environment variable overlay ---
        if (isSet(envLookup, "RFC_SCHEMA_DIRECTORY")) {
            directory = envLookup.apply("RFC_SCHEMA_DIRECTORY").trim();
        }
        envString(envLookup, "RFC_SCHEMA_SUFFIX", builder::schemaSuffix);
        envString(envLookup, "RFC_VALIDATION_MODE", v -> builder.validationMode(ValidationMode.fromString(v)));
        envBool(envLookup, "RFC_VALIDATION_OEM_CHECK", builder::oemCheck);
        envBool(envLookup, "RFC_FUZZY_ENABLED", builder::fuzzyEnabled);
        envString(envLookup, "RFC_FUZZY_MIN_SIMILARITY", v -> builder.fuzzyMinSimilarity(parseDouble(v)));

        if (directory == null || directory.isBlank()) {
            throw new ConfigLoadException(
                    "Missing required 'schema.directory' (or RFC_SCHEMA_DIRECTORY) in configuration");
        }
        Path schemaDirectory = Path.of(directory);
        if (!schemaDirectory.isAbsolute() && baseDir != null) {
            schemaDirectory = baseDir.resolve(schemaDirectory).normalize();
        }
        builder.schemaDirectory(schemaDirectory);

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: '" + value + "'", e);
        }
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.has(field) ? node.get(field).asText() : null;
    }
}
