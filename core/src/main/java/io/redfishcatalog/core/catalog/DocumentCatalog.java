package io.redfishcatalog.core.catalog;

import io.redfishcatalog.core.config.CatalogConfig;
import io.redfishcatalog.core.error.CatalogLoadException;
import io.redfishcatalog.core.error.MissingSchemaException;
import io.redfishcatalog.core.error.SchemaParseException;
import io.redfishcatalog.core.model.NamespaceDefinition;
import io.redfishcatalog.core.model.NamespaceName;
import io.redfishcatalog.core.model.SchemaDocument;
import io.redfishcatalog.core.model.SchemaReference;
import io.redfishcatalog.core.model.SchemaVersion;
import io.redfishcatalog.core.schema.SchemaDocumentParser;
import io.redfishcatalog.core.spi.CatalogListener;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Immutable index of parsed schema documents: by file name, by namespace, and by namespace base
 * name across versions.
 *
 * <p>
 * Built once by {@link #load(Path)} (or a {@link Builder}) and read-only afterwards, so a single
 * instance is safe to share between concurrent validation requests without locking.
 */
public final class DocumentCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCatalog.class);

    /** MDC key carrying the schema file being parsed. */
    static final String MDC_SCHEMA_FILE = "schema.file";

    private final Map<String, SchemaDocument> documentsByFile;
    private final Map<NamespaceName, SchemaDocument> documentsByNamespace;
    private final Map<String, List<NamespaceDefinition>> namespacesByBase;
    private final String schemaSuffix;

    private DocumentCatalog(List<SchemaDocument> documents, String schemaSuffix) {
        Map<String, SchemaDocument> byFile = new LinkedHashMap<>();
        Map<NamespaceName, SchemaDocument> byNamespace = new HashMap<>();
        Map<String, List<NamespaceDefinition>> byBase = new HashMap<>();
        for (SchemaDocument document : documents) {
            byFile.put(document.fileName(), document);
            for (NamespaceDefinition ns : document.namespaces()) {
                SchemaDocument previous = byNamespace.putIfAbsent(ns.name(), document);
                if (previous != null) {
                    LOG.warn(
                            "Duplicate namespace ignored: namespace={}, file={}, keptFile={}",
                            ns.name(),
                            document.fileName(),
                            previous.fileName());
                    continue;
                }
                byBase.computeIfAbsent(ns.name().baseName(), k -> new ArrayList<>()).add(ns);
            }
        }
        byBase.replaceAll((base, list) -> {
            list.sort(SchemaDocument.NEWEST_FIRST);
            return List.copyOf(list);
        });
        this.documentsByFile = Collections.unmodifiableMap(byFile);
        this.documentsByNamespace = Map.copyOf(byNamespace);
        this.namespacesByBase = Map.copyOf(byBase);
        this.schemaSuffix = schemaSuffix;
    }

    /** Loads every {@code *.xml} file in {@code directory} with default settings. */
    public static DocumentCatalog load(Path directory) {
        return load(directory, CatalogConfig.defaults(), CatalogListener.NONE);
    }

    public static DocumentCatalog load(Path directory, CatalogConfig config) {
        return load(directory, config, CatalogListener.NONE);
    }

    /**
     * Loads every {@code *.xml} file in {@code directory}.
     *
     * <p>
     * A document that fails to parse does not stop the others from loading. Once the whole
     * directory has been read, any failures are reported together by a
     * {@link CatalogLoadException} whose {@link CatalogLoadException#partialCatalog()} holds the
     * documents that did parse.
     *
     * @throws CatalogLoadException if the directory is unreadable or any document failed to parse
     */
    public static DocumentCatalog load(Path directory, CatalogConfig config, CatalogListener listener) {
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        String source = directory.toString();

        List<Path> files;
        if (!Files.isDirectory(directory)) {
            throw new CatalogLoadException("Schema directory is not readable: " + source, null, source);
        }
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".xml"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to list schema directory: " + source, e, source);
        }

        SchemaDocumentParser parser = new SchemaDocumentParser();
        Builder builder = builder().schemaSuffix(config.schemaSuffix());
        List<CatalogLoadException.DocumentFailure> failures = new ArrayList<>();

        for (Path file : files) {
            String fileName = file.getFileName().toString();
            MDC.put(MDC_SCHEMA_FILE, fileName);
            try {
                SchemaDocument document = parser.parse(file);
                builder.addDocument(document);
                notifyLoaded(listener, document);
            } catch (SchemaParseException e) {
                LOG.warn("Schema document rejected: file={}, detail={}", fileName, e.getMessage());
                failures.add(new CatalogLoadException.DocumentFailure(fileName, e.getMessage()));
                notifyRejected(listener, fileName, e);
            } finally {
                MDC.remove(MDC_SCHEMA_FILE);
            }
        }

        DocumentCatalog catalog = builder.build();
        LOG.info(
                "Schema catalog loaded: directory={}, documents={}, namespaces={}, rejected={}",
                source,
                catalog.documentCount(),
                catalog.documentsByNamespace.size(),
                failures.size());

        if (!failures.isEmpty()) {
            throw new CatalogLoadException(
                    failures.size() + " schema document(s) failed to parse in " + source + ": "
                            + failures.stream()
                                    .map(CatalogLoadException.DocumentFailure::fileName)
                                    .collect(Collectors.joining(", ")),
                    source,
                    failures,
                    catalog);
        }
        return catalog;
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- Lookups ---

    /**
     * Returns the document declaring the namespace of {@code qualifiedOrBareName}, which may be a
     * bare namespace ({@code Example}), a versioned namespace ({@code Example.v1_0_0}) or a
     * qualified type name ({@code Example.v1_0_0.Example}). Version fallback applies.
     *
     * @throws MissingSchemaException if no document declares a matching namespace
     */
    public SchemaDocument getSchemaDocByClass(String qualifiedOrBareName) {
        NamespaceDefinition ns = getSchemaInCatalog(qualifiedOrBareName);
        SchemaDocument document = documentsByNamespace.get(ns.name());
        if (document == null) {
            throw new MissingSchemaException(qualifiedOrBareName);
        }
        return document;
    }

    /**
     * Same lookup as {@link #getSchemaDocByClass(String)}, returning the namespace record.
     *
     * @throws MissingSchemaException if no document declares a matching namespace
     */
    public NamespaceDefinition getSchemaInCatalog(String qualifiedNamespaceOrType) {
        Objects.requireNonNull(qualifiedNamespaceOrType, "name must not be null");
        if (!isWellFormed(qualifiedNamespaceOrType)) {
            throw new MissingSchemaException(qualifiedNamespaceOrType);
        }
        return findNamespace(toNamespace(qualifiedNamespaceOrType))
                .orElseThrow(() -> new MissingSchemaException(qualifiedNamespaceOrType));
    }

    /** Version-fallback lookup of a namespace across all documents. */
    public Optional<NamespaceDefinition> findNamespace(NamespaceName requested) {
        List<NamespaceDefinition> chain = namespacesByBase.getOrDefault(requested.baseName(), List.of());
        return VersionFallback.select(chain, requested.version());
    }

    /** All namespaces of a base name, newest first, unversioned last. */
    public List<NamespaceDefinition> namespacesOf(String baseName) {
        return namespacesByBase.getOrDefault(baseName, List.of());
    }

    /** The document that declares exactly this namespace. */
    public Optional<SchemaDocument> documentOf(NamespaceName namespace) {
        return Optional.ofNullable(documentsByNamespace.get(namespace));
    }

    public Optional<SchemaDocument> document(String fileName) {
        return Optional.ofNullable(documentsByFile.get(fileName));
    }

    /**
     * Finds the document a reference points at: by the file name in its URI, else by the
     * document declaring {@code baseName}, else by {@code baseName + schemaSuffix}.
     */
    public Optional<SchemaDocument> documentFor(SchemaReference reference, String baseName) {
        SchemaDocument byFile = documentsByFile.get(reference.fileName());
        if (byFile != null && byFile.declaresBase(baseName)) {
            return Optional.of(byFile);
        }
        Optional<SchemaDocument> declaring = findNamespace(NamespaceName.unversioned(baseName))
                .map(ns -> documentsByNamespace.get(ns.name()));
        if (declaring.isPresent()) {
            return declaring;
        }
        return Optional.ofNullable(documentsByFile.get(baseName + schemaSuffix));
    }

    public Collection<SchemaDocument> documents() {
        return documentsByFile.values();
    }

    public int documentCount() {
        return documentsByFile.size();
    }

    public String schemaSuffix() {
        return schemaSuffix;
    }

    /** Non-blank, with no empty dot-separated segment. */
    private static boolean isWellFormed(String name) {
        String stripped = name.strip();
        return !stripped.isEmpty() && Arrays.stream(stripped.split("\\.", -1)).noneMatch(String::isBlank);
    }

    /**
     * Reads a namespace out of a class-style name. A {@code vN_N_N} segment ends the namespace;
     * without one the whole name is tried as a namespace before dropping a trailing type name.
     */
    private NamespaceName toNamespace(String name) {
        String[] segments = name.strip().split("\\.");
        for (int i = 1; i < segments.length; i++) {
            if (SchemaVersion.isVersionSegment(segments[i])) {
                String base = String.join(".", Arrays.copyOfRange(segments, 0, i));
                return new NamespaceName(base, SchemaVersion.parse(segments[i]));
            }
        }
        String whole = name.strip();
        if (namespacesByBase.containsKey(whole) || whole.indexOf('.') < 0) {
            return NamespaceName.unversioned(whole);
        }
        return NamespaceName.unversioned(whole.substring(0, whole.lastIndexOf('.')));
    }

    // --- Listener notifications ---

    private static void notifyLoaded(CatalogListener listener, SchemaDocument document) {
        try {
            listener.onDocumentLoaded(new CatalogListener.DocumentLoadedEvent(
                    document.fileName(), document.namespaces().size()));
        } catch (Exception e) {
            LOG.warn("CatalogListener.onDocumentLoaded failed", e);
        }
    }

    private static void notifyRejected(CatalogListener listener, String fileName, Exception cause) {
        try {
            listener.onDocumentRejected(new CatalogListener.DocumentRejectedEvent(fileName, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("CatalogListener.onDocumentRejected failed", e);
        }
    }

    /**
     * Builder for assembling a catalog from already-parsed documents, e.g. documents whose text was
     * fetched by some other means than a directory scan.
     */
    public static final class Builder {

        private final List<SchemaDocument> documents = new ArrayList<>();
        private String schemaSuffix = CatalogConfig.DEFAULT_SCHEMA_SUFFIX;

        Builder() {}

        public Builder addDocument(SchemaDocument document) {
            documents.add(Objects.requireNonNull(document, "document must not be null"));
            return this;
        }

        public Builder schemaSuffix(String schemaSuffix) {
            this.schemaSuffix = Objects.requireNonNull(schemaSuffix, "schemaSuffix must not be null");
            return this;
        }

        public DocumentCatalog build() {
            return new DocumentCatalog(documents, schemaSuffix);
        }
    }
}
