package io.redfishcatalog.core.error;

import io.redfishcatalog.core.catalog.DocumentCatalog;
import java.util.List;

/**
 * Thrown when the schema directory cannot be read, or after a scan in which one or more documents
 * failed to parse. In the latter case the catalog built from the remaining documents is available
 * through {@link #partialCatalog()}; whether to continue with it is the caller's decision.
 */
public final class CatalogLoadException extends CatalogException {

    private static final long serialVersionUID = 1L;

    /** One rejected schema document. */
    public record DocumentFailure(String fileName, String detail) {}

    private final String source;
    private final transient List<DocumentFailure> failures;
    private final transient DocumentCatalog partialCatalog;

    public CatalogLoadException(String message, Throwable cause, String source) {
        super(message, cause, null, Phase.LOAD);
        this.source = source;
        this.failures = List.of();
        this.partialCatalog = null;
    }

    public CatalogLoadException(
            String message, String source, List<DocumentFailure> failures, DocumentCatalog partialCatalog) {
        super(message, null, Phase.LOAD);
        this.source = source;
        this.failures = List.copyOf(failures);
        this.partialCatalog = partialCatalog;
    }

    /** The directory being loaded. */
    public String source() {
        return source;
    }

    /** Per-document failures, empty when the directory itself was unreadable. */
    public List<DocumentFailure> failures() {
        return failures;
    }

    /** Catalog of the documents that did parse, or {@code null} if the directory was unreadable. */
    public DocumentCatalog partialCatalog() {
        return partialCatalog;
    }
}
