package io.redfishcatalog.core.spi;

/**
 * Observability hook for catalog lifecycle events.
 *
 * <p>
 * Integrations provide implementations that bridge to their own metrics or reporting. The core
 * has no telemetry dependencies; this is a plain Java interface.
 *
 * <p>
 * Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners are caught
 * by the catalog and logged; they never affect loading or resolution. All methods default to no-op
 * so that implementations override only what they need.
 */
public interface CatalogListener {

    /** Shared no-op listener. */
    CatalogListener NONE = new CatalogListener() {};

    /**
     * Called once per schema document that parsed successfully.
     *
     * @param event contains file name and namespace count
     */
    default void onDocumentLoaded(DocumentLoadedEvent event) {}

    /**
     * Called once per schema document that failed to parse.
     *
     * @param event contains file name and error detail
     */
    default void onDocumentRejected(DocumentRejectedEvent event) {}

    /**
     * Called the first time a qualified type name is resolved (cache hits are not reported).
     *
     * @param event contains the requested name, the resolved name and the merged property count
     */
    default void onTypeResolved(TypeResolvedEvent event) {}

    // --- Event records ---

    /** Event emitted when a schema document is loaded. */
    record DocumentLoadedEvent(String fileName, int namespaceCount) {}

    /** Event emitted when a schema document is rejected. */
    record DocumentRejectedEvent(String fileName, String errorDetail) {}

    /** Event emitted when a type is resolved for the first time. */
    record TypeResolvedEvent(String requestedName, String resolvedName, int propertyCount) {}
}
