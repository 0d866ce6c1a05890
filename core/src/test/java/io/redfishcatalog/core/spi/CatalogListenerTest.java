package io.redfishcatalog.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ch.qos.logback.classic.Level;
import io.redfishcatalog.core.catalog.DocumentCatalog;
import io.redfishcatalog.core.config.CatalogConfig;
import io.redfishcatalog.core.error.CatalogLoadException;
import io.redfishcatalog.core.testkit.LogCapture;
import io.redfishcatalog.core.testkit.TestSchemas;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CatalogListenerTest {

    private final List<CatalogListener.DocumentLoadedEvent> loaded = new ArrayList<>();
    private final List<CatalogListener.DocumentRejectedEvent> rejected = new ArrayList<>();

    private final CatalogListener recording = new CatalogListener() {
        @Override
        public void onDocumentLoaded(DocumentLoadedEvent event) {
            loaded.add(event);
        }

        @Override
        public void onDocumentRejected(DocumentRejectedEvent event) {
            rejected.add(event);
        }
    };

    @Test
    void everyParsedDocumentIsReported() {
        DocumentCatalog.load(TestSchemas.main(), CatalogConfig.defaults(), recording);

        assertThat(loaded)
                .extracting(CatalogListener.DocumentLoadedEvent::fileName)
                .containsExactly("ExampleResource_v1.xml", "Example_v1.xml", "Resource_v1.xml", "Standalone_v1.xml");
        assertThat(loaded).filteredOn(e -> e.fileName().equals("Resource_v1.xml"))
                .extracting(CatalogListener.DocumentLoadedEvent::namespaceCount)
                .containsExactly(2);
        assertThat(rejected).isEmpty();
    }

    @Test
    void rejectedDocumentsAreReportedWithDetail() {
        catchThrowableOfType(
                () -> DocumentCatalog.load(TestSchemas.broken(), CatalogConfig.defaults(), recording),
                CatalogLoadException.class);

        assertThat(loaded).extracting(CatalogListener.DocumentLoadedEvent::fileName).containsExactly("Good_v1.xml");
        assertThat(rejected)
                .extracting(CatalogListener.DocumentRejectedEvent::fileName)
                .containsExactly("Broken_v1.xml", "NotEdmx_v1.xml");
        assertThat(rejected).allSatisfy(e -> assertThat(e.errorDetail()).isNotBlank());
    }

    @Test
    void throwingListenerIsLoggedAndIgnored() {
        CatalogListener failing = new CatalogListener() {
            @Override
            public void onDocumentLoaded(DocumentLoadedEvent event) {
                throw new IllegalStateException("boom");
            }
        };

        try (LogCapture log = LogCapture.attach(DocumentCatalog.class)) {
            DocumentCatalog catalog = DocumentCatalog.load(TestSchemas.main(), CatalogConfig.defaults(), failing);

            assertThat(catalog.documentCount()).isEqualTo(4);
            assertThat(log.messages(Level.WARN)).contains("CatalogListener.onDocumentLoaded failed");
        }
    }

    @Test
    void defaultMethodsAreNoOps() {
        CatalogListener.NONE.onDocumentLoaded(new CatalogListener.DocumentLoadedEvent("a.xml", 1));
        CatalogListener.NONE.onDocumentRejected(new CatalogListener.DocumentRejectedEvent("b.xml", "bad"));
        CatalogListener.NONE.onTypeResolved(new CatalogListener.TypeResolvedEvent("A.A", "A.v1_0_0.A", 0));
    }
}
