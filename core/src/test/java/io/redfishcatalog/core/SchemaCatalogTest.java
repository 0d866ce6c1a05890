package io.redfishcatalog.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.redfishcatalog.core.config.CatalogConfig;
import io.redfishcatalog.core.config.CatalogConfigLoader;
import io.redfishcatalog.core.engine.RedfishObject;
import io.redfishcatalog.core.engine.ValidationMode;
import io.redfishcatalog.core.error.CatalogLoadException;
import io.redfishcatalog.core.error.MissingSchemaException;
import io.redfishcatalog.core.error.PropertyCoercionException;
import io.redfishcatalog.core.model.SchemaDocument;
import io.redfishcatalog.core.testkit.TestSchemas;
import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SchemaCatalogTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static SchemaCatalog catalog;

    @BeforeAll
    static void load() throws Exception {
        Path configFile = Path.of(SchemaCatalogTest.class.getResource("/config/catalog.yaml").toURI());
        catalog = SchemaCatalog.load(CatalogConfigLoader.load(configFile));
    }

    @Test
    void loadsTheConfiguredDirectory() {
        assertThat(catalog.config().validationMode()).isEqualTo(ValidationMode.STRICT);
        assertThat(catalog.documents().documentCount()).isEqualTo(4);
        assertThat(catalog.getSchemaDocByClass("Example").fileName()).isEqualTo("Example_v1.xml");
        assertThat(catalog.getTypeInCatalog("Example.v1_7_0.Example").properties()).hasSize(17);
    }

    @Test
    void configWithoutDirectoryIsRejected() {
        assertThatThrownBy(() -> SchemaCatalog.load(CatalogConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("schema directory");
    }

    @Test
    void resolvesReferencesFromADocument() {
        SchemaDocument example = catalog.getSchemaDocByClass("Example");

        assertThat(catalog.resolveReference(example, "ExRes").name()).hasToString("ExampleResource.v1_0_0");
        assertThat(catalog.getTypeInSchemaDoc(example, "ExRes.ExampleResource").name())
                .hasToString("ExampleResource.v1_0_0.ExampleResource");
    }

    @Test
    void populatedValuesRoundTrip() throws Exception {
        JsonNode payload = JSON.readTree("""
                {
                  "Id": "7",
                  "Name": "Seven",
                  "Count": 7,
                  "Tags": [],
                  "Status": {"Health": "Warning"},
                  "Related": {"@odata.id": "/redfish/v1/Things/7"}
                }
                """);

        RedfishObject populated = catalog.populate("Example.v1_7_0.Example", payload);

        assertThat(populated.asJson()).isEqualTo(payload);
        assertThat(populated.getLinks()).containsExactly(URI.create("/redfish/v1/Things/7"));
    }

    @Test
    void explicitNullSurvivesPopulation() throws Exception {
        JsonNode payload = JSON.readTree("{\"Id\": null}");

        RedfishObject populated = catalog.populate("Example.v1_7_0.Example", payload, ValidationMode.LENIENT);

        assertThat(populated.asJson()).isEqualTo(payload);
        assertThat(populated.valid()).isFalse();
        assertThatThrownBy(() -> catalog.populate("Example.v1_7_0.Example", payload))
                .isInstanceOf(PropertyCoercionException.class);
    }

    @Test
    void skeletonByName() {
        RedfishObject skeleton = catalog.skeleton("Example.v1_0_0.Example");

        assertThat(skeleton.isSkeleton()).isTrue();
        assertThat(skeleton.asJson().isEmpty()).isTrue();
    }

    @Test
    void unknownTypeNameFails() {
        assertThatThrownBy(() -> catalog.skeleton("Nope.v1_0_0.Nope")).isInstanceOf(MissingSchemaException.class);
    }

    @Test
    void partialCatalogFromFailedLoadIsUsable() {
        CatalogConfig config = CatalogConfig.builder().schemaDirectory(TestSchemas.broken()).build();

        CatalogLoadException ex = catchThrowableOfType(() -> SchemaCatalog.load(config), CatalogLoadException.class);
        SchemaCatalog partial = SchemaCatalog.of(ex.partialCatalog());

        assertThat(partial.documents().documentCount()).isEqualTo(1);
        assertThat(partial.getSchemaInCatalog("Good.v1_0_0").name()).hasToString("Good.v1_0_0");
    }
}
