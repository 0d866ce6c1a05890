package io.redfishcatalog.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.redfishcatalog.core.catalog.DocumentCatalog;
import io.redfishcatalog.core.catalog.TypeCatalog;
import io.redfishcatalog.core.config.CatalogConfig;
import io.redfishcatalog.core.error.MissingSchemaException;
import io.redfishcatalog.core.error.PropertyCoercionException;
import io.redfishcatalog.core.model.ResolvedType;
import io.redfishcatalog.core.testkit.LogCapture;
import io.redfishcatalog.core.testkit.TestSchemas;
import java.net.URI;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ObjectEngineTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static DocumentCatalog documents;

    private TypeCatalog types;
    private ObjectEngine engine;
    private ResolvedType example;

    @BeforeAll
    static void load() {
        documents = TestSchemas.mainCatalog();
    }

    @BeforeEach
    void setUp() {
        types = new TypeCatalog(documents);
        engine = new ObjectEngine(types);
        example = types.getTypeInCatalog("Example.v1_7_0.Example");
    }

    private static JsonNode json(String text) throws JsonProcessingException {
        return JSON.readTree(text);
    }

    @Nested
    @DisplayName("skeleton")
    class Skeleton {

        @Test
        void everyDeclaredPropertyIsAbsent() {
            RedfishObject skeleton = engine.skeleton(example);

            assertThat(skeleton.elements()).hasSize(17);
            assertThat(skeleton.isSkeleton()).isTrue();
            assertThat(skeleton.elements().values()).allMatch(RedfishElement::isAbsent);
            assertThat(skeleton.asJson().size()).isZero();
            assertThat(skeleton.getLinks()).isEmpty();
        }

        @Test
        void emptyPayloadEqualsSkeleton() throws Exception {
            RedfishObject populated = engine.populate(example, json("{}"));

            assertThat(populated.asJson()).isEqualTo(engine.skeleton(example).asJson());
            assertThat(populated.unknownKeys()).isEmpty();
        }
    }

    @Test
    void explicitNullIsPreservedAndDistinctFromAbsence() throws Exception {
        RedfishObject populated = engine.populate(example, json("{\"Description\": null}"));

        assertThat(populated.asJson()).isEqualTo(json("{\"Description\": null}"));
        assertThat(populated.element("Description").isAbsent()).isFalse();
        assertThat(populated.element("Name").isAbsent()).isTrue();
    }

    @Nested
    @DisplayName("population")
    class Population {

        private static final String PAYLOAD = """
                {
                  "@odata.id": "/redfish/v1/Examples/1",
                  "@odata.type": "#Example.v1_7_0.Example",
                  "Id": "1",
                  "Name": "Example One",
                  "Count": 3,
                  "Ratio": 0.25,
                  "Tags": ["a", "b"],
                  "PowerState": "On",
                  "Status": {"State": "Enabled", "Health": "OK"},
                  "Related": {"@odata.id": "/redfish/v1/Things/9"},
                  "Members": [{"@odata.id": "/redfish/v1/Things/1"}, {"@odata.id": "/redfish/v1/Things/2"}],
                  "Embedded": {"Id": "e", "Name": "Embedded", "PowerWatts": 12.5},
                  "Links": {"Chassis": [{"@odata.id": "/redfish/v1/Chassis/1"}]},
                  "Actions": {"#Example.Reset": {"target": "/redfish/v1/Examples/1/Actions/Example.Reset"}}
                }
                """;

        private RedfishObject populated;

        @BeforeEach
        void populate() throws Exception {
            populated = engine.populate(example, json(PAYLOAD), ValidationMode.STRICT);
        }

        @Test
        void roundTripsDeclaredValues() throws Exception {
            assertThat(populated.asJson()).isEqualTo(json(PAYLOAD));
            assertThat(populated.valid()).isTrue();
        }

        @Test
        void nestedComplexValueIsObject() {
            RedfishElement status = populated.element("Status");

            assertThat(status).isInstanceOf(RedfishObject.class);
            RedfishObject statusObject = (RedfishObject) status;
            assertThat(statusObject.name()).isEqualTo("Status");
            assertThat(statusObject.element("Health").name()).isEqualTo("Status.Health");
        }

        @Test
        void collectionsArePopulatedElementWise() {
            RedfishCollection tags = (RedfishCollection) populated.element("Tags");

            assertThat(tags.size()).isEqualTo(2);
            assertThat(tags.elements().get(1).name()).isEqualTo("Tags[1]");
        }

        @Test
        void linksAreCollectedFromEveryReference() {
            assertThat(populated.getLinks())
                    .containsExactlyInAnyOrder(
                            URI.create("/redfish/v1/Things/9"),
                            URI.create("/redfish/v1/Things/1"),
                            URI.create("/redfish/v1/Things/2"),
                            URI.create("/redfish/v1/Chassis/1"));
        }

        @Test
        void autoExpandedNavigationUsesNewestConcreteVersion() {
            RedfishObject embedded = (RedfishObject) populated.element("Embedded");

            assertThat(embedded.type().name()).hasToString("ExampleResource.v1_2_0.ExampleResource");
            assertThat(embedded.element("PowerWatts").isAbsent()).isFalse();
        }

        @Test
        void annotationsAndActionsAreKeptApart() {
            assertThat(populated.annotations()).containsOnlyKeys("@odata.id", "@odata.type");
            RedfishObject actions = (RedfishObject) populated.element("Actions");
            assertThat(actions.actions()).containsOnlyKeys("#Example.Reset");
            assertThat(actions.unknownKeys()).isEmpty();
        }
    }

    @Nested
    @DisplayName("payload keys")
    class PayloadKeys {

        @Test
        void misspelledKeyIsMatchedFuzzily() throws Exception {
            RedfishObject populated = engine.populate(example, json("{\"Descripton\": \"typo\"}"));

            assertThat(((RedfishProperty) populated.element("Description")).rawValue().textValue()).isEqualTo("typo");
            assertThat(populated.unknownKeys()).isEmpty();
        }

        @Test
        void keyOfAnotherDeclaredPropertyIsNotStolen() throws Exception {
            RedfishObject populated = engine.populate(example, json("{\"Name\": \"n\"}"));

            assertThat(populated.element("Name").isAbsent()).isFalse();
            assertThat(populated.element("Id").isAbsent()).isTrue();
        }

        @Test
        void fuzzyKeyIsClaimedByOnlyOneProperty() throws Exception {
            ResolvedType twins = types.getTypeInCatalog("Standalone.v1_0_0.Twins");

            RedfishObject populated = engine.populate(twins, json("{\"colorc\": \"red\"}"));

            assertThat(populated.element("ColorA").asJson().textValue()).isEqualTo("red");
            assertThat(populated.element("ColorB").isAbsent()).isTrue();
            assertThat(populated.asJson()).isEqualTo(json("{\"ColorA\": \"red\"}"));
        }

        @Test
        void fuzzyMatchingCanBeDisabled() throws Exception {
            ObjectEngine exact = new ObjectEngine(types, CatalogConfig.builder().fuzzyEnabled(false).build());

            RedfishObject populated = exact.populate(example, json("{\"Descripton\": \"typo\"}"));

            assertThat(populated.element("Description").isAbsent()).isTrue();
            assertThat(populated.unknownKeys()).containsExactly("Descripton");
        }

        @Test
        void undeclaredKeysAreReported() throws Exception {
            RedfishObject populated =
                    engine.populate(example, json("{\"Zebra\": 1, \"Name@Redfish.AllowableValues\": [\"x\"]}"));

            assertThat(populated.unknownKeys()).containsExactly("Zebra");
            assertThat(populated.annotations()).containsOnlyKeys("Name@Redfish.AllowableValues");
        }
    }

    @Nested
    @DisplayName("@odata.type")
    class OdataType {

        @Test
        void derivedTypeNamedInPayloadIsUsed() throws Exception {
            ResolvedType abstractExample = types.getTypeInCatalog("Example");

            RedfishObject populated =
                    engine.populate(abstractExample, json("{\"@odata.type\": \"#Example.v1_1_0.Example\"}"));

            assertThat(populated.type().name()).hasToString("Example.v1_1_0.Example");
            assertThat(populated.elements()).containsKey("SampleTime").doesNotContainKey("Links");
        }

        @Test
        void abstractTypeWithoutOdataTypeUsesNewestConcreteVersion() throws Exception {
            RedfishObject populated = engine.populate(types.getTypeInCatalog("Example"), json("{}"));

            assertThat(populated.type().name()).hasToString("Example.v1_7_0.Example");
        }

        @Test
        void unrelatedOdataTypeIsIgnored() throws Exception {
            ResolvedType v100 = types.getTypeInCatalog("Example.v1_0_0.Example");

            RedfishObject populated =
                    engine.populate(v100, json("{\"@odata.type\": \"#ExampleResource.v1_0_0.ExampleResource\"}"));

            assertThat(populated.type()).isSameAs(v100);
        }

        @Test
        void unresolvableOdataTypeFailsOnlyWhenStrict() throws Exception {
            JsonNode payload = json("{\"@odata.type\": \"#Nowhere.v1_0_0.Thing\"}");

            assertThat(engine.populate(example, payload).type()).isSameAs(example);
            assertThatThrownBy(() -> engine.populate(example, payload, ValidationMode.STRICT))
                    .isInstanceOf(MissingSchemaException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"#", "#Example.v1_0_0.", "#.Example", "#Example..Example"})
        void malformedOdataTypeIsTreatedAsUnresolvable(String odataType) {
            JsonNode payload = JSON.createObjectNode().put("@odata.type", odataType).put("Name", "n");

            try (LogCapture log = LogCapture.attach(ObjectEngine.class)) {
                RedfishObject populated = engine.populate(example, payload);

                assertThat(populated.type()).isSameAs(example);
                assertThat(populated.element("Name").asJson().asText()).isEqualTo("n");
                assertThat(log.messages(Level.WARN)).singleElement().asString().contains("Unresolvable @odata.type");
            }
            assertThatThrownBy(() -> engine.populate(example, payload, ValidationMode.STRICT))
                    .isInstanceOf(MissingSchemaException.class);
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void lenientModeFlagsInvalidNestedValue() throws Exception {
            RedfishObject populated = engine.populate(example, json("{\"Status\": {\"Health\": \"Fine\"}}"));

            assertThat(populated.valid()).isFalse();
            RedfishObject status = (RedfishObject) populated.element("Status");
            assertThat(status.element("Health").valid()).isFalse();
            assertThat(status.element("State").valid()).isTrue();
        }

        @Test
        void strictModeNamesTheNestedPropertyPath() throws Exception {
            assertThatThrownBy(() -> engine.populate(
                            example, json("{\"Status\": {\"Health\": \"Fine\"}}"), ValidationMode.STRICT))
                    .isInstanceOf(PropertyCoercionException.class)
                    .satisfies(e -> assertThat(((PropertyCoercionException) e).property()).isEqualTo("Status.Health"));
        }

        @Test
        void scalarWhereObjectExpected() throws Exception {
            RedfishObject populated = engine.populate(example, json("{\"Status\": \"OK\"}"));

            assertThat(populated.element("Status")).isInstanceOf(RedfishProperty.class);
            assertThat(populated.element("Status").valid()).isFalse();
        }

        @Test
        void collectionElementErrorsCarryIndex() throws Exception {
            JsonNode payload = json("{\"Members\": [{\"@odata.id\": \"/redfish/v1/Things/1\"}, 5]}");

            assertThatThrownBy(() -> engine.populate(example, payload, ValidationMode.STRICT))
                    .isInstanceOf(PropertyCoercionException.class)
                    .satisfies(e -> assertThat(((PropertyCoercionException) e).property()).isEqualTo("Members[1]"));
        }

        @Test
        void referenceWithoutOdataIdIsInvalid() throws Exception {
            assertThatThrownBy(() -> engine.populate(example, json("{\"Related\": {}}"), ValidationMode.STRICT))
                    .isInstanceOf(PropertyCoercionException.class)
                    .satisfies(e -> assertThat(((PropertyCoercionException) e).property()).isEqualTo("Related"));
        }

        @Test
        void nonObjectPayloadIsRejected() throws Exception {
            assertThatThrownBy(() -> engine.populate(example, json("[1]")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void unresolvablePropertyTypeIsFatal() throws Exception {
            ResolvedType holder = types.getTypeInCatalog("Standalone.v1_0_0.Holder");

            assertThatThrownBy(() -> engine.populate(holder, json("{\"Label\": \"x\"}")))
                    .isInstanceOf(MissingSchemaException.class);
        }
    }

    @Nested
    @DisplayName("Oem")
    class Oem {

        private static final String PAYLOAD = "{\"Oem\": {\"Contoso\": {\"Anything\": [1, 2]}}}";

        @Test
        void checkedOemIsPopulatedAgainstItsType() throws Exception {
            RedfishObject populated = engine.populate(example, json(PAYLOAD));

            RedfishObject oem = (RedfishObject) populated.element("Oem");
            assertThat(oem.unknownKeys()).containsExactly("Contoso");
        }

        @Test
        void uncheckedOemIsCarriedThrough() throws Exception {
            ObjectEngine unchecked = new ObjectEngine(types, CatalogConfig.builder().oemCheck(false).build());

            RedfishObject populated = unchecked.populate(example, json(PAYLOAD), ValidationMode.STRICT);

            assertThat(populated.element("Oem")).isInstanceOf(RedfishProperty.class);
            assertThat(populated.asJson()).isEqualTo(json(PAYLOAD));
        }
    }
}
