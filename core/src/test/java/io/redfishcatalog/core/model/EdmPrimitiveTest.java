package io.redfishcatalog.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EdmPrimitiveTest {

    @ParameterizedTest
    @CsvSource({
        "Edm.Int64, INT",
        "Edm.Int32, INT",
        "Edm.Byte, INT",
        "Edm.Double, DECIMAL",
        "Edm.Decimal, DECIMAL",
        "Edm.String, STRING",
        "Edm.Guid, GUID",
        "Edm.Boolean, BOOLEAN",
        "Edm.DateTimeOffset, DATE_TIME_OFFSET",
        "Edm.Duration, DURATION",
        "Edm.PrimitiveType, ANY",
        "Edm.Binary, ANY"
    })
    void mapsEdmNamesToRules(String typeName, EdmPrimitive expected) {
        assertThat(EdmPrimitive.fromTypeName(typeName)).contains(expected);
    }

    @Test
    void nonEdmNamesAreNotPrimitive() {
        assertThat(EdmPrimitive.fromTypeName("Resource.Id")).isEmpty();
        assertThat(EdmPrimitive.isEdm("Resource.Health")).isFalse();
    }

    @Test
    void collectionWrapperIsStrippedByPropertyDefinition() {
        PropertyDefinition tags = PropertyDefinition.of("Tags", "Collection(Edm.String)", true, false, false, null);

        assertThat(tags.collection()).isTrue();
        assertThat(tags.typeName()).isEqualTo("Edm.String");
        assertThat(tags.element().collection()).isFalse();
    }
}
