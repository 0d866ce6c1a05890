package io.redfishcatalog.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.redfishcatalog.core.error.PropertyCoercionException;
import io.redfishcatalog.core.model.EdmPrimitive;
import io.redfishcatalog.core.model.PropertyDefinition;
import io.redfishcatalog.core.model.PropertyType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coerces a single payload value against its declared kind.
 *
 * <p>
 * Leniency by kind:
 * <ul>
 * <li>{@code Int}: lenient accepts any number or numeric string (truncated); strict only integral
 * values, including integral-valued numeric strings such as {@code "1"}.</li>
 * <li>{@code Decimal}: numbers and numeric strings in both modes.</li>
 * <li>{@code String}: always accepted; scalars are stringified, structures serialized.</li>
 * <li>{@code Guid}, date/time kinds and {@code Duration}: lenient accepts any string; strict
 * checks the lexical form.</li>
 * <li>{@code Boolean}: JSON booleans; lenient also {@code "true"}/{@code "false"}.</li>
 * <li>enums: a declared member name.</li>
 * <li>navigation references: an object with a string {@code @odata.id}, which becomes a link.</li>
 * </ul>
 * The absent marker is accepted in every mode. {@code null} is accepted for nullable properties.
 *
 * <p>
 * In {@link ValidationMode#STRICT} a non-conforming value raises
 * {@link PropertyCoercionException}; in {@link ValidationMode#LENIENT} the property is returned
 * with {@code valid() == false} and a WARN is logged.
 *
 * <p>
 * Thread-safe; stateless.
 */
public final class PropertyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PropertyEngine.class);

    private static final Pattern GUID =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern DURATION =
            Pattern.compile("^-?P(?!$)(\\d+Y)?(\\d+M)?(\\d+W)?(\\d+D)?(T(?=\\d)(\\d+H)?(\\d+M)?(\\d+(\\.\\d+)?S)?)?$");
    private static final String ODATA_ID = "@odata.id";

    /** Wider than any Edm integer type; longer values are rejected before expansion. */
    private static final int MAX_INTEGER_DIGITS = 40;

    private PropertyEngine() {}

    /** Outcome of one coercion: the converted value, or the reason it failed. */
    private record Coercion(JsonNode value, String problem, Set<URI> links) {

        static Coercion ok(JsonNode value) {
            return new Coercion(value, null, Set.of());
        }

        static Coercion fail(String problem) {
            return new Coercion(null, problem, Set.of());
        }
    }

    /**
     * Populates {@code definition} with {@code rawValue}.
     *
     * @throws PropertyCoercionException in strict mode when the value does not conform
     */
    public static RedfishProperty populate(
            PropertyDefinition definition, PropertyType type, JsonNode rawValue, ValidationMode mode) {
        if (JsonNodeUtils.isAbsent(rawValue)) {
            return RedfishProperty.absent(definition, type);
        }
        boolean strict = mode == ValidationMode.STRICT;

        Coercion coercion;
        if (rawValue.isNull()) {
            coercion = definition.nullable() ? Coercion.ok(rawValue) : Coercion.fail("property is not nullable");
        } else if (definition.collection()) {
            coercion = Coercion.fail("expected a collection");
        } else {
            coercion = coerce(type, rawValue, strict);
        }

        if (coercion.problem() == null) {
            return new RedfishProperty(definition, type, rawValue, coercion.value(), true, null, coercion.links());
        }
        String expected = definition.collection() ? "Collection(" + type.expectedKind() + ")" : type.expectedKind();
        if (strict) {
            throw new PropertyCoercionException(
                    definition.name(), expected, JsonNodeUtils.kindOf(rawValue), rawValue.toString());
        }
        LOG.warn(
                "Lenient coercion failed: property={}, expected={}, actual={}, reason={}",
                definition.name(),
                expected,
                JsonNodeUtils.kindOf(rawValue),
                coercion.problem());
        return new RedfishProperty(definition, type, rawValue, rawValue, false, coercion.problem(), Set.of());
    }

    private static Coercion coerce(PropertyType type, JsonNode value, boolean strict) {
        return switch (type.kind()) {
            case PRIMITIVE -> coercePrimitive(type.primitive(), value, strict);
            case ENUM -> value.isTextual() && type.members().contains(value.textValue())
                    ? Coercion.ok(value)
                    : Coercion.fail("not a member of " + type.typeName());
            case REFERENCE -> coerceReference(value);
            case STRUCTURED -> value.isObject() ? Coercion.ok(value) : Coercion.fail("expected an object");
        };
    }

    private static Coercion coercePrimitive(EdmPrimitive primitive, JsonNode value, boolean strict) {
        return switch (primitive) {
            case INT -> coerceInt(value, strict);
            case DECIMAL -> coerceDecimal(value);
            case STRING -> Coercion.ok(value.isTextual() ? value : TextNode.valueOf(stringify(value)));
            case GUID -> coerceLexical(value, strict, GUID.matcher(value.asText()).matches());
            case BOOLEAN -> coerceBoolean(value, strict);
            case DATE_TIME_OFFSET -> coerceLexical(value, strict, parses(value.asText(), OffsetDateTime::parse));
            case DATE -> coerceLexical(value, strict, parses(value.asText(), LocalDate::parse));
            case TIME_OF_DAY -> coerceLexical(value, strict, parses(value.asText(), LocalTime::parse));
            case DURATION -> coerceLexical(value, strict, DURATION.matcher(value.asText()).matches());
            case ANY -> Coercion.ok(value);
        };
    }

    private static Coercion coerceInt(JsonNode value, boolean strict) {
        BigDecimal number = numberOf(value);
        if (number == null) {
            return Coercion.fail("not a number");
        }
        if (strict && !JsonNodeUtils.isIntegral(number)) {
            return Coercion.fail("not an integral value");
        }
        long integerDigits = (long) number.precision() - number.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            return Coercion.fail("integer out of range");
        }
        BigInteger integer = integerDigits <= 0 ? BigInteger.ZERO : number.toBigInteger();
        return Coercion.ok(JsonNodeFactory.instance.numberNode(integer));
    }

    private static Coercion coerceDecimal(JsonNode value) {
        BigDecimal number = numberOf(value);
        return number != null ? Coercion.ok(DecimalNode.valueOf(number)) : Coercion.fail("not a number");
    }

    private static Coercion coerceBoolean(JsonNode value, boolean strict) {
        if (value.isBoolean()) {
            return Coercion.ok(value);
        }
        if (!strict && value.isTextual()) {
            String text = value.textValue().strip();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Coercion.ok(BooleanNode.valueOf(Boolean.parseBoolean(text)));
            }
        }
        return Coercion.fail("not a boolean");
    }

    /** Strings only; in strict mode the lexical check must also hold. */
    private static Coercion coerceLexical(JsonNode value, boolean strict, boolean wellFormed) {
        if (!value.isTextual()) {
            return Coercion.fail("not a string");
        }
        if (strict && !wellFormed) {
            return Coercion.fail("malformed value");
        }
        return Coercion.ok(value);
    }

    private static Coercion coerceReference(JsonNode value) {
        if (!value.isObject()) {
            return Coercion.fail("expected a link object");
        }
        JsonNode id = value.get(ODATA_ID);
        if (id == null || !id.isTextual()) {
            return Coercion.fail("link object has no " + ODATA_ID);
        }
        try {
            return new Coercion(value, null, Set.of(new URI(id.textValue())));
        } catch (URISyntaxException e) {
            return Coercion.fail("malformed " + ODATA_ID + ": " + e.getMessage());
        }
    }

    private static BigDecimal numberOf(JsonNode value) {
        if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        return value.isTextual() ? JsonNodeUtils.parseNumber(value.textValue()) : null;
    }

    private static String stringify(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static boolean parses(String text, Function<String, ?> parser) {
        try {
            parser.apply(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
