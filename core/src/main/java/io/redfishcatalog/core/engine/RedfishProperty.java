package io.redfishcatalog.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.redfishcatalog.core.model.EdmPrimitive;
import io.redfishcatalog.core.model.PropertyDefinition;
import io.redfishcatalog.core.model.PropertyType;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A declared property paired with its payload value.
 *
 * <p>
 * Keeps the raw value exactly as received (so {@link #asJson()} reproduces it), the value
 * coerced to the declared kind, and whether coercion succeeded. The absent marker
 * {@link #ABSENT} is distinct from an explicit JSON {@code null}.
 *
 * <p>
 * Immutable: {@link #populate} returns a new instance.
 */
public final class RedfishProperty implements RedfishElement {

    /** Marker for "declared by the schema, missing from the payload". */
    public static final JsonNode ABSENT = MissingNode.getInstance();

    private final PropertyDefinition definition;
    private final PropertyType type;
    private final JsonNode rawValue;
    private final JsonNode coercedValue;
    private final boolean valid;
    private final String problem;
    private final Set<URI> links;

    RedfishProperty(
            PropertyDefinition definition,
            PropertyType type,
            JsonNode rawValue,
            JsonNode coercedValue,
            boolean valid,
            String problem,
            Set<URI> links) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.rawValue = rawValue != null ? rawValue : ABSENT;
        this.coercedValue = coercedValue != null ? coercedValue : ABSENT;
        this.valid = valid;
        this.problem = problem;
        this.links = Set.copyOf(links);
    }

    /** An absent-valued property of the given definition. */
    static RedfishProperty absent(PropertyDefinition definition, PropertyType type) {
        return new RedfishProperty(definition, type, ABSENT, ABSENT, true, null, Set.of());
    }

    /**
     * A standalone, absent-valued property of a primitive {@code Edm} type, e.g.
     * {@code RedfishProperty.of("Edm.Int")}. Non-primitive types need a catalog; use the
     * {@link ObjectEngine} for those.
     *
     * @throws IllegalArgumentException if {@code edmTypeName} is not an {@code Edm.*} name
     */
    public static RedfishProperty of(String edmTypeName) {
        Objects.requireNonNull(edmTypeName, "edmTypeName must not be null");
        EdmPrimitive primitive = EdmPrimitive.fromTypeName(PropertyDefinition.elementType(edmTypeName))
                .orElseThrow(() -> new IllegalArgumentException("Not a primitive Edm type: " + edmTypeName));
        PropertyDefinition definition = PropertyDefinition.scalar(edmTypeName).element();
        return absent(definition, PropertyType.primitive(definition.typeName(), primitive));
    }

    /** Populates leniently: never throws, records {@link #valid()} instead. */
    public RedfishProperty populate(JsonNode rawValue) {
        return populate(rawValue, ValidationMode.LENIENT);
    }

    /**
     * @param check {@code true} for strict checking
     * @throws io.redfishcatalog.core.error.PropertyCoercionException if {@code check} and the value
     *         does not conform
     */
    public RedfishProperty populate(JsonNode rawValue, boolean check) {
        return populate(rawValue, check ? ValidationMode.STRICT : ValidationMode.LENIENT);
    }

    public RedfishProperty populate(JsonNode rawValue, ValidationMode mode) {
        return PropertyEngine.populate(definition, type, rawValue, mode);
    }

    public PropertyDefinition definition() {
        return definition;
    }

    public PropertyType type() {
        return type;
    }

    @Override
    public String name() {
        return definition.name();
    }

    /** Value as received from the payload; {@link #ABSENT} when missing. */
    public JsonNode rawValue() {
        return rawValue;
    }

    /**
     * Value converted to the declared kind, e.g. an integer node for {@code "1"} declared as
     * {@code Edm.Int}. Equal to the raw value when no conversion applies or coercion failed.
     */
    public JsonNode coercedValue() {
        return coercedValue;
    }

    @Override
    public boolean valid() {
        return valid;
    }

    /** Why lenient coercion failed; empty when {@link #valid()}. */
    public Optional<String> problem() {
        return Optional.ofNullable(problem);
    }

    @Override
    public boolean isAbsent() {
        return rawValue.isMissingNode();
    }

    @Override
    public JsonNode asJson() {
        return rawValue;
    }

    @Override
    public Set<URI> getLinks() {
        return links;
    }

    @Override
    public String toString() {
        return "RedfishProperty[" + name() + ": " + type.typeName() + " = " + (isAbsent() ? "<absent>" : rawValue)
                + (valid ? "" : " (invalid)") + "]";
    }
}
