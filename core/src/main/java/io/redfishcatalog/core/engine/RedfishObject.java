package io.redfishcatalog.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.redfishcatalog.core.model.ResolvedType;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An entity or complex type paired with a payload object: one element per declared property (own
 * and inherited, in declaration order), plus the payload's annotations, action entries and
 * undeclared keys.
 *
 * <p>
 * An object populated without a payload is the schema skeleton: every element is absent.
 */
public final class RedfishObject implements RedfishElement {

    private final String name;
    private final ResolvedType type;
    private final Map<String, RedfishElement> elements;
    private final Map<String, JsonNode> annotations;
    private final Map<String, JsonNode> actions;
    private final Set<String> unknownKeys;

    RedfishObject(
            String name,
            ResolvedType type,
            Map<String, RedfishElement> elements,
            Map<String, JsonNode> annotations,
            Map<String, JsonNode> actions,
            Set<String> unknownKeys) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        this.unknownKeys = Collections.unmodifiableSet(new LinkedHashSet<>(unknownKeys));
    }

    @Override
    public String name() {
        return name;
    }

    /** The type the object was populated as; may be derived from the declared one via {@code @odata.type}. */
    public ResolvedType type() {
        return type;
    }

    /** Elements keyed by declared property name. */
    public Map<String, RedfishElement> elements() {
        return elements;
    }

    public RedfishElement element(String propertyName) {
        return elements.get(propertyName);
    }

    /** Payload keys containing {@code @}, e.g. {@code @odata.id} or {@code Name@Redfish.AllowableValues}. */
    public Map<String, JsonNode> annotations() {
        return annotations;
    }

    /** Payload keys starting with {@code #}, e.g. {@code #ComputerSystem.Reset}. */
    public Map<String, JsonNode> actions() {
        return actions;
    }

    /** Payload keys that are neither declared properties, annotations nor actions. */
    public Set<String> unknownKeys() {
        return unknownKeys;
    }

    /**
     * Plain JSON form: annotations, then non-absent declared properties in declaration order
     * (explicit nulls kept), then actions. Undeclared keys are not reproduced.
     */
    @Override
    public JsonNode asJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        annotations.forEach(json::set);
        elements.forEach((propertyName, element) -> {
            JsonNode value = element.asJson();
            if (!value.isMissingNode()) {
                json.set(propertyName, value);
            }
        });
        actions.forEach(json::set);
        return json;
    }

    @Override
    public Set<URI> getLinks() {
        Set<URI> links = new LinkedHashSet<>();
        elements.values().forEach(e -> links.addAll(e.getLinks()));
        return links;
    }

    @Override
    public boolean valid() {
        return elements.values().stream().allMatch(RedfishElement::valid);
    }

    @Override
    public boolean isAbsent() {
        return false;
    }

    /** True when no declared property carries a value. */
    public boolean isSkeleton() {
        return elements.values().stream().allMatch(RedfishElement::isAbsent);
    }

    @Override
    public String toString() {
        return "RedfishObject[" + name + ": " + type.name() + ", properties=" + elements.size() + "]";
    }
}
