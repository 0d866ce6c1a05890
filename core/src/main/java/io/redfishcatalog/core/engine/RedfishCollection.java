package io.redfishcatalog.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.redfishcatalog.core.model.PropertyDefinition;
import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** A {@code Collection(...)} property populated element-wise. */
public final class RedfishCollection implements RedfishElement {

    private final PropertyDefinition definition;
    private final List<RedfishElement> elements;

    RedfishCollection(PropertyDefinition definition, List<RedfishElement> elements) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.elements = List.copyOf(elements);
    }

    public PropertyDefinition definition() {
        return definition;
    }

    @Override
    public String name() {
        return definition.name();
    }

    public List<RedfishElement> elements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public JsonNode asJson() {
        ArrayNode array = JsonNodeFactory.instance.arrayNode(elements.size());
        for (RedfishElement element : elements) {
            JsonNode json = element.asJson();
            array.add(json.isMissingNode() ? JsonNodeFactory.instance.nullNode() : json);
        }
        return array;
    }

    @Override
    public Set<URI> getLinks() {
        Set<URI> links = new LinkedHashSet<>();
        elements.forEach(e -> links.addAll(e.getLinks()));
        return links;
    }

    @Override
    public boolean valid() {
        return elements.stream().allMatch(RedfishElement::valid);
    }

    @Override
    public boolean isAbsent() {
        return false;
    }

    @Override
    public String toString() {
        return "RedfishCollection[" + name() + ", size=" + elements.size() + "]";
    }
}
