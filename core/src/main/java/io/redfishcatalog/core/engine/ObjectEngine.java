package io.redfishcatalog.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.redfishcatalog.core.catalog.TypeCatalog;
import io.redfishcatalog.core.config.CatalogConfig;
import io.redfishcatalog.core.error.MissingSchemaException;
import io.redfishcatalog.core.model.EdmPrimitive;
import io.redfishcatalog.core.model.PropertyDefinition;
import io.redfishcatalog.core.model.PropertyType;
import io.redfishcatalog.core.model.ResolvedType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Populates entity and complex types from payload objects.
 *
 * <p>
 * For every declared property (own and inherited) the payload key is found with the
 * {@link FuzzyKeyMatcher}, excluding the other declared names. Values then populate by kind:
 * objects of structured types recursively, arrays of collection properties element-wise, and
 * everything else through the {@link PropertyEngine}. Missing keys populate as absent.
 *
 * <p>
 * A payload {@code @odata.type} naming the declared type or a type derived from it selects that
 * type; otherwise an abstract unversioned declared type is replaced by its newest concrete
 * version.
 *
 * <p>
 * Thread-safe: holds only immutable collaborators and allocates per call.
 */
public final class ObjectEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ObjectEngine.class);

    private static final String ODATA_TYPE = "@odata.type";
    private static final String OEM = "Oem";

    private final TypeCatalog types;
    private final CatalogConfig config;
    private final FuzzyKeyMatcher matcher;

    public ObjectEngine(TypeCatalog types) {
        this(types, CatalogConfig.defaults());
    }

    public ObjectEngine(TypeCatalog types, CatalogConfig config) {
        this.types = Objects.requireNonNull(types, "types must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.matcher = new FuzzyKeyMatcher(config.fuzzyMinSimilarity());
    }

    /** All-absent instance of {@code type}, used to introspect a type without data. */
    public RedfishObject skeleton(ResolvedType type) {
        return populate(type, RedfishProperty.ABSENT, config.validationMode());
    }

    /** Populates with the configured validation mode. */
    public RedfishObject populate(ResolvedType declaredType, JsonNode payload) {
        return populate(declaredType, payload, config.validationMode());
    }

    /**
     * @param payload a JSON object, or the absent marker for a skeleton
     * @throws IllegalArgumentException if {@code payload} is neither an object nor absent
     * @throws io.redfishcatalog.core.error.PropertyCoercionException in strict mode, on the first
     *         non-conforming value
     * @throws io.redfishcatalog.core.error.SchemaResolveException if a property type cannot be
     *         resolved
     */
    public RedfishObject populate(ResolvedType declaredType, JsonNode payload, ValidationMode mode) {
        Objects.requireNonNull(declaredType, "declaredType must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        JsonNode object = payload != null ? payload : RedfishProperty.ABSENT;
        if (!object.isObject() && !object.isMissingNode()) {
            throw new IllegalArgumentException(
                    "Payload for " + declaredType.name() + " must be a JSON object, got " + JsonNodeUtils.kindOf(object));
        }
        return populateObject("", declaredType, object, mode);
    }

    private RedfishObject populateObject(String path, ResolvedType declaredType, JsonNode payload, ValidationMode mode) {
        ResolvedType type = selectType(declaredType, payload, mode);
        Set<String> payloadKeys = new LinkedHashSet<>();
        payload.fieldNames().forEachRemaining(key -> {
            if (!isAnnotation(key) && !isAction(key)) {
                payloadKeys.add(key);
            }
        });
        Set<String> declaredNames = type.properties().keySet();

        Map<String, RedfishElement> elements = new LinkedHashMap<>();
        Set<String> claimed = new HashSet<>();
        for (PropertyDefinition property : type.properties().values()) {
            String key = matchKey(property.name(), payloadKeys, declaredNames, claimed);
            JsonNode value = payloadKeys.contains(key) ? payload.path(key) : RedfishProperty.ABSENT;
            if (!value.isMissingNode()) {
                claimed.add(key);
            }
            String childPath = path.isEmpty() ? property.name() : path + "." + property.name();
            elements.put(property.name(), populateElement(childPath, property, value, mode));
        }

        Map<String, JsonNode> annotations = new LinkedHashMap<>();
        Map<String, JsonNode> actions = new LinkedHashMap<>();
        Set<String> unknown = new LinkedHashSet<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = payload.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            String key = field.getKey();
            if (isAction(key)) {
                actions.put(key, field.getValue());
            } else if (isAnnotation(key)) {
                annotations.put(key, field.getValue());
            } else if (!claimed.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            LOG.debug("Undeclared payload keys: type={}, path={}, keys={}", type.name(), path, unknown);
        }
        String name = path.isEmpty() ? type.name().typeName() : path;
        return new RedfishObject(name, type, elements, annotations, actions, unknown);
    }

    private static boolean isAction(String key) {
        return key.startsWith("#");
    }

    private static boolean isAnnotation(String key) {
        return key.indexOf('@') >= 0;
    }

    private String matchKey(
            String expected, Set<String> payloadKeys, Set<String> declaredNames, Set<String> claimed) {
        if (!config.fuzzyEnabled() || payloadKeys.contains(expected)) {
            return expected;
        }
        Set<String> exclude = new HashSet<>(declaredNames);
        exclude.remove(expected);
        exclude.addAll(claimed);
        String key = matcher.matchKey(expected, payloadKeys, exclude);
        if (!key.equals(expected)) {
            LOG.debug("Fuzzy key match: property={}, key={}", expected, key);
        }
        return key;
    }

    private RedfishElement populateElement(String path, PropertyDefinition property, JsonNode value, ValidationMode mode) {
        PropertyDefinition located = property.withPath(path);
        if (OEM.equals(property.name()) && !config.oemCheck()) {
            return PropertyEngine.populate(located, PropertyType.primitive(property.typeName(), EdmPrimitive.ANY), value, mode);
        }
        PropertyType type = types.resolvePropertyType(property);

        if (property.collection() && value.isArray()) {
            List<RedfishElement> items = new ArrayList<>(value.size());
            PropertyDefinition element = property.element();
            for (int i = 0; i < value.size(); i++) {
                items.add(populateValue(path + "[" + i + "]", element, type, value.get(i), mode));
            }
            return new RedfishCollection(located, items);
        }
        return populateValue(path, property, type, value, mode);
    }

    private RedfishElement populateValue(
            String path, PropertyDefinition property, PropertyType type, JsonNode value, ValidationMode mode) {
        if (type.kind() == PropertyType.Kind.STRUCTURED && !property.collection() && value.isObject()) {
            return populateObject(path, type.structure(), value, mode);
        }
        return PropertyEngine.populate(property.withPath(path), type, value, mode);
    }

    /**
     * The {@code @odata.type} named in the payload when it is the declared type or derived from
     * it; otherwise the declared type, or its newest concrete version when it is abstract.
     */
    private ResolvedType selectType(ResolvedType declaredType, JsonNode payload, ValidationMode mode) {
        JsonNode odataType = payload.path(ODATA_TYPE);
        if (odataType.isTextual() && !odataType.textValue().isBlank()) {
            try {
                ResolvedType named = types.getTypeInCatalog(odataType.textValue().strip().replaceFirst("^#", ""));
                if (named.isAssignableTo(declaredType.name())) {
                    return named;
                }
                LOG.debug("Ignoring {} {}: not a {}", ODATA_TYPE, odataType.textValue(), declaredType.name());
            } catch (MissingSchemaException e) {
                if (mode == ValidationMode.STRICT) {
                    throw e;
                }
                LOG.warn("Unresolvable {} {}: {}", ODATA_TYPE, odataType.textValue(), e.getMessage());
            }
        }
        return types.concreteVersionOf(declaredType);
    }
}
