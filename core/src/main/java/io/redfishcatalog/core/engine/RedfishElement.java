package io.redfishcatalog.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.Set;

/**
 * One populated node of a payload tree: a leaf {@link RedfishProperty}, a nested
 * {@link RedfishObject} or a {@link RedfishCollection}.
 */
public sealed interface RedfishElement permits RedfishProperty, RedfishObject, RedfishCollection {

    /** Property path within the populated tree, e.g. {@code Status.Health} or {@code Members[2]}. */
    String name();

    /**
     * Plain JSON form of this element. An absent element yields {@code MissingNode}, which
     * container elements omit.
     */
    JsonNode asJson();

    /** Resource links carried by this element and its descendants. */
    Set<URI> getLinks();

    /** False when this element or any descendant failed lenient coercion. */
    boolean valid();

    /** True when the payload did not contain this element. */
    boolean isAbsent();
}
