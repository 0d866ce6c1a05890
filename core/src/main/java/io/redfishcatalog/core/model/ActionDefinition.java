package io.redfishcatalog.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A bound {@code Action} declared in a namespace. The binding parameter (first parameter of a bound
 * action) names the type the action belongs to.
 *
 * @param qualifiedName  {@code Namespace.ActionName}, the key a payload uses after a {@code #}
 * @param boundType      type reference of the binding parameter, or {@code null} if unbound
 * @param parameterNames remaining (non-binding) parameter names in declaration order
 */
public record ActionDefinition(String qualifiedName, String boundType, List<String> parameterNames) {

    public ActionDefinition {
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        parameterNames = List.copyOf(parameterNames);
    }

    /** The action name without its namespace. */
    public String name() {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    /** The payload key under which this action is advertised, e.g. {@code #ComputerSystem.Reset}. */
    public String payloadKey() {
        String namespace = qualifiedName.substring(0, qualifiedName.lastIndexOf('.'));
        return "#" + NamespaceName.parse(namespace).baseName() + "." + name();
    }
}
