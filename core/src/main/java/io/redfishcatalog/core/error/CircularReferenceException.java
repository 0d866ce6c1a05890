package io.redfishcatalog.core.error;

import java.util.List;

/** Thrown when a base-type chain refers back to a type already on the chain. */
public final class CircularReferenceException extends SchemaResolveException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CircularReferenceException(List<String> cycle) {
        super("Circular base type chain: " + String.join(" -> ", cycle), cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    /** The qualified names on the loop, first element repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}
