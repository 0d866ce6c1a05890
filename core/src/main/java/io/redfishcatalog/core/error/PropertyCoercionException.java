package io.redfishcatalog.core.error;

/**
 * Thrown in strict mode when a payload value does not conform to its declared kind. Lenient mode
 * never raises it.
 */
public final class PropertyCoercionException extends CatalogException {

    private static final long serialVersionUID = 1L;

    private final String expectedKind;
    private final String actualKind;
    private final String actualValue;

    public PropertyCoercionException(String property, String expectedKind, String actualKind, String actualValue) {
        super(String.format(
                        "Property '%s': expected %s but got %s value %s",
                        property, expectedKind, actualKind, actualValue),
                property,
                Phase.VALIDATION);
        this.expectedKind = expectedKind;
        this.actualKind = actualKind;
        this.actualValue = actualValue;
    }

    /** Property path, e.g. {@code Status.Health}. Same as {@link #name()}. */
    public String property() {
        return name();
    }

    public String expectedKind() {
        return expectedKind;
    }

    public String actualKind() {
        return actualKind;
    }

    /** JSON text of the offending value. */
    public String actualValue() {
        return actualValue;
    }
}
