package im.arun.opndossier.tree;

/**
 * Thrown when a value has a type the classifier has no shape for. This means
 * a configuration type was not made {@link Walkable}; it is a programming
 * error, not a data error.
 */
public class UnsupportedShapeException extends IllegalArgumentException {

    private final String label;

    public UnsupportedShapeException(String label, Object value) {
        super(String.format("Cannot classify field '%s' of type %s", label, value.getClass().getName()));
        this.label = label;
    }

    public UnsupportedShapeException(String message) {
        super(message);
        this.label = null;
    }

    public String getLabel() {
        return label;
    }
}
