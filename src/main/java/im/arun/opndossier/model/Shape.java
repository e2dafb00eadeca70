package im.arun.opndossier.model;

/**
 * Structural kind of a configuration value, used to decide whether it is
 * written inline on its parent or expanded into a child node.
 */
public enum Shape {
    SCALAR,
    /** Zero-field record used as a presence flag. */
    EMPTY_MARKER,
    /** Absent nullable value. Present values are classified by their content. */
    OPTIONAL,
    RECORD,
    ORDERED_SEQUENCE,
    KEY_VALUE_CONTAINER;

    public boolean isInline() {
        return this == SCALAR || this == EMPTY_MARKER;
    }

    public boolean isStructured() {
        return this == RECORD || this == ORDERED_SEQUENCE || this == KEY_VALUE_CONTAINER;
    }
}
