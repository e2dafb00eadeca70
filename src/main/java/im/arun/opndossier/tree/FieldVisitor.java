package im.arun.opndossier.tree;

/**
 * Receives the fields of a {@link Walkable} in declared order.
 */
@FunctionalInterface
public interface FieldVisitor {

    /**
     * @param name  schema identifier of the field, e.g. "DisableConsoleMenu"
     * @param value field value, may be null when the field is absent
     */
    void visit(String name, Object value);
}
