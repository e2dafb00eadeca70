package im.arun.opndossier.tree;

/**
 * Implemented by every configuration record type so the walker can enumerate
 * its fields without reflection. A type that visits no fields is treated as
 * a presence flag.
 */
public interface Walkable {

    /**
     * Report each field, in schema order, to the given visitor.
     */
    void visitFields(FieldVisitor visitor);
}
