package im.arun.opndossier.tree;

/**
 * Field-less record marking an option as switched on. Absent options are
 * represented by {@code null}.
 */
public final class PresenceFlag implements Walkable {

    public static final PresenceFlag PRESENT = new PresenceFlag();

    private PresenceFlag() {
    }

    public static PresenceFlag of(boolean enabled) {
        return enabled ? PRESENT : null;
    }

    @Override
    public void visitFields(FieldVisitor visitor) {
        // no fields
    }

    @Override
    public String toString() {
        return "PresenceFlag";
    }
}
