package im.arun.opndossier.model;

import lombok.Value;

/**
 * A value paired with the label it was reached through: a record field name
 * or a container key.
 */
@Value
public class NamedValue {
    String label;
    Object value;
}
