package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DHCP address pool.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Range implements Walkable {

    @JsonProperty("from")
    private String from;

    @JsonProperty("to")
    private String to;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("From", from);
        visitor.visit("To", to);
    }
}
