package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound NAT mode (automatic, hybrid, advanced, disabled).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Outbound implements Walkable {

    @JsonProperty("mode")
    private String mode;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Mode", mode);
    }
}
