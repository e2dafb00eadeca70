package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A kernel tunable.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SysctlItem implements Walkable {

    @JsonProperty("descr")
    private String descr;

    @JsonProperty("tunable")
    private String tunable;

    @JsonProperty("value")
    private String value;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Descr", descr);
        visitor.visit("Tunable", tunable);
        visitor.visit("Value", value);
    }
}
