package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Ntpd implements Walkable {

    @JsonProperty("prefer")
    private String prefer;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Prefer", prefer);
    }
}
