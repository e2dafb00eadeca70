package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class Nat implements Walkable {

    @JsonProperty("outbound")
    private Outbound outbound = new Outbound();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Outbound", outbound);
    }
}
