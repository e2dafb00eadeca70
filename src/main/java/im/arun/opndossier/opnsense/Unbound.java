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
public class Unbound implements Walkable {

    @JsonProperty("enable")
    private String enable;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Enable", enable);
    }
}
