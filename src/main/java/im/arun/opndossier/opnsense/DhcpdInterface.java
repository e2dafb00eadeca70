package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DhcpdInterface implements Walkable {

    @JsonProperty("enable")
    private String enable;

    @JsonProperty("range")
    private Range range = new Range();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Enable", enable);
        visitor.visit("Range", range);
    }
}
