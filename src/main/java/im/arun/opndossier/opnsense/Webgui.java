package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Web GUI listener settings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Webgui implements Walkable {

    @JsonProperty("protocol")
    private String protocol;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Protocol", protocol);
    }
}
