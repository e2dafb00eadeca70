package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A firewall filter rule.
 */
@Data
@NoArgsConstructor
public class Rule implements Walkable {

    @JsonProperty("type")
    private String type;

    @JsonProperty("ipprotocol")
    private String ipProtocol;

    @JsonProperty("descr")
    private String descr;

    @JsonProperty("interface")
    private String iface;

    @JsonProperty("source")
    private Source source = new Source();

    @JsonProperty("destination")
    private Destination destination = new Destination();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Type", type);
        visitor.visit("IPProtocol", ipProtocol);
        visitor.visit("Descr", descr);
        visitor.visit("Interface", iface);
        visitor.visit("Source", source);
        visitor.visit("Destination", destination);
    }
}
