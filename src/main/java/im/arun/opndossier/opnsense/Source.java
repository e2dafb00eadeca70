package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.PresenceFlag;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Source implements Walkable {

    @JsonProperty("any")
    private PresenceFlag any;

    @JsonProperty("network")
    private String network;

    @JsonProperty("address")
    private String address;

    @JsonProperty("port")
    private String port;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Any", any);
        visitor.visit("Network", network);
        visitor.visit("Address", address);
        visitor.visit("Port", port);
    }
}
