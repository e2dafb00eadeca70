package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DHCP server settings per interface.
 */
@Data
@NoArgsConstructor
public class Dhcpd implements Walkable {

    @JsonProperty("lan")
    private DhcpdInterface lan = new DhcpdInterface();

    @JsonProperty("wan")
    private DhcpdInterface wan = new DhcpdInterface();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Lan", lan);
        visitor.visit("Wan", wan);
    }
}
