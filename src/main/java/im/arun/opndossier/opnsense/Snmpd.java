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
public class Snmpd implements Walkable {

    @JsonProperty("syslocation")
    private String sysLocation;

    @JsonProperty("syscontact")
    private String sysContact;

    @JsonProperty("rocommunity")
    private String roCommunity;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("SysLocation", sysLocation);
        visitor.visit("SysContact", sysContact);
        visitor.visit("ROCommunity", roCommunity);
    }
}
