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
public class Group implements Walkable {

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("scope")
    private String scope;

    @JsonProperty("gid")
    private String gid;

    @JsonProperty("member")
    private String member;

    @JsonProperty("priv")
    private String priv;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Name", name);
        visitor.visit("Description", description);
        visitor.visit("Scope", scope);
        visitor.visit("Gid", gid);
        visitor.visit("Member", member);
        visitor.visit("Priv", priv);
    }
}
