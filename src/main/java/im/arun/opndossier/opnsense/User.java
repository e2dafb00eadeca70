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
public class User implements Walkable {

    @JsonProperty("name")
    private String name;

    @JsonProperty("descr")
    private String descr;

    @JsonProperty("scope")
    private String scope;

    @JsonProperty("groupname")
    private String groupname;

    @JsonProperty("password")
    private String password;

    @JsonProperty("uid")
    private String uid;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Name", name);
        visitor.visit("Descr", descr);
        visitor.visit("Scope", scope);
        visitor.visit("Groupname", groupname);
        visitor.visit("Password", password);
        visitor.visit("UID", uid);
    }
}
