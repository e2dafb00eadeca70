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
public class MonitorOptions implements Walkable {

    @JsonProperty("path")
    private String path;

    @JsonProperty("host")
    private String host;

    @JsonProperty("code")
    private String code;

    @JsonProperty("send")
    private String send;

    @JsonProperty("expect")
    private String expect;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Path", path);
        visitor.visit("Host", host);
        visitor.visit("Code", code);
        visitor.visit("Send", send);
        visitor.visit("Expect", expect);
    }
}
