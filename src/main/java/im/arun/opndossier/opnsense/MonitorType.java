package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health check used by load balancer pools.
 */
@Data
@NoArgsConstructor
public class MonitorType implements Walkable {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("descr")
    private String descr;

    @JsonProperty("options")
    private MonitorOptions options = new MonitorOptions();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Name", name);
        visitor.visit("Type", type);
        visitor.visit("Descr", descr);
        visitor.visit("Options", options);
    }
}
