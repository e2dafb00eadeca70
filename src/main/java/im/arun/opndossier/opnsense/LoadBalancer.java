package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class LoadBalancer implements Walkable {

    @JsonProperty("monitor_type")
    private List<MonitorType> monitorType = new ArrayList<>();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("MonitorType", monitorType);
    }
}
