package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Firewall filter rules in evaluation order.
 */
@Data
@NoArgsConstructor
public class Filter implements Walkable {

    @JsonProperty("rule")
    private List<Rule> rule = new ArrayList<>();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Rule", rule);
    }
}
