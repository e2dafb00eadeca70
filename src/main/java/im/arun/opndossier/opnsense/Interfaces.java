package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigned interfaces keyed by their logical name (wan, lan, opt1, ...).
 */
@Data
@NoArgsConstructor
public class Interfaces implements Walkable {

    @JsonProperty("items")
    private Map<String, NetworkInterface> items = new LinkedHashMap<>();

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Items", items);
    }
}
