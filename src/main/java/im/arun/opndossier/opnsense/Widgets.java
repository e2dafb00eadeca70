package im.arun.opndossier.opnsense;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.opndossier.tree.FieldVisitor;
import im.arun.opndossier.tree.Walkable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard layout.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Widgets implements Walkable {

    @JsonProperty("sequence")
    private String sequence;

    @JsonProperty("column_count")
    private String columnCount;

    @Override
    public void visitFields(FieldVisitor visitor) {
        visitor.visit("Sequence", sequence);
        visitor.visit("ColumnCount", columnCount);
    }
}
