package im.arun.opndossier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * One node of the hierarchical document built from a configuration.
 * The level maps to a heading depth, the body holds inline "Label: value"
 * lines and the children hold nested sections in deterministic order.
 */
@Value
@JsonPropertyOrder({"level", "title", "body", "children"})
public class DocumentNode {

    @JsonProperty("level")
    int level;

    @JsonProperty("title")
    String title;

    @JsonProperty("body")
    List<String> body;

    @JsonProperty("children")
    List<DocumentNode> children;

    public DocumentNode(int level, String title, List<String> body, List<DocumentNode> children) {
        this.level = level;
        this.title = title;
        this.body = List.copyOf(body);
        this.children = List.copyOf(children);
    }

    /**
     * Markdown heading line for this node, e.g. "## System".
     */
    @JsonIgnore
    public String heading() {
        return "#".repeat(level) + " " + title;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }
}
