package im.arun.opndossier.tree;

import im.arun.opndossier.config.WalkerConfig;
import im.arun.opndossier.model.DocumentNode;
import im.arun.opndossier.model.NamedValue;
import im.arun.opndossier.model.Shape;
import im.arun.opndossier.model.ShapeDecision;
import im.arun.opndossier.util.LabelFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link DocumentNode} tree from any {@link Walkable} configuration.
 *
 * <p>Inline fields (non-empty scalars and presence flags) become
 * {@code "Label: value"} body lines on the node of the record that holds
 * them. Records, non-empty sequences and non-empty maps become child nodes
 * one level deeper. Sequence elements are titled {@code [i]} and map entries
 * are titled with their key, in sorted key order.
 *
 * <p>No node is created above the configured depth ceiling; structured values
 * below it are dropped. That ceiling is also what terminates walks over
 * cyclic object graphs.
 *
 * <p>Instances hold no per-walk state and may be shared between threads.
 */
public class DocumentWalker {
    private static final Logger logger = LoggerFactory.getLogger(DocumentWalker.class);

    private final ValueClassifier classifier;
    private final String rootTitle;
    private final int maxDepth;

    public DocumentWalker(WalkerConfig config) {
        this(new ValueClassifier(config), config);
    }

    public DocumentWalker(ValueClassifier classifier, WalkerConfig config) {
        this.classifier = classifier;
        this.rootTitle = config.getRootTitle();
        this.maxDepth = config.effectiveMaxDepth();
    }

    /**
     * Walk a whole configuration. The root node is level 1 and carries the
     * configured root title.
     *
     * @throws UnsupportedShapeException if the root is not a record, or a
     *                                   value somewhere has no known shape
     */
    public DocumentNode walk(Object root) {
        ShapeDecision decision = classifier.classify(rootTitle, root);
        if (decision.getShape() != Shape.RECORD) {
            throw new UnsupportedShapeException(
                "Configuration root must be a record with fields, got " + decision.getShape());
        }
        return build(rootTitle, 1, decision);
    }

    /**
     * Build the node for an already classified structured value.
     */
    DocumentNode build(String title, int level, ShapeDecision decision) {
        List<String> body = new ArrayList<>();
        List<DocumentNode> children = new ArrayList<>();

        switch (decision.getShape()) {
            case RECORD:
                addFields(decision.getFields(), level, body, children);
                break;
            case ORDERED_SEQUENCE:
                addElements(decision, level, children);
                break;
            case KEY_VALUE_CONTAINER:
                addEntries(decision, level, children);
                break;
            default:
                throw new IllegalArgumentException("Not a structured shape: " + decision.getShape());
        }

        return new DocumentNode(level, title, body, children);
    }

    private void addFields(List<NamedValue> fields, int level, List<String> body, List<DocumentNode> children) {
        for (NamedValue field : fields) {
            ShapeDecision decision = classifier.classify(field.getLabel(), field.getValue());
            String label = LabelFormatter.formatLabel(field.getLabel());

            if (decision.isInline()) {
                body.add(label + ": " + classifier.inlineText(decision));
            } else if (decision.isStructured()) {
                if (level < maxDepth) {
                    children.add(build(label, level + 1, decision));
                } else {
                    logTruncation(label, level);
                }
            }
        }
    }

    private void addElements(ShapeDecision sequence, int level, List<DocumentNode> children) {
        if (level >= maxDepth) {
            logTruncation(sequence.getLabel(), level);
            return;
        }
        List<Object> elements = sequence.getElements();
        for (int i = 0; i < elements.size(); i++) {
            String title = LabelFormatter.formatIndex(i);
            children.add(member(title, level + 1, elements.get(i)));
        }
    }

    private void addEntries(ShapeDecision container, int level, List<DocumentNode> children) {
        if (level >= maxDepth) {
            logTruncation(container.getLabel(), level);
            return;
        }
        for (NamedValue entry : container.getFields()) {
            children.add(member(entry.getLabel(), level + 1, entry.getValue()));
        }
    }

    /**
     * Node for one sequence element or map entry. Inline members get a node
     * whose only body line is the bare value; absent, zero and empty members
     * get a node with an empty body, so every index and key keeps its node.
     */
    private DocumentNode member(String title, int level, Object value) {
        ShapeDecision decision = classifier.classify(title, value);
        if (decision.isStructured()) {
            return build(title, level, decision);
        }
        List<String> body = decision.isInline() ? List.of(classifier.inlineText(decision)) : List.of();
        return new DocumentNode(level, title, body, List.of());
    }

    private void logTruncation(String label, int level) {
        if (logger.isTraceEnabled()) {
            logger.trace("Depth ceiling {} reached at level {}, not expanding '{}'", maxDepth, level, label);
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
