package im.arun.opndossier.util;

import im.arun.opndossier.model.DocumentNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over {@link DocumentNode} trees.
 */
public class TreeUtils {

    /**
     * Total number of nodes, the root included.
     */
    public static int countNodes(DocumentNode node) {
        int count = 1;
        for (DocumentNode child : node.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }

    /**
     * Deepest level present anywhere in the tree.
     */
    public static int maxLevel(DocumentNode node) {
        int max = node.getLevel();
        for (DocumentNode child : node.getChildren()) {
            max = Math.max(max, maxLevel(child));
        }
        return max;
    }

    /**
     * First direct child whose title contains the given fragment.
     */
    public static Optional<DocumentNode> findChild(DocumentNode node, String titleFragment) {
        return node.getChildren().stream()
            .filter(child -> child.getTitle().contains(titleFragment))
            .findFirst();
    }

    /**
     * Follow a path of title fragments down from the given node.
     * e.g. findPath(root, "Interfaces", "Items", "wan")
     */
    public static Optional<DocumentNode> findPath(DocumentNode node, String... titleFragments) {
        Optional<DocumentNode> current = Optional.of(node);
        for (String fragment : titleFragments) {
            current = current.flatMap(n -> findChild(n, fragment));
        }
        return current;
    }

    /**
     * All nodes in pre-order, i.e. the order a renderer writes them.
     */
    public static List<DocumentNode> flatten(DocumentNode root) {
        List<DocumentNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(DocumentNode node, List<DocumentNode> nodes) {
        nodes.add(node);
        for (DocumentNode child : node.getChildren()) {
            collect(child, nodes);
        }
    }
}
