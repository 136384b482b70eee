package im.arun.xml2csv.util;

import im.arun.xml2csv.model.TreeNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only helpers over {@link TreeNode}: children grouped by tag and repeat detection.
 */
public final class TreeUtils {

    private TreeUtils() {
    }

    /**
     * Group the direct children of a node by tag.
     * Tags keep their first-appearance order; children keep document order within a tag.
     */
    public static Map<String, List<TreeNode>> childrenByTag(TreeNode parent) {
        Map<String, List<TreeNode>> byTag = new LinkedHashMap<>();
        for (TreeNode child : parent.getChildren()) {
            byTag.computeIfAbsent(child.getTag(), tag -> new ArrayList<>()).add(child);
        }
        return byTag;
    }

    /**
     * First tag, in first-appearance order, shared by two or more direct children.
     */
    public static Optional<String> firstRepeatingChildTag(Map<String, List<TreeNode>> byTag) {
        return byTag.entrySet().stream()
            .filter(entry -> entry.getValue().size() > 1)
            .map(Map.Entry::getKey)
            .findFirst();
    }

    /**
     * Whether a tag occurs more than once among the direct children.
     */
    public static boolean isRepeating(Map<String, List<TreeNode>> byTag, String tag) {
        List<TreeNode> siblings = byTag.get(tag);
        return siblings != null && siblings.size() > 1;
    }

    /**
     * Number of nodes in the subtree rooted at the given node, the node itself included.
     */
    public static int countNodes(TreeNode node) {
        int count = 1;
        for (TreeNode child : node.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }
}
