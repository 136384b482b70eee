package im.arun.xml2csv.tree;

import im.arun.xml2csv.model.LeafValue;
import im.arun.xml2csv.model.PathKey;
import im.arun.xml2csv.model.Selection;
import im.arun.xml2csv.model.TreeNode;
import im.arun.xml2csv.util.TreeUtils;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Projects the scalar leaves under a node for one selection.
 *
 * <p>A childless node yields its trimmed text. Singleton children are always visited; for
 * a repeating group only the member chosen by the selection is visited, and an unresolved
 * group (or an out-of-range index) contributes nothing. Text on nodes that also have
 * children is not emitted. The returned stream is lazy and depends only on its arguments.
 */
public class LeafCollector {

    /**
     * Leaves under {@code node} in document order.
     *
     * @param node      traversal root
     * @param selection resolved repeating groups
     * @param path      path of {@code node}
     */
    public Stream<LeafValue> collectLeaves(TreeNode node, Selection selection, PathKey path) {
        return collectLeaves(node, selection, path, childPath -> true);
    }

    /**
     * Leaves under {@code node}, entering only children whose path passes {@code descend}.
     * Used for container values, which leave out the row tag subtree.
     */
    public Stream<LeafValue> collectLeaves(TreeNode node, Selection selection, PathKey path,
                                           Predicate<PathKey> descend) {
        if (node.isLeaf()) {
            return Stream.of(new LeafValue(path, node.getText().strip()));
        }

        Map<String, List<TreeNode>> byTag = TreeUtils.childrenByTag(node);
        return byTag.entrySet().stream()
            .flatMap(entry -> {
                PathKey childPath = path.append(entry.getKey());
                if (!descend.test(childPath)) {
                    return Stream.empty();
                }
                List<TreeNode> siblings = entry.getValue();
                if (siblings.size() == 1) {
                    return collectLeaves(siblings.get(0), selection, childPath, descend);
                }
                OptionalInt index = selection.indexOf(childPath);
                if (index.isPresent() && index.getAsInt() < siblings.size()) {
                    return collectLeaves(siblings.get(index.getAsInt()), selection, childPath, descend);
                }
                return Stream.empty();
            });
    }
}
