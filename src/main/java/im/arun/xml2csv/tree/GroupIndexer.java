package im.arun.xml2csv.tree;

import im.arun.xml2csv.model.PathKey;
import im.arun.xml2csv.model.RepeatingGroup;
import im.arun.xml2csv.model.Selection;
import im.arun.xml2csv.model.TreeNode;
import im.arun.xml2csv.util.TreeUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Discovers repeating groups below a node that a selection has not resolved yet.
 *
 * <p>The search is depth-first: a node's own repeating groups come first, left to right,
 * then the search descends into its singleton children. By default members of a repeating
 * group are never entered, so groups nested inside a repeated element stay unresolved and
 * their leaves are left out of the rows. With deep expansion enabled the search also
 * descends into the selected member of each resolved group.
 */
public class GroupIndexer {

    private final boolean deepExpansion;

    public GroupIndexer() {
        this(false);
    }

    public GroupIndexer(boolean deepExpansion) {
        this.deepExpansion = deepExpansion;
    }

    /**
     * Next unresolved repeating group reachable from {@code node}.
     *
     * @param node       traversal root
     * @param selection  groups already resolved
     * @param pathPrefix path of {@code node}
     * @return the group, or empty when every reachable group is resolved
     */
    public Optional<RepeatingGroup> findNextUnresolvedGroup(TreeNode node, Selection selection, PathKey pathPrefix) {
        Map<String, List<TreeNode>> byTag = TreeUtils.childrenByTag(node);

        for (Map.Entry<String, List<TreeNode>> entry : byTag.entrySet()) {
            if (TreeUtils.isRepeating(byTag, entry.getKey())) {
                PathKey groupKey = pathPrefix.append(entry.getKey());
                if (!selection.isResolved(groupKey)) {
                    return Optional.of(new RepeatingGroup(groupKey, List.copyOf(entry.getValue())));
                }
            }
        }

        for (Map.Entry<String, List<TreeNode>> entry : byTag.entrySet()) {
            List<TreeNode> siblings = entry.getValue();
            PathKey childPath = pathPrefix.append(entry.getKey());
            TreeNode next = null;
            if (siblings.size() == 1) {
                next = siblings.get(0);
            } else if (deepExpansion) {
                OptionalInt index = selection.indexOf(childPath);
                if (index.isPresent() && index.getAsInt() < siblings.size()) {
                    next = siblings.get(index.getAsInt());
                }
            }
            if (next != null) {
                Optional<RepeatingGroup> found = findNextUnresolvedGroup(next, selection, childPath);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }
}
