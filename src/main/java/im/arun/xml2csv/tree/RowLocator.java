package im.arun.xml2csv.tree;

import im.arun.xml2csv.model.PathKey;
import im.arun.xml2csv.model.RowLocation;
import im.arun.xml2csv.model.TreeNode;
import im.arun.xml2csv.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the element that defines one output row.
 * Breadth-first from the root, the first node with a repeated child tag becomes the row
 * parent and that tag the row tag, so the shallowest repetition wins over deeper ones.
 */
public class RowLocator {
    private static final Logger logger = LoggerFactory.getLogger(RowLocator.class);

    /**
     * Locate the row parent, row tag and row elements of a document.
     * Without any repeated tag the root itself is the only row.
     *
     * @param root document root
     * @return the row location, never null
     */
    public RowLocation locate(TreeNode root) {
        Deque<Visit> queue = new ArrayDeque<>();
        queue.add(new Visit(root, PathKey.of(root.getTag())));

        while (!queue.isEmpty()) {
            Visit visit = queue.poll();
            Map<String, List<TreeNode>> byTag = TreeUtils.childrenByTag(visit.node);
            Optional<String> rowTag = TreeUtils.firstRepeatingChildTag(byTag);

            if (rowTag.isPresent()) {
                List<TreeNode> rowElements = byTag.get(rowTag.get());
                logger.debug("Row tag '{}' under {} ({} elements)", rowTag.get(), visit.path, rowElements.size());
                return new RowLocation(visit.node, visit.path, rowTag.get(), List.copyOf(rowElements));
            }

            for (TreeNode child : visit.node.getChildren()) {
                queue.add(new Visit(child, visit.path.append(child.getTag())));
            }
        }

        logger.debug("No repeated tag below <{}>, treating the document as a single row", root.getTag());
        return RowLocation.singleRow(root);
    }

    private static final class Visit {
        private final TreeNode node;
        private final PathKey path;

        private Visit(TreeNode node, PathKey path) {
            this.node = node;
            this.path = path;
        }
    }
}
