package im.arun.xml2csv.tree;

import im.arun.xml2csv.model.PathKey;
import im.arun.xml2csv.model.RepeatingGroup;
import im.arun.xml2csv.model.Selection;
import im.arun.xml2csv.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Expands a row element into one selection per output row, the Cartesian product of all
 * repeating groups the {@link GroupIndexer} reaches from it.
 */
public class SelectionExpander {
    private static final Logger logger = LoggerFactory.getLogger(SelectionExpander.class);

    private final GroupIndexer groupIndexer;

    public SelectionExpander(GroupIndexer groupIndexer) {
        this.groupIndexer = groupIndexer;
    }

    /**
     * Expand a row element located at {@code rowPath}.
     * Selections come out in document order: the first discovered group varies slowest.
     * A row element without nested repeating groups yields a single empty selection.
     *
     * @param rowElement the row element
     * @param rowPath    path of the row element, the prefix of every group key
     * @return finalized selections, never empty
     */
    public List<Selection> expand(TreeNode rowElement, PathKey rowPath) {
        Deque<Selection> pending = new ArrayDeque<>();
        pending.push(Selection.empty());
        List<Selection> finalized = new ArrayList<>();

        while (!pending.isEmpty()) {
            Selection partial = pending.pop();
            Optional<RepeatingGroup> next = groupIndexer.findNextUnresolvedGroup(rowElement, partial, rowPath);
            if (next.isEmpty()) {
                finalized.add(partial);
                continue;
            }
            RepeatingGroup group = next.get();
            // pushed last-to-first so index 0 is popped first
            for (int index = group.size() - 1; index >= 0; index--) {
                pending.push(partial.with(group.getKey(), index));
            }
        }

        if (finalized.size() > 1) {
            logger.debug("Row element {} expanded into {} rows", rowPath, finalized.size());
        }
        return finalized;
    }
}
