package im.arun.xml2csv.service;

import im.arun.xml2csv.header.ColumnNamer;
import im.arun.xml2csv.header.HeaderState;
import im.arun.xml2csv.model.LeafValue;
import im.arun.xml2csv.model.PathKey;
import im.arun.xml2csv.model.RowLocation;
import im.arun.xml2csv.model.RowRecord;
import im.arun.xml2csv.model.Selection;
import im.arun.xml2csv.model.TreeNode;
import im.arun.xml2csv.tree.GroupIndexer;
import im.arun.xml2csv.tree.LeafCollector;
import im.arun.xml2csv.tree.RowLocator;
import im.arun.xml2csv.tree.SelectionExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one document into rows against a header that may be shared with other documents.
 *
 * <p>Per row element the container values (leaves of the row parent outside the row tag
 * subtree) are named first, then each selection of the row element contributes its own
 * leaves. Row values are written after container values, so they win on a shared column.
 */
public class RowAssembler {
    private static final Logger logger = LoggerFactory.getLogger(RowAssembler.class);

    private final RowLocator rowLocator;
    private final SelectionExpander selectionExpander;
    private final LeafCollector leafCollector;
    private final ColumnNamer columnNamer;
    private final boolean keepEmptyColumns;

    public RowAssembler() {
        this(new RowLocator(), new SelectionExpander(new GroupIndexer()), new LeafCollector(), new ColumnNamer(), false);
    }

    public RowAssembler(RowLocator rowLocator,
                        SelectionExpander selectionExpander,
                        LeafCollector leafCollector,
                        ColumnNamer columnNamer,
                        boolean keepEmptyColumns) {
        this.rowLocator = rowLocator;
        this.selectionExpander = selectionExpander;
        this.leafCollector = leafCollector;
        this.columnNamer = columnNamer;
        this.keepEmptyColumns = keepEmptyColumns;
    }

    /**
     * Rows of {@code document}. New columns are appended to {@code headerState}.
     *
     * @param document    parsed document root
     * @param headerState header of the output target, shared across merged documents
     * @return this document's rows in document order
     */
    public List<RowRecord> assembleRows(TreeNode document, HeaderState headerState) {
        RowLocation location = rowLocator.locate(document);
        PathKey rowPath = location.rowElementPath();
        int columnsBefore = headerState.size();

        List<RowRecord> rows = new ArrayList<>();
        for (TreeNode rowElement : location.getRowElements()) {
            Map<String, String> containerValues = containerValues(location, headerState);

            for (Selection selection : selectionExpander.expand(rowElement, rowPath)) {
                RowRecord row = new RowRecord(containerValues);
                leafCollector.collectLeaves(rowElement, selection, rowPath)
                    .forEach(leaf -> record(leaf, row, headerState));
                rows.add(row);
            }
        }

        logger.debug("Assembled {} rows from {} <{}> elements, {} new columns",
            rows.size(), location.getRowElements().size(), location.getRowTag(), headerState.size() - columnsBefore);
        return rows;
    }

    /**
     * Named scalar values of the row parent, the row tag subtree and unresolved groups excluded.
     */
    private Map<String, String> containerValues(RowLocation location, HeaderState headerState) {
        Map<String, String> values = new LinkedHashMap<>();
        if (!location.hasRowParent()) {
            return values;
        }
        PathKey rowPath = location.rowElementPath();
        leafCollector.collectLeaves(location.getRowParent(), Selection.empty(), location.getRowParentPath(),
                childPath -> !childPath.equals(rowPath))
            .forEach(leaf -> {
                if (leaf.isBlank()) {
                    if (keepEmptyColumns) {
                        columnNamer.name(leaf.getPath(), headerState);
                    }
                    return;
                }
                values.put(columnNamer.name(leaf.getPath(), headerState), leaf.getText());
            });
        return values;
    }

    private void record(LeafValue leaf, RowRecord row, HeaderState headerState) {
        if (leaf.isBlank()) {
            if (keepEmptyColumns) {
                columnNamer.name(leaf.getPath(), headerState);
            }
            return;
        }
        row.put(columnNamer.name(leaf.getPath(), headerState), leaf.getText());
    }
}
