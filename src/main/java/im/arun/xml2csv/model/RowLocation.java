package im.arun.xml2csv.model;

import lombok.Value;

import java.util.List;

/**
 * Where a document's rows come from: the row parent (null when the whole document is a
 * single implicit row), the repeated row tag and the row elements in document order.
 */
@Value
public class RowLocation {
    TreeNode rowParent;
    PathKey rowParentPath;
    String rowTag;
    List<TreeNode> rowElements;

    public static RowLocation singleRow(TreeNode root) {
        return new RowLocation(null, null, root.getTag(), List.of(root));
    }

    public boolean hasRowParent() {
        return rowParent != null;
    }

    /**
     * Absolute path shared by every row element.
     */
    public PathKey rowElementPath() {
        return rowParentPath == null ? PathKey.of(rowTag) : rowParentPath.append(rowTag);
    }
}
