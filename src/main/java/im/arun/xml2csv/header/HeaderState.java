package im.arun.xml2csv.header;

import im.arun.xml2csv.model.PathKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Columns of one output target in first-seen order, each bound to the path that introduced it.
 * Shared by every document written to the same target; it only ever grows. Not thread-safe:
 * documents feeding one target are processed one after another.
 */
public class HeaderState {

    private final List<String> columns = new ArrayList<>();
    private final Map<String, PathKey> pathsByColumn = new HashMap<>();
    private final Map<PathKey, String> columnsByPath = new HashMap<>();

    /**
     * Bind a new column to a path and append it to the header.
     *
     * @throws IllegalStateException if the column or the path is already bound
     */
    public void bind(String column, PathKey path) {
        if (pathsByColumn.containsKey(column)) {
            throw new IllegalStateException("Column '" + column + "' is already bound to " + pathsByColumn.get(column));
        }
        if (columnsByPath.containsKey(path)) {
            throw new IllegalStateException("Path " + path + " already owns column '" + columnsByPath.get(path) + "'");
        }
        columns.add(column);
        pathsByColumn.put(column, path);
        columnsByPath.put(path, column);
    }

    public boolean isTaken(String column) {
        return pathsByColumn.containsKey(column);
    }

    public Optional<PathKey> pathOf(String column) {
        return Optional.ofNullable(pathsByColumn.get(column));
    }

    public Optional<String> columnOf(PathKey path) {
        return Optional.ofNullable(columnsByPath.get(path));
    }

    /**
     * Header in first-seen order.
     */
    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
