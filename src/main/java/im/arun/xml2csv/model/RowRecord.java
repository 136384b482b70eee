package im.arun.xml2csv.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One output row: column name to value. Columns never set read as empty strings.
 */
@EqualsAndHashCode
public class RowRecord {

    private final Map<String, String> values = new LinkedHashMap<>();

    public RowRecord() {
    }

    public RowRecord(Map<String, String> initial) {
        values.putAll(initial);
    }

    /**
     * Set a column value, replacing any earlier value for that column.
     */
    public void put(String column, String value) {
        values.put(column, value);
    }

    public String get(String column) {
        return values.getOrDefault(column, "");
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public int size() {
        return values.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Values laid out in header order, blanks for absent columns.
     */
    public String[] project(List<String> header) {
        String[] line = new String[header.size()];
        for (int i = 0; i < header.size(); i++) {
            line[i] = get(header.get(i));
        }
        return line;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
