package im.arun.xml2csv.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Header and rows produced from one or more documents.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FlatTable {

    private List<String> header = new ArrayList<>();

    private List<RowRecord> rows = new ArrayList<>();

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return header.size();
    }
}
