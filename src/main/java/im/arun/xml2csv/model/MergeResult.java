package im.arun.xml2csv.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of merging several documents into one table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeResult {

    @JsonProperty("output")
    private String output;

    @JsonProperty("rows")
    private int rowCount;

    @JsonProperty("columns")
    private int columnCount;

    @JsonProperty("documents")
    private List<ConversionOutcome> documents;

    public boolean hasProblems() {
        return documents.stream().anyMatch(outcome -> !outcome.isConverted());
    }
}
