package im.arun.xml2csv.model;

import lombok.Value;

/**
 * Trimmed text of a childless node together with its path.
 */
@Value
public class LeafValue {
    PathKey path;
    String text;

    public boolean isBlank() {
        return text.isEmpty();
    }
}
