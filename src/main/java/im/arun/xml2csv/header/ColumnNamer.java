package im.arun.xml2csv.header;

import im.arun.xml2csv.model.PathKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Chooses the column for a leaf path and records it in the header.
 *
 * <p>A path that already owns a column keeps it. Otherwise the first free candidate wins:
 * the leaf tag, then the dotted full path, then the dotted path with the smallest free
 * numeric suffix starting at 2. Distinct paths therefore never share a column.
 */
public class ColumnNamer {
    private static final Logger logger = LoggerFactory.getLogger(ColumnNamer.class);

    private final String suffixSeparator;

    public ColumnNamer() {
        this("_");
    }

    public ColumnNamer(String suffixSeparator) {
        this.suffixSeparator = suffixSeparator;
    }

    /**
     * Column name for {@code path}, binding a new one in {@code headerState} on first use.
     */
    public String name(PathKey path, HeaderState headerState) {
        Optional<String> existing = headerState.columnOf(path);
        if (existing.isPresent()) {
            return existing.get();
        }

        String column = path.leafTag();
        if (headerState.isTaken(column)) {
            String dotted = path.dotted();
            column = dotted;
            int suffix = 2;
            while (headerState.isTaken(column)) {
                column = dotted + suffixSeparator + suffix++;
            }
        }

        headerState.bind(column, path);
        logger.debug("New column '{}' for {}", column, path);
        return column;
    }
}
