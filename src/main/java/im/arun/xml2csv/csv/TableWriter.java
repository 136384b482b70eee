package im.arun.xml2csv.csv;

import im.arun.xml2csv.model.RowRecord;

import java.io.IOException;
import java.util.List;

/**
 * Sink for a finished table. Implementations keep the header order and write an empty
 * value for every column a row does not have.
 */
public interface TableWriter {

    void write(List<String> header, List<RowRecord> rows) throws IOException;
}
