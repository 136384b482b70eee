package im.arun.xml2csv.csv;

import com.opencsv.CSVWriter;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import im.arun.xml2csv.model.RowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a table as delimited text using OpenCSV. Fields are quoted only when they contain
 * the separator, a quote or a line break.
 */
public class CsvTableWriter implements TableWriter {
    private static final Logger logger = LoggerFactory.getLogger(CsvTableWriter.class);

    private final Path target;
    private final Charset charset;
    private final char separator;

    public CsvTableWriter(Path target, Charset charset, char separator) {
        this.target = target;
        this.charset = charset;
        this.separator = separator;
    }

    @Override
    public void write(List<String> header, List<RowRecord> rows) throws IOException {
        try (Writer out = Files.newBufferedWriter(target, charset)) {
            write(out, header, rows);
        }
        logger.debug("Wrote {} rows x {} columns to {}", rows.size(), header.size(), target);
    }

    /**
     * Write to an already open writer; the writer is flushed but not closed.
     */
    public void write(Writer out, List<String> header, List<RowRecord> rows) throws IOException {
        ICSVWriter csv = new CSVWriterBuilder(out)
            .withSeparator(separator)
            .withQuoteChar(CSVWriter.DEFAULT_QUOTE_CHARACTER)
            .withEscapeChar(CSVWriter.DEFAULT_ESCAPE_CHARACTER)
            .withLineEnd(CSVWriter.DEFAULT_LINE_END)
            .build();
        csv.writeNext(header.toArray(new String[0]), false);
        for (RowRecord row : rows) {
            csv.writeNext(row.project(header), false);
        }
        csv.flush();
        if (csv.checkError()) {
            throw new IOException("Failed to write CSV to " + target);
        }
    }

    public Path getTarget() {
        return target;
    }
}
