package im.arun.xml2csv.config;

import lombok.Data;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

@Data
public class Xml2CsvConfig {
    private String delimiter = ",";
    // Unset: input follows its XML declaration, output is UTF-8
    private String encoding;
    private String outputDir;
    private String mergeInto;
    private boolean keepEmptyColumns = false;
    private boolean deepExpansion = false;
    private String suffixSeparator = "_";
    private int maxThreads = 8;
    private String jsonLogDir;

    public char delimiterChar() {
        return delimiter.charAt(0);
    }

    /**
     * Charset of the CSV output, UTF-8 unless an encoding is set.
     */
    public Charset charset() {
        return encoding == null ? StandardCharsets.UTF_8 : Charset.forName(encoding);
    }

    /**
     * Whether input files are decoded with {@link #charset()} instead of their own declaration.
     */
    public boolean hasExplicitEncoding() {
        return encoding != null;
    }

    /**
     * @throws IllegalArgumentException when a value cannot be used
     */
    public void validate() {
        if (delimiter == null || delimiter.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character, got: " + delimiter);
        }
        if (encoding != null) {
            try {
                Charset.forName(encoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                throw new IllegalArgumentException("Unsupported encoding: " + encoding, e);
            }
        }
        if (suffixSeparator == null) {
            throw new IllegalArgumentException("Suffix separator must be set");
        }
        if (maxThreads < 1) {
            throw new IllegalArgumentException("maxThreads must be at least 1, got: " + maxThreads);
        }
    }
}
