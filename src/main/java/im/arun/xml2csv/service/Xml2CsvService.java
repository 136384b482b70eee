package im.arun.xml2csv.service;

import im.arun.xml2csv.config.Xml2CsvConfig;
import im.arun.xml2csv.csv.CsvTableWriter;
import im.arun.xml2csv.header.ColumnNamer;
import im.arun.xml2csv.header.HeaderState;
import im.arun.xml2csv.model.ConversionOutcome;
import im.arun.xml2csv.model.FlatTable;
import im.arun.xml2csv.model.MergeResult;
import im.arun.xml2csv.model.RowRecord;
import im.arun.xml2csv.model.TreeNode;
import im.arun.xml2csv.tree.GroupIndexer;
import im.arun.xml2csv.tree.LeafCollector;
import im.arun.xml2csv.tree.RowLocator;
import im.arun.xml2csv.tree.SelectionExpander;
import im.arun.xml2csv.util.ExecutorProvider;
import im.arun.xml2csv.util.JsonLogger;
import im.arun.xml2csv.util.TreeUtils;
import im.arun.xml2csv.xml.XmlTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Converts XML files to CSV: one output per input, or all inputs merged into one table.
 */
public class Xml2CsvService {
    private static final Logger logger = LoggerFactory.getLogger(Xml2CsvService.class);
    static final String MERGED_FILE_NAME = "merged.csv";

    private final Xml2CsvConfig config;
    private final XmlTreeParser parser;
    private final RowAssembler rowAssembler;
    private final JsonLogger jsonLogger;

    public Xml2CsvService(Xml2CsvConfig config) {
        config.validate();
        this.config = config;
        this.parser = new XmlTreeParser();
        this.rowAssembler = new RowAssembler(
            new RowLocator(),
            new SelectionExpander(new GroupIndexer(config.isDeepExpansion())),
            new LeafCollector(),
            new ColumnNamer(config.getSuffixSeparator()),
            config.isKeepEmptyColumns());
        this.jsonLogger = new JsonLogger(config.getJsonLogDir() == null ? null : Paths.get(config.getJsonLogDir()));
    }

    /**
     * Rows of one document against a header that may be shared with other documents.
     */
    public List<RowRecord> convert(TreeNode document, HeaderState headerState) {
        return rowAssembler.assembleRows(document, headerState);
    }

    /**
     * Flatten a single document with its own header.
     */
    public FlatTable convertDocument(TreeNode document) {
        HeaderState headerState = new HeaderState();
        List<RowRecord> rows = convert(document, headerState);
        return new FlatTable(new ArrayList<>(headerState.getColumns()), rows);
    }

    /**
     * Convert one XML file to {@code <name>.csv} in the output directory, or next to the input.
     *
     * @return the written file
     * @throws IOException if the input cannot be read or parsed, or the output cannot be written
     */
    public Path convertFile(Path input) throws IOException {
        return Paths.get(writeConversion(input).getOutput());
    }

    private ConversionOutcome writeConversion(Path input) throws IOException {
        TreeNode document = parseInput(input);
        logger.debug("Parsed {} ({} nodes)", input, TreeUtils.countNodes(document));
        FlatTable table = convertDocument(document);

        Path output = resolveOutputPath(input);
        new CsvTableWriter(output, config.charset(), config.delimiterChar()).write(table.getHeader(), table.getRows());

        jsonLogger.info("document converted", Map.of(
            "input", input.toString(),
            "output", output.toString(),
            "rows", table.rowCount(),
            "columns", table.columnCount()));
        logger.info("Converted {} -> {} ({} rows, {} columns)", input, output, table.rowCount(), table.columnCount());
        return ConversionOutcome.converted(input, output, table.rowCount(), table.columnCount());
    }

    /**
     * Convert every input to its own file. Inputs share no state and run concurrently;
     * a missing or broken input is reported in its outcome and does not stop the others.
     *
     * @return one outcome per input, in input order
     */
    public List<ConversionOutcome> convertAll(List<Path> inputs) {
        ExecutorService executor = ExecutorProvider.getExecutor(config.getMaxThreads());
        logger.debug("Converting {} inputs on {} workers", inputs.size(), ExecutorProvider.getPoolSize());
        List<CompletableFuture<ConversionOutcome>> futures = inputs.stream()
            .map(input -> CompletableFuture.supplyAsync(() -> convertSafely(input), executor))
            .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return futures.stream()
            .map(CompletableFuture::join)
            .collect(Collectors.toList());
    }

    private ConversionOutcome convertSafely(Path input) {
        if (!Files.exists(input)) {
            return skipMissing(input);
        }
        try {
            return writeConversion(input);
        } catch (IOException | RuntimeException e) {
            return fail(input, e);
        }
    }

    /**
     * Merge all inputs into a single CSV with one shared header. Documents are processed in
     * input order, so column order is first-seen order across the inputs.
     *
     * @param mergeTarget target file, or a directory to hold {@value #MERGED_FILE_NAME}
     * @throws IOException if the merged file cannot be written
     */
    public MergeResult mergeFiles(List<Path> inputs, Path mergeTarget) throws IOException {
        HeaderState headerState = new HeaderState();
        List<RowRecord> mergedRows = new ArrayList<>();
        List<ConversionOutcome> outcomes = new ArrayList<>();

        for (Path input : inputs) {
            if (!Files.exists(input)) {
                outcomes.add(skipMissing(input));
                continue;
            }
            try {
                TreeNode document = parseInput(input);
                int columnsBefore = headerState.size();
                List<RowRecord> rows = convert(document, headerState);
                mergedRows.addAll(rows);
                outcomes.add(ConversionOutcome.converted(input, null, rows.size(), headerState.size() - columnsBefore));
                logger.debug("Merged {} rows from {}", rows.size(), input);
            } catch (IOException | RuntimeException e) {
                outcomes.add(fail(input, e));
            }
        }

        Path output = resolveMergePath(mergeTarget);
        new CsvTableWriter(output, config.charset(), config.delimiterChar()).write(headerState.getColumns(), mergedRows);

        MergeResult result = new MergeResult(output.toString(), mergedRows.size(), headerState.size(), outcomes);
        jsonLogger.info("merge written", Map.of(
            "output", output.toString(),
            "rows", result.getRowCount(),
            "columns", result.getColumnCount(),
            "documents", outcomes.size()));
        logger.info("Merged {} documents into {} ({} rows, {} columns)",
            outcomes.stream().filter(ConversionOutcome::isConverted).count(), output,
            result.getRowCount(), result.getColumnCount());
        return result;
    }

    /**
     * Output file for an input: same base name with a {@code .csv} extension, placed in the
     * configured output directory (created if needed) or beside the input.
     */
    public Path resolveOutputPath(Path input) throws IOException {
        Path outDir;
        if (config.getOutputDir() != null) {
            outDir = Paths.get(config.getOutputDir()).toAbsolutePath();
            Files.createDirectories(outDir);
        } else {
            outDir = input.toAbsolutePath().getParent();
        }
        return outDir.resolve(stem(input) + ".csv");
    }

    /**
     * Merge target: an existing directory gets {@value #MERGED_FILE_NAME}; parents are created.
     */
    public Path resolveMergePath(Path mergeTarget) throws IOException {
        Path target = mergeTarget.toAbsolutePath();
        if (Files.isDirectory(target)) {
            target = target.resolve(MERGED_FILE_NAME);
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return target;
    }

    public JsonLogger getJsonLogger() {
        return jsonLogger;
    }

    private TreeNode parseInput(Path input) throws IOException {
        if (config.hasExplicitEncoding()) {
            return parser.parse(input, config.charset());
        }
        return parser.parse(input);
    }

    private ConversionOutcome skipMissing(Path input) {
        logger.warn("Skipping non-existent file: {}", input);
        jsonLogger.warn("document skipped", Map.of("input", input.toString(), "reason", "not found"));
        return ConversionOutcome.skipped(input, "not found");
    }

    private ConversionOutcome fail(Path input, Exception e) {
        logger.error("Failed to convert {}: {}", input, e.getMessage());
        logger.debug("Conversion failure for {}", input, e);
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        jsonLogger.error("document failed", Map.of("input", input.toString(), "error", message));
        return ConversionOutcome.failed(input, message);
    }

    private static String stem(Path input) {
        String fileName = input.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
    }
}
