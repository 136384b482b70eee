package im.arun.xml2csv.cli;

import im.arun.xml2csv.config.ConfigLoader;
import im.arun.xml2csv.config.Xml2CsvConfig;
import im.arun.xml2csv.model.ConversionOutcome;
import im.arun.xml2csv.model.MergeResult;
import im.arun.xml2csv.service.Xml2CsvService;
import im.arun.xml2csv.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command-line interface for xml2csv using Picocli.
 */
@Command(
    name = "xml2csv",
    description = "Convert XML file(s) to CSV by flattening repeating child elements",
    mixinStandardHelpOptions = true,
    version = "xml2csv 1.0"
)
public class Xml2CsvCLI implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_PROBLEM = 1;
    static final int EXIT_BAD_CONFIG = 2;

    @Parameters(paramLabel = "<input>", description = "One or more XML files to convert", arity = "1..*")
    private List<Path> inputs;

    @Option(names = {"--merge-into"}, paramLabel = "<path>",
        description = "Combine the rows of all inputs into this single CSV file (or merged.csv inside this directory)")
    private String mergeInto;

    @Option(names = {"--output-dir"}, paramLabel = "<dir>",
        description = "Directory for the CSV files. Defaults to the directory of each input file")
    private String outputDir;

    @Option(names = {"--encoding"}, paramLabel = "<charset>", description = "Charset used to read the inputs and write the CSV "
        + "(default: each input's XML declaration, UTF-8 output)")
    private String encoding;

    @Option(names = {"--delimiter"}, paramLabel = "<char>", description = "CSV delimiter (default: ,)")
    private String delimiter;

    @Option(names = {"--keep-empty-columns"}, description = "Keep columns whose leaves are all empty")
    private boolean keepEmptyColumns;

    @Option(names = {"--deep-expansion"}, description = "Also expand repeating groups nested inside repeated elements")
    private boolean deepExpansion;

    @Option(names = {"--config"}, paramLabel = "<yaml>", description = "YAML file with default settings")
    private String configPath;

    @Option(names = {"--json-log-dir"}, paramLabel = "<dir>", description = "Write a JSON run log into this directory")
    private String jsonLogDir;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Xml2CsvConfig config;
        Xml2CsvService service;
        try {
            config = new ConfigLoader(configPath).load(userOptions());
            service = new Xml2CsvService(config);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_BAD_CONFIG;
        }

        List<Path> absoluteInputs = inputs.stream()
            .map(path -> path.toAbsolutePath().normalize())
            .collect(Collectors.toList());

        // --merge-into or a mergeInto entry in the config file
        if (config.getMergeInto() != null) {
            return merge(service, absoluteInputs, Paths.get(config.getMergeInto()), out, err);
        }

        List<ConversionOutcome> outcomes = service.convertAll(absoluteInputs);
        boolean allConverted = true;
        for (ConversionOutcome outcome : outcomes) {
            switch (outcome.getStatus()) {
                case CONVERTED:
                    out.println("Wrote: " + outcome.getOutput());
                    break;
                case SKIPPED:
                    err.println("Skipping non-existent file: " + outcome.getInput());
                    allConverted = false;
                    break;
                default:
                    err.println("Failed to convert " + outcome.getInput() + ": " + outcome.getMessage());
                    allConverted = false;
            }
        }
        out.flush();
        err.flush();
        return allConverted ? EXIT_OK : EXIT_INPUT_PROBLEM;
    }

    private int merge(Xml2CsvService service, List<Path> absoluteInputs, Path mergeTarget,
                      PrintWriter out, PrintWriter err) {
        MergeResult result;
        try {
            result = service.mergeFiles(absoluteInputs, mergeTarget);
        } catch (IOException e) {
            err.println("Failed to write merged CSV " + mergeTarget + ": " + e.getMessage());
            return EXIT_INPUT_PROBLEM;
        }

        for (ConversionOutcome outcome : result.getDocuments()) {
            if (outcome.getStatus() == ConversionOutcome.Status.SKIPPED) {
                err.println("Skipping non-existent file: " + outcome.getInput());
            } else if (outcome.getStatus() == ConversionOutcome.Status.FAILED) {
                err.println("Failed to parse " + outcome.getInput() + ": " + outcome.getMessage());
            }
        }
        out.println("Wrote merged CSV: " + result.getOutput());
        out.flush();
        err.flush();
        return result.hasProblems() ? EXIT_INPUT_PROBLEM : EXIT_OK;
    }

    /**
     * Options given on the command line, in the keys {@link ConfigLoader} understands.
     */
    Map<String, Object> userOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("delimiter", delimiter);
        options.put("encoding", encoding);
        options.put("outputDir", outputDir);
        options.put("mergeInto", mergeInto);
        options.put("jsonLogDir", jsonLogDir);
        if (keepEmptyColumns) {
            options.put("keepEmptyColumns", true);
        }
        if (deepExpansion) {
            options.put("deepExpansion", true);
        }
        return options;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new Xml2CsvCLI()).execute(args);
        } finally {
            ExecutorProvider.shutdown();
        }
        System.exit(exitCode);
    }
}
