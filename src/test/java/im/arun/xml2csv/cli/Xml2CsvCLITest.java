package im.arun.xml2csv.cli;

import im.arun.xml2csv.util.ExecutorProvider;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the command line front end.
 */
public class Xml2CsvCLITest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Xml2CsvCLI cli;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = new Xml2CsvCLI();
        commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterAll
    static void shutdownExecutor() {
        ExecutorProvider.shutdown();
    }

    @Test
    void testConvertsEachInput() throws IOException {
        Path first = fixture("shipment-1.xml");
        Path second = fixture("shipment-2.xml");

        int exitCode = commandLine.execute(first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(Xml2CsvCLI.EXIT_OK);
        assertThat(out.toString())
            .contains("Wrote: " + tempDir.resolve("shipment-1.csv"))
            .contains("Wrote: " + tempDir.resolve("shipment-2.csv"));
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testMissingAndBrokenInputsGiveInputProblem() throws IOException {
        Path good = fixture("shipment-1.xml");
        Path broken = fixture("broken.xml");
        Path missing = tempDir.resolve("missing.xml");

        int exitCode = commandLine.execute(good.toString(), missing.toString(), broken.toString());

        assertThat(exitCode).isEqualTo(Xml2CsvCLI.EXIT_INPUT_PROBLEM);
        assertThat(err.toString())
            .contains("Skipping non-existent file: " + missing)
            .contains("Failed to convert " + broken + ": Malformed XML");
        assertThat(tempDir.resolve("shipment-1.csv")).exists();
    }

    @Test
    void testOptionsReachTheOutput() throws IOException {
        Path input = fixture("shipment-2.xml");
        Path outDir = tempDir.resolve("csv");

        int exitCode = commandLine.execute("--delimiter", ";", "--output-dir", outDir.toString(), input.toString());

        assertThat(exitCode).isEqualTo(Xml2CsvCLI.EXIT_OK);
        assertThat(Files.readAllLines(outDir.resolve("shipment-2.csv")).get(0)).isEqualTo("carrier;id;name;sku;qty;note");
    }

    @Test
    void testBadDelimiterIsConfigError() throws IOException {
        Path input = fixture("shipment-1.xml");

        int exitCode = commandLine.execute("--delimiter", "::", input.toString());

        assertThat(exitCode).isEqualTo(Xml2CsvCLI.EXIT_BAD_CONFIG);
        assertThat(err.toString()).contains("Error: Delimiter must be a single character");
        assertThat(tempDir.resolve("shipment-1.csv")).doesNotExist();
    }

    @Test
    void testMergeMode() throws IOException {
        Path first = fixture("shipment-1.xml");
        Path second = fixture("shipment-2.xml");
        Path target = tempDir.resolve("merged/all.csv");

        int exitCode = commandLine.execute("--merge-into", target.toString(), first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(Xml2CsvCLI.EXIT_OK);
        assertThat(out.toString()).contains("Wrote merged CSV: " + target.toAbsolutePath());
        assertThat(Files.readAllLines(target)).hasSize(6);
    }

    @Test
    void testMergeReportsBrokenInput() throws IOException {
        Path broken = fixture("broken.xml");
        Path good = fixture("shipment-1.xml");

        int exitCode = commandLine.execute("--merge-into", tempDir.toString(), broken.toString(), good.toString());

        assertThat(exitCode).isEqualTo(Xml2CsvCLI.EXIT_INPUT_PROBLEM);
        assertThat(err.toString()).contains("Failed to parse " + broken);
        assertThat(tempDir.resolve("merged.csv")).exists();
    }

    @Test
    void testMergeTargetFromConfigFile() throws IOException {
        Path first = fixture("shipment-1.xml");
        Path second = fixture("shipment-2.xml");
        Path merged = tempDir.resolve("merged-out.csv");
        Path configFile = tempDir.resolve("xml2csv.yaml");
        Files.writeString(configFile, "mergeInto: \"" + merged.toString().replace("\\", "/") + "\"\n");

        int exitCode = commandLine.execute("--config", configFile.toString(), first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(Xml2CsvCLI.EXIT_OK);
        assertThat(out.toString()).contains("Wrote merged CSV: ");
        assertThat(merged).exists();
        assertThat(Files.readAllLines(merged)).hasSize(6);
        assertThat(tempDir.resolve("shipment-1.csv")).doesNotExist();
    }

    @Test
    void testNoInputsIsUsageError() {
        int exitCode = commandLine.execute();

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("<input>");
    }

    @Test
    void testUserOptionsOnlyCarryFlagsThatWereSet() {
        commandLine.parseArgs("--keep-empty-columns", "--encoding", "ISO-8859-1", "in.xml");

        Map<String, Object> options = cli.userOptions();

        assertThat(options).containsEntry("keepEmptyColumns", true)
            .containsEntry("encoding", "ISO-8859-1")
            .doesNotContainKey("deepExpansion");
        assertThat(options.get("delimiter")).isNull();
    }

    private Path fixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/xml/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }
}
