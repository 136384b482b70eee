package im.arun.xml2csv.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for loading and merging configuration.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testBundledDefaults() {
        Xml2CsvConfig config = new ConfigLoader().load(null);

        assertThat(config.getDelimiter()).isEqualTo(",");
        assertThat(config.getEncoding()).isNull();
        assertThat(config.isKeepEmptyColumns()).isFalse();
        assertThat(config.isDeepExpansion()).isFalse();
        assertThat(config.getSuffixSeparator()).isEqualTo("_");
        assertThat(config.getMaxThreads()).isEqualTo(8);
        assertThat(config.getOutputDir()).isNull();
    }

    @Test
    void testUserOptionsOverrideDefaults() {
        Map<String, Object> options = new HashMap<>();
        options.put("delimiter", ";");
        options.put("output_dir", "out");
        options.put("keepEmptyColumns", true);
        options.put("deep_expansion", "yes");
        options.put("max_threads", "2");
        options.put("encoding", null);

        Xml2CsvConfig config = new ConfigLoader().load(options);

        assertThat(config.getDelimiter()).isEqualTo(";");
        assertThat(config.getOutputDir()).isEqualTo("out");
        assertThat(config.isKeepEmptyColumns()).isTrue();
        assertThat(config.isDeepExpansion()).isTrue();
        assertThat(config.getMaxThreads()).isEqualTo(2);
        assertThat(config.getEncoding()).isNull();
    }

    @Test
    void testUnknownKeysAreIgnored() {
        Xml2CsvConfig config = new ConfigLoader().load(Map.of("colour", "blue"));

        assertThat(config).isEqualTo(new ConfigLoader().getDefaultConfig());
    }

    @Test
    void testLoadDoesNotChangeDefaults() {
        ConfigLoader loader = new ConfigLoader();

        loader.load(Map.of("delimiter", "|"));

        assertThat(loader.getDefaultConfig().getDelimiter()).isEqualTo(",");
    }

    @Test
    void testConfigFileWinsOverBundledDefaults() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "delimiter: \"|\"\nsuffixSeparator: \"-\"\nmaxThreads: 3\nsomethingElse: 1\n");

        Xml2CsvConfig config = new ConfigLoader(file.toString()).load(Map.of("maxThreads", 4));

        assertThat(config.getDelimiter()).isEqualTo("|");
        assertThat(config.getSuffixSeparator()).isEqualTo("-");
        assertThat(config.getMaxThreads()).isEqualTo(4);
        assertThat(config.getEncoding()).isNull();
    }

    @Test
    void testMissingConfigFileFallsBack() {
        Xml2CsvConfig config = new ConfigLoader(tempDir.resolve("absent.yaml").toString()).load(null);

        assertThat(config.getDelimiter()).isEqualTo(",");
    }

    @Test
    void testNonNumericThreadCount() {
        assertThatThrownBy(() -> new ConfigLoader().load(Map.of("maxThreads", "many")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expects a number");
    }

    // ==================== Validation ====================

    @Test
    void testValidationRejectsBadValues() {
        Xml2CsvConfig delimiter = new Xml2CsvConfig();
        delimiter.setDelimiter("");
        Xml2CsvConfig encoding = new Xml2CsvConfig();
        encoding.setEncoding("no-such-charset");
        Xml2CsvConfig threads = new Xml2CsvConfig();
        threads.setMaxThreads(0);

        assertThatThrownBy(delimiter::validate).hasMessageStartingWith("Delimiter must be a single character");
        assertThatThrownBy(encoding::validate).hasMessage("Unsupported encoding: no-such-charset");
        assertThatThrownBy(threads::validate).hasMessageContaining("maxThreads");
    }

    @Test
    void testDefaultsAreValid() {
        Xml2CsvConfig config = new Xml2CsvConfig();

        config.validate();

        assertThat(config.delimiterChar()).isEqualTo(',');
        assertThat(config.charset().name()).isEqualTo("UTF-8");
        assertThat(config.hasExplicitEncoding()).isFalse();
    }

    @Test
    void testEncodingAndMergeTargetFromConfigFile() throws IOException {
        Path file = tempDir.resolve("merge.yaml");
        Files.writeString(file, "encoding: \"ISO-8859-1\"\nmergeInto: \"out/all.csv\"\n");

        Xml2CsvConfig config = new ConfigLoader(file.toString()).load(Map.of());

        assertThat(config.getMergeInto()).isEqualTo("out/all.csv");
        assertThat(config.hasExplicitEncoding()).isTrue();
        assertThat(config.charset().name()).isEqualTo("ISO-8859-1");
    }
}
