package im.arun.xml2csv.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "xml2csv.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Xml2CsvConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private Xml2CsvConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), Xml2CsvConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, Xml2CsvConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new Xml2CsvConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new Xml2CsvConfig();
        }
    }

    public Xml2CsvConfig load(Map<String, Object> userOptions) {
        Xml2CsvConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "delimiter":
                    config.setDelimiter(String.valueOf(value));
                    break;
                case "encoding":
                    config.setEncoding(String.valueOf(value));
                    break;
                case "output_dir":
                case "outputDir":
                    config.setOutputDir(String.valueOf(value));
                    break;
                case "merge_into":
                case "mergeInto":
                    config.setMergeInto(String.valueOf(value));
                    break;
                case "keep_empty_columns":
                case "keepEmptyColumns":
                    config.setKeepEmptyColumns(parseBoolean(value));
                    break;
                case "deep_expansion":
                case "deepExpansion":
                    config.setDeepExpansion(parseBoolean(value));
                    break;
                case "suffix_separator":
                case "suffixSeparator":
                    config.setSuffixSeparator(String.valueOf(value));
                    break;
                case "max_threads":
                case "maxThreads":
                    config.setMaxThreads(parseInt(key, value));
                    break;
                case "json_log_dir":
                case "jsonLogDir":
                    config.setJsonLogDir(String.valueOf(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    public Xml2CsvConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private int parseInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key " + key + " expects a number, got: " + value, e);
        }
    }

    private Xml2CsvConfig copyConfig(Xml2CsvConfig source) {
        Xml2CsvConfig copy = new Xml2CsvConfig();
        copy.setDelimiter(source.getDelimiter());
        copy.setEncoding(source.getEncoding());
        copy.setOutputDir(source.getOutputDir());
        copy.setMergeInto(source.getMergeInto());
        copy.setKeepEmptyColumns(source.isKeepEmptyColumns());
        copy.setDeepExpansion(source.isDeepExpansion());
        copy.setSuffixSeparator(source.getSuffixSeparator());
        copy.setMaxThreads(source.getMaxThreads());
        copy.setJsonLogDir(source.getJsonLogDir());
        return copy;
    }
}
