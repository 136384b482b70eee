package im.arun.xml2csv.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured run log: accumulates one JSON entry per event and rewrites the log file after
 * every entry. Without a log directory entries are only kept in memory.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger() {
        this(null);
    }

    public JsonLogger(Path logDir) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        if (logDir == null) {
            this.logPath = null;
            return;
        }

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS"));
        Path path = logDir.resolve(String.format("xml2csv_%s.json", timestamp));
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}, JSON log disabled", logDir, e);
            path = null;
        }
        this.logPath = path;
    }

    public void info(String event, Map<String, ?> details) {
        log("INFO", event, details);
    }

    public void warn(String event, Map<String, ?> details) {
        log("WARNING", event, details);
    }

    public void error(String event, Map<String, ?> details) {
        log("ERROR", event, details);
    }

    private synchronized void log(String level, String event, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("event", event);
        if (details != null) {
            entry.putAll(details);
        }
        logData.add(entry);
        writeToFile();
    }

    private void writeToFile() {
        if (logPath == null) {
            return;
        }
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public synchronized List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(logData));
    }

    /**
     * Log file location, or null when logging to memory only.
     */
    public Path getLogPath() {
        return logPath;
    }
}
