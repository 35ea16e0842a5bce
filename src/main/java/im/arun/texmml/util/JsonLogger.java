package im.arun.texmml.util;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates structured trace entries for one document and rewrites them as a JSON
 * array to {@code <logDirectory>/<docname>_<timestamp>.json} after every entry.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private final Path logPath;
    private final List<Object> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger(Path logDirectory, String documentPath) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        String docName = extractDocumentName(documentPath);
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("%s_%s.json", docName, timestamp);

        try {
            Files.createDirectories(logDirectory);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", logDirectory, e);
        }

        this.logPath = logDirectory.resolve(logFileName);
    }

    private String extractDocumentName(String documentPath) {
        if (documentPath == null) {
            return "Untitled";
        }

        Path fileName = Path.of(documentPath).getFileName();
        String name = fileName == null ? documentPath : fileName.toString();

        int dotIndex = name.lastIndexOf('.');
        if (dotIndex > 0) {
            name = name.substring(0, dotIndex);
        }

        return name.replaceAll("[/\\\\]", "-");
    }

    public void info(String message) {
        log("INFO", message, Map.of());
    }

    public void info(String message, Map<String, ?> details) {
        log("INFO", message, details);
    }

    public void warn(String message, Map<String, ?> details) {
        log("WARNING", message, details);
    }

    public void error(String message, Map<String, ?> details) {
        log("ERROR", message, details);
    }

    /** One entry per pipeline step. */
    public void step(int step, int total, String passName, long elapsedMillis, int nodeCount) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("step", step);
        details.put("total", total);
        details.put("pass", passName);
        details.put("elapsed_ms", elapsedMillis);
        details.put("node_count", nodeCount);
        log("INFO", "Pipeline step", details);
    }

    private void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        entry.putAll(details);
        logData.add(entry);

        writeToFile();
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public Path getLogPath() {
        return logPath;
    }

    public List<Object> getEntries() {
        return logData;
    }
}
