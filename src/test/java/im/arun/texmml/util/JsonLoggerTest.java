package im.arun.texmml.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

final class JsonLoggerTest {

    @TempDir
    Path dir;

    @Test
    void everyEntryRewritesTheLogFile() throws IOException {
        JsonLogger logger = new JsonLogger(dir.resolve("logs"), "papers/thesis.tex");

        logger.info("Starting conversion", Map.of("document", "thesis.tex"));
        logger.step(3, 14, "MoveCommandsOutOfDocument", 7, 42);

        assertThat(logger.getLogPath().getFileName().toString()).startsWith("thesis_").endsWith(".json");
        assertThat(Files.exists(logger.getLogPath())).isTrue();
        JsonNode entries = new ObjectMapper().readTree(logger.getLogPath().toFile());
        assertThat(entries.size()).isEqualTo(2);
        assertThat(entries.get(0).get("level").asText()).isEqualTo("INFO");
        assertThat(entries.get(1).get("step").asInt()).isEqualTo(3);
        assertThat(entries.get(1).get("node_count").asInt()).isEqualTo(42);
    }

    @Test
    void untitledDocumentGetsPlaceholderName() {
        JsonLogger logger = new JsonLogger(dir, null);

        logger.warn("Something odd", Map.of());

        assertThat(logger.getLogPath().getFileName().toString()).startsWith("Untitled_");
        assertThat(logger.getEntries()).hasSize(1);
    }
}
