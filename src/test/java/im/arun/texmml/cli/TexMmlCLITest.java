package im.arun.texmml.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

final class TexMmlCLITest {

    @TempDir
    Path dir;

    private static int run(String... args) {
        return new CommandLine(new TexMmlCLI()).execute(args);
    }

    @Test
    void convertsToJsonFile() throws IOException {
        Path source = dir.resolve("doc.tex");
        Files.writeString(source, "\\section{Hello}\nSome $x^2$ text.\\label{l}");
        Path output = dir.resolve("doc.json");

        int exitCode = run("--source", source.toString(), "--output", output.toString(), "--localization", "ru");

        assertThat(exitCode).isZero();
        JsonNode tree = new ObjectMapper().readTree(output.toFile());
        assertThat(tree.get("doc_name").asText()).isEqualTo("doc.tex");
        assertThat(tree.get("localization").asText()).isEqualTo("ru");
        assertThat(tree.get("contents").get(0).get("title").asText()).isEqualTo("Hello");
        assertThat(tree.get("references").has("l")).isTrue();
    }

    @Test
    void missingSourceFails() {
        assertThat(run("--source", dir.resolve("absent.tex").toString())).isEqualTo(1);
    }

    @Test
    void syntaxErrorFails() throws IOException {
        Path source = dir.resolve("broken.tex");
        Files.writeString(source, "$x + 1");

        assertThat(run("--source", source.toString(), "--output", dir.resolve("out.json").toString())).isEqualTo(1);
        assertThat(dir.resolve("out.json")).doesNotExist();
    }

    @Test
    void lenientImportsSkipMissingFiles() throws IOException {
        Path source = dir.resolve("main.tex");
        Files.writeString(source, "before \\input{absent} after");
        Path output = dir.resolve("main.json");

        assertThat(run("--source", source.toString(), "--output", output.toString())).isEqualTo(1);
        assertThat(run("--source", source.toString(), "--output", output.toString(), "--lenient-imports")).isZero();

        JsonNode tree = new ObjectMapper().readTree(output.toFile());
        assertThat(tree.get("diagnostics").get(0).get("kind").asText()).isEqualTo("MISSING_RESOURCE");
    }

    @Test
    void sourceOptionIsRequired() {
        assertThat(run()).isNotZero();
    }
}
