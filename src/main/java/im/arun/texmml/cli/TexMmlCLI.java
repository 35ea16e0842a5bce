package im.arun.texmml.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.texmml.config.ConfigLoader;
import im.arun.texmml.config.TexMmlConfig;
import im.arun.texmml.error.LatexConversionException;
import im.arun.texmml.model.DocumentTree;
import im.arun.texmml.service.ParsedDocument;
import im.arun.texmml.service.TexMmlService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface: converts one LaTeX file and writes the document tree as JSON.
 */
@Command(
    name = "texmml",
    description = "Parse a LaTeX document into the expression tree consumed by the MathML renderer",
    mixinStandardHelpOptions = true,
    version = "texmml 1.0"
)
public class TexMmlCLI implements Callable<Integer> {

    @Option(names = {"--source"}, description = "Path to the .tex file", required = true)
    private String sourcePath;

    @Option(names = {"--output"}, description = "Output JSON file path (default: standard output)")
    private String outputPath;

    @Option(names = {"--encoding"}, description = "Source file encoding")
    private String encoding;

    @Option(names = {"--timeout"}, description = "Conversion timeout in seconds")
    private Integer timeoutSeconds;

    @Option(names = {"--localization"}, description = "Localization code, e.g. en or ru")
    private String localization;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--lenient-imports"}, description = "Skip missing \\input files instead of failing")
    private boolean lenientImports;

    @Option(names = {"--json-log"}, description = "Write a structured per-step trace to the log directory")
    private boolean jsonLog;

    @Override
    public Integer call() throws Exception {
        Path source = Paths.get(sourcePath);
        if (!Files.exists(source)) {
            System.err.println("Error: source file not found: " + sourcePath);
            return 1;
        }

        // Command-line options override the configuration file
        Map<String, Object> overrides = new HashMap<>();
        if (encoding != null) {
            overrides.put("encoding", encoding);
        }
        if (timeoutSeconds != null) {
            overrides.put("timeout_seconds", timeoutSeconds);
        }
        if (localization != null) {
            overrides.put("localization", localization);
        }
        if (lenientImports) {
            overrides.put("fail_on_missing_import", false);
        }
        if (jsonLog) {
            overrides.put("json_log_enabled", true);
        }
        TexMmlConfig config = new ConfigLoader(configPath).load(overrides);

        Optional<ParsedDocument> result;
        try (TexMmlService service = new TexMmlService(config)) {
            service.setProgressListener((step, total, name) ->
                    System.err.printf("[%d/%d] %s%n", step, total, name));
            result = service.parseWithTimeout(source);
        } catch (LatexConversionException | IOException e) {
            System.err.println("Error converting document: " + e.getMessage());
            return 1;
        }
        if (result.isEmpty()) {
            System.err.println("Error: conversion timed out after " + config.getTimeoutSeconds() + " seconds");
            return 1;
        }

        DocumentTree tree = result.get().toDocumentTree();
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        String jsonOutput = mapper.writeValueAsString(tree);

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), jsonOutput);
            System.err.println("Output written to: " + outputPath);
        } else {
            System.out.println(jsonOutput);
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TexMmlCLI()).execute(args);
        System.exit(exitCode);
    }
}
