package im.arun.texmml.service;

import im.arun.texmml.bibliography.BibliographyAttacher;
import im.arun.texmml.bibliography.BibtexParser;
import im.arun.texmml.config.TexMmlConfig;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.outline.SectionOutlineCollector;
import im.arun.texmml.rewrite.AlgorithmPreprocessor;
import im.arun.texmml.rewrite.BaselessScriptSimplifier;
import im.arun.texmml.rewrite.BlockNumberer;
import im.arun.texmml.rewrite.CustomCommandExpander;
import im.arun.texmml.rewrite.EnvironmentEncapsulator;
import im.arun.texmml.rewrite.ImportIncluder;
import im.arun.texmml.rewrite.LabelResolver;
import im.arun.texmml.rewrite.ListGrouper;
import im.arun.texmml.rewrite.MetadataHoister;
import im.arun.texmml.rewrite.ParagraphGrouper;
import im.arun.texmml.rewrite.RewritePass;
import im.arun.texmml.rewrite.ScriptGrouper;
import im.arun.texmml.rewrite.TablePostParser;
import im.arun.texmml.tree.ExpressionTreeBuilder;
import im.arun.texmml.tree.TreeUtils;
import im.arun.texmml.util.JsonLogger;
import im.arun.texmml.verification.TreeVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the conversion pipeline for one document: build the tree, apply the rewrite
 * passes in order, attach the bibliography, then collect the outline and verify.
 */
public class TexMmlService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TexMmlService.class);

    public static final String CREATE_ROOT = "CreateRoot";
    public static final int TOTAL_STEPS = 14;

    private final TexMmlConfig config;
    private final ExpressionTreeBuilder builder;
    private final List<RewritePass> passes;
    private final SectionOutlineCollector outlineCollector;
    private final TreeVerifier treeVerifier;

    private ProgressListener progressListener = ProgressListener.NONE;
    private ConversionWorkers workers;

    public TexMmlService(TexMmlConfig config) {
        this.config = config;
        this.builder = new ExpressionTreeBuilder();
        this.passes = List.of(
                new ImportIncluder(builder, config.isFailOnMissingImport()),
                new CustomCommandExpander(builder, config.getMaxMacroExpansionDepth()),
                new MetadataHoister(),
                new EnvironmentEncapsulator(),
                new TablePostParser(),
                new ScriptGrouper(),
                new ListGrouper(),
                new ParagraphGrouper(),
                new BaselessScriptSimplifier(),
                new BlockNumberer(),
                new LabelResolver(),
                new AlgorithmPreprocessor(),
                new BibliographyAttacher(new BibtexParser(builder), config.isFailOnMissingBibliography()));
        this.outlineCollector = new SectionOutlineCollector();
        this.treeVerifier = new TreeVerifier();
    }

    public void setProgressListener(ProgressListener progressListener) {
        this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
    }

    /** The passes run after the tree is created, in order. */
    public List<RewritePass> getPasses() {
        return passes;
    }

    public ParsedDocument parseDocument(Path sourcePath) throws IOException {
        String source = Files.readString(sourcePath, charset());
        return parseText(source, sourcePath);
    }

    /**
     * Converts {@code source}. {@code sourcePath} is used to name the document and to
     * resolve imports and the bibliography; it may be null for in-memory text.
     */
    public ParsedDocument parseText(String source, Path sourcePath) {
        String docName = documentName(sourcePath);
        ConversionContext context = new ConversionContext(sourcePath, config.getLocalization(), charset());
        JsonLogger jsonLogger = config.isJsonLogEnabled()
                ? new JsonLogger(Path.of(config.getLogDirectory()), docName)
                : null;

        logger.info("Converting {}", docName);
        if (jsonLogger != null) {
            jsonLogger.info("Starting conversion", Map.of("document", docName));
        }

        try {
            Expression root = runPipeline(source, docName, context, jsonLogger);
            logger.info("Converted {} with {} diagnostic(s)", docName, context.getDiagnostics().size());
            if (jsonLogger != null) {
                for (Diagnostic diagnostic : context.getDiagnostics()) {
                    jsonLogger.warn("Diagnostic", Map.of(
                            "kind", diagnostic.getKind(),
                            "name", String.valueOf(diagnostic.getName()),
                            "detail", String.valueOf(diagnostic.getDetail()),
                            "line", diagnostic.getLine()));
                }
                jsonLogger.info("Conversion complete");
            }
            return new ParsedDocument(docName, root, context);
        } catch (RuntimeException e) {
            if (jsonLogger != null) {
                jsonLogger.error("Conversion failed", Map.of(
                        "exception", e.getClass().getSimpleName(),
                        "error", String.valueOf(e.getMessage())));
            }
            throw e;
        }
    }

    private Expression runPipeline(String source, String docName, ConversionContext context, JsonLogger jsonLogger) {
        // Build the tree
        long started = System.currentTimeMillis();
        Expression root = builder.parseDocument(source, docName);
        finishStep(1, CREATE_ROOT, started, root, jsonLogger);

        // Rewrite passes
        int step = 2;
        for (RewritePass pass : passes) {
            started = System.currentTimeMillis();
            pass.apply(root, context);
            finishStep(step++, pass.getName(), started, root, jsonLogger);
        }

        // Outline for the table of contents
        outlineCollector.collect(root, context);

        // Verify before handing the tree to the renderer
        if (config.isVerifyTree()) {
            TreeVerifier.VerificationResult result = treeVerifier.verify(root, context);
            if (jsonLogger != null) {
                jsonLogger.info("Verification result", Map.of(
                        "node_count", result.nodeCount,
                        "diagnostic_count", result.diagnostics.size()));
            }
        }
        return root;
    }

    /**
     * Runs {@link #parseDocument(Path)} on a conversion worker. A conversion that does not
     * finish within the configured timeout is abandoned and reported as an empty result.
     */
    public Optional<ParsedDocument> parseWithTimeout(Path sourcePath) throws IOException {
        return workers().convert(documentName(sourcePath), () -> parseDocument(sourcePath));
    }

    private synchronized ConversionWorkers workers() {
        if (workers == null) {
            workers = new ConversionWorkers(ConversionWorkers.defaultThreads(),
                    Duration.ofSeconds(config.getTimeoutSeconds()));
        }
        return workers;
    }

    @Override
    public synchronized void close() {
        if (workers != null) {
            workers.close();
            workers = null;
        }
    }

    private static String documentName(Path sourcePath) {
        return sourcePath == null || sourcePath.getFileName() == null
                ? "document"
                : sourcePath.getFileName().toString();
    }

    private void finishStep(int step, String name, long started, Expression root, JsonLogger jsonLogger) {
        long elapsed = System.currentTimeMillis() - started;
        logger.debug("[{}/{}] {} done in {} ms", step, TOTAL_STEPS, name, elapsed);
        if (jsonLogger != null) {
            jsonLogger.step(step, TOTAL_STEPS, name, elapsed, TreeUtils.countNodes(root));
        }
        progressListener.onStep(step, TOTAL_STEPS, name);
    }

    private Charset charset() {
        return Charset.forName(config.getEncoding());
    }
}
