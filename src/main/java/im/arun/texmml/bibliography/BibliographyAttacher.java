package im.arun.texmml.bibliography;

import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.error.ResourceException;
import im.arun.texmml.model.BibliographyRecord;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.rewrite.ImportIncluder;
import im.arun.texmml.rewrite.RewritePass;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the files named by the first {@code \bibliography} command into the context
 * and tags every {@code \cite} with the list of keys it cites.
 */
public class BibliographyAttacher implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(BibliographyAttacher.class);

    private final BibtexParser parser;
    private final boolean failOnMissingBibliography;

    public BibliographyAttacher(BibtexParser parser, boolean failOnMissingBibliography) {
        this.parser = parser;
        this.failOnMissingBibliography = failOnMissingBibliography;
    }

    @Override
    public String getName() {
        return "AttachBibliography";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        Optional<Expression> command = TreeUtils.collect(root, node -> node.isCommand("bibliography"))
                .stream()
                .findFirst();
        command.ifPresent(bibliography -> attach(bibliography, context));

        for (Expression cite : TreeUtils.collect(root, node -> node.isCommand("cite"))) {
            List<String> keys = splitNames(TreeUtils.argumentText(cite, 0));
            cite.setTag(keys);
            for (String key : keys) {
                if (context.findCitation(key).isEmpty()) {
                    logger.warn("Citation '{}' at line {} is not in the bibliography", key, cite.getLine());
                    context.report(Diagnostic.Kind.UNDEFINED_CITATION, key, "no bibliography record",
                            cite.getLine());
                }
            }
        }
    }

    private void attach(Expression command, ConversionContext context) {
        for (String name : splitNames(TreeUtils.argumentText(command, 0))) {
            Path path = resolve(context.getSourceDirectory(), name);
            String text;
            try {
                text = Files.readString(path, context.getEncoding());
            } catch (NoSuchFileException e) {
                skipOrFail(command, context, path, "Bibliography file not found", e);
                continue;
            } catch (IOException e) {
                skipOrFail(command, context, path, "Failed to read bibliography file", e);
                continue;
            }
            int firstNumber = context.getBibliography().size() + 1;
            Map<String, BibliographyRecord> records = parser.parse(text, path.getFileName().toString(), firstNumber);
            context.attachBibliography(records);
            logger.info("Attached {} bibliography record(s) from {}", records.size(), path);
        }
    }

    private void skipOrFail(Expression command, ConversionContext context, Path path, String message,
                            IOException cause) {
        if (failOnMissingBibliography) {
            throw new ResourceException(message, path, cause);
        }
        logger.warn("{}: {}, continuing without it", message, path);
        context.report(Diagnostic.Kind.MISSING_RESOURCE, command.getName(), path.toString(), command.getLine());
    }

    static Path resolve(Path directory, String name) {
        return ImportIncluder.resolve(directory, name, ".bib");
    }

    private static List<String> splitNames(String text) {
        List<String> names = new ArrayList<>();
        for (String part : text.split(",")) {
            if (!part.isBlank()) {
                names.add(part.trim());
            }
        }
        return names;
    }
}
