package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.error.LatexConversionException;
import im.arun.texmml.error.ResourceException;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.ExpressionTreeBuilder;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Replaces {@code \input} and {@code \include} commands with the parsed contents of
 * the referenced file. Paths are resolved against the directory of the main
 * source file and get a {@code .tex} extension when they have none. Imported
 * files are processed recursively; an import cycle is an error.
 */
public class ImportIncluder implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(ImportIncluder.class);

    private final ExpressionTreeBuilder builder;
    private final boolean failOnMissingImport;

    public ImportIncluder(ExpressionTreeBuilder builder, boolean failOnMissingImport) {
        this.builder = builder;
        this.failOnMissingImport = failOnMissingImport;
    }

    @Override
    public String getName() {
        return "IncludeImports";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        Deque<Path> importStack = new ArrayDeque<>();
        if (context.getSourcePath() != null) {
            importStack.push(context.getSourcePath().toAbsolutePath().normalize());
        }
        visit(root, context, importStack);
    }

    private void visit(Expression node, ConversionContext context, Deque<Path> importStack) {
        for (int g : TreeUtils.contentGroups(node)) {
            int i = 0;
            while (i < node.group(g).size()) {
                Expression child = node.group(g).get(i);
                if (child.is(ExpressionType.COMMAND) && ConstructCatalog.IMPORT_COMMANDS.contains(child.getName())) {
                    i += include(child, context, importStack);
                } else {
                    visit(child, context, importStack);
                    i++;
                }
            }
        }
    }

    /** Splices the imported file in place of {@code command} and returns the number of nodes inserted. */
    private int include(Expression command, ConversionContext context, Deque<Path> importStack) {
        String target = TreeUtils.argumentText(command, 0);
        if (target.isEmpty()) {
            context.report(Diagnostic.Kind.ARGUMENT_SHAPE, command.getName(), "missing file name", command.getLine());
            command.removeFromParent();
            return 0;
        }

        Path path = resolve(context.getSourceDirectory(), target);
        if (importStack.contains(path)) {
            throw new LatexConversionException("Import cycle through " + path);
        }

        String source;
        try {
            source = Files.readString(path, context.getEncoding());
        } catch (NoSuchFileException e) {
            return skipOrFail(command, context, path, "Imported file not found", e);
        } catch (IOException e) {
            return skipOrFail(command, context, path, "Failed to read imported file", e);
        }

        logger.info("Including {}", path);
        List<Expression> imported = builder.parseFile(source, path.getFileName().toString());

        // Wrap the imported nodes so their own imports resolve before splicing
        Expression holder = Expression.root();
        holder.setGroup(0, imported);
        importStack.push(path);
        visit(holder, context, importStack);
        importStack.pop();

        List<Expression> content = holder.extractRange(0, 0, holder.group(0).size());
        if (!content.isEmpty()) {
            content.get(0).setWhitespaceBefore(command.isWhitespaceBefore());
        }
        command.replaceWith(content);
        return content.size();
    }

    private int skipOrFail(Expression command, ConversionContext context, Path path, String message,
                           IOException cause) {
        if (failOnMissingImport) {
            throw new ResourceException(message, path, cause);
        }
        logger.warn("{}: {}, skipping", message, path);
        context.report(Diagnostic.Kind.MISSING_RESOURCE, command.getName(), path.toString(), command.getLine());
        command.removeFromParent();
        return 0;
    }

    static Path resolve(Path directory, String target) {
        return resolve(directory, target, ".tex");
    }

    /** Resolves {@code target} against {@code directory}, appending the extension only when the name has none. */
    public static Path resolve(Path directory, String target, String defaultExtension) {
        String lastSegment = target.substring(Math.max(target.lastIndexOf('/'), target.lastIndexOf('\\')) + 1);
        String fileName = lastSegment.contains(".") ? target : target + defaultExtension;
        return directory.resolve(fileName).toAbsolutePath().normalize();
    }
}
