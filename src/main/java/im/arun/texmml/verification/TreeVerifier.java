package im.arun.texmml.verification;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Checks the finished tree before it is handed to the renderer.
 *
 * <p>A broken parent or index link is a programming error and fails with
 * {@link IllegalStateException}. Commands with fewer argument groups than the
 * renderer expects, and commands or environments nobody knows how to render, are
 * recorded as diagnostics and do not stop the check.
 */
public class TreeVerifier {
    private static final Logger logger = LoggerFactory.getLogger(TreeVerifier.class);

    /**
     * Outcome of one verification run.
     */
    public static class VerificationResult {
        public final int nodeCount;
        public final List<Diagnostic> diagnostics;

        public VerificationResult(int nodeCount, List<Diagnostic> diagnostics) {
            this.nodeCount = nodeCount;
            this.diagnostics = diagnostics;
        }

        public boolean isClean() {
            return diagnostics.isEmpty();
        }
    }

    public VerificationResult verify(Expression root, ConversionContext context) {
        TreeUtils.checkInvariants(root);

        List<Diagnostic> found = new ArrayList<>();
        TreeUtils.walk(root, node -> {
            if (node.is(ExpressionType.COMMAND)) {
                checkCommand(node, context, found);
            } else if (node.is(ExpressionType.BLOCK)) {
                checkEnvironment(node, found);
            }
        });

        for (Diagnostic diagnostic : found) {
            context.report(diagnostic.getKind(), diagnostic.getName(), diagnostic.getDetail(), diagnostic.getLine());
        }
        int nodeCount = TreeUtils.countNodes(root);
        if (!found.isEmpty()) {
            logger.info("Verified {} nodes, {} diagnostic(s)", nodeCount, found.size());
        }
        return new VerificationResult(nodeCount, found);
    }

    private static void checkCommand(Expression command, ConversionContext context, List<Diagnostic> found) {
        String name = command.getName();
        OptionalInt expected = ConstructCatalog.expectedArguments(name);
        if (expected.isEmpty()) {
            if (context.findMacro(name).isEmpty()) {
                logger.debug("Unknown command \\{} at line {}", name, command.getLine());
                found.add(new Diagnostic(Diagnostic.Kind.UNKNOWN_CONSTRUCT, name, "unknown command",
                        command.getLine()));
            }
            return;
        }
        // Blank-line paragraph breaks carry no title
        if (name.equals("paragraph") && command.groupCount() == 0) {
            return;
        }
        if (command.groupCount() < expected.getAsInt()) {
            found.add(new Diagnostic(Diagnostic.Kind.ARGUMENT_SHAPE, name,
                    String.format("expected %d argument(s), found %d", expected.getAsInt(), command.groupCount()),
                    command.getLine()));
        }
    }

    private static void checkEnvironment(Expression block, List<Diagnostic> found) {
        String name = block.getName();
        if (ConstructCatalog.isAnonymousBlock(name) || ConstructCatalog.isKnownEnvironment(name)) {
            return;
        }
        logger.debug("Unknown environment {} at line {}", name, block.getLine());
        found.add(new Diagnostic(Diagnostic.Kind.UNKNOWN_CONSTRUCT, name, "unknown environment", block.getLine()));
    }
}
