package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.AlgorithmLine;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;

import java.util.Set;

/**
 * Tags the statements of algorithmic blocks with their line number and indentation.
 * Block openers such as {@code \If} indent what follows by two, the matching
 * closers undo it, and {@code \Else} sits one level out. {@code \Statex} continues
 * the previous line without taking a number of its own.
 */
public class AlgorithmPreprocessor implements RewritePass {
    private static final int INDENT = 2;

    private static final Set<String> OPENERS = Set.of(
            "Procedure", "Function", "Begin", "If", "For", "ForAll", "While", "Loop", "Repeat");
    private static final Set<String> CLOSERS = Set.of(
            "EndProcedure", "EndFunction", "End", "EndIf", "EndFor", "EndWhile", "EndLoop", "Until");
    private static final Set<String> BRANCHES = Set.of("Else", "ElsIf");

    @Override
    public String getName() {
        return "PreprocessAlgorithms";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        for (Expression block : TreeUtils.collect(root, AlgorithmPreprocessor::isAlgorithm)) {
            int[] state = {1, 0};
            tagLines(block, TreeUtils.bodyGroup(block), state);
        }
    }

    private static boolean isAlgorithm(Expression node) {
        return node.is(ExpressionType.BLOCK) && ConstructCatalog.ALGORITHM_ENVIRONMENTS.contains(node.getName());
    }

    /** {@code state} holds the next line number and the current indentation. */
    private void tagLines(Expression parent, int group, int[] state) {
        for (Expression child : parent.group(group)) {
            // Blank lines inside the environment leave the statements wrapped in paragraphs
            if (child.isBlock("paragraph")) {
                tagLines(child, TreeUtils.bodyGroup(child), state);
                continue;
            }
            if (!child.is(ExpressionType.COMMAND)) {
                continue;
            }
            String name = child.getName();
            if (OPENERS.contains(name)) {
                child.setTag(new AlgorithmLine(state[0]++, state[1]));
                state[1] += INDENT;
            } else if (CLOSERS.contains(name)) {
                state[1] = Math.max(0, state[1] - INDENT);
                child.setTag(new AlgorithmLine(state[0]++, state[1]));
            } else if (BRANCHES.contains(name)) {
                child.setTag(new AlgorithmLine(state[0]++, Math.max(0, state[1] - INDENT)));
            } else if (name.equals("State")) {
                child.setTag(new AlgorithmLine(state[0]++, state[1]));
            } else if (name.equals("Statex")) {
                child.setTag(new AlgorithmLine(state[0], state[1]));
            }
        }
    }
}
