package im.arun.texmml.rewrite;

import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.error.LatexSyntaxException;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replaces each {@code \begin{name} ... \end{name}} pair with a block named after the
 * environment. The block keeps the extra groups and options of {@code \begin} (for
 * example the column spec of a tabular) and holds the enclosed nodes in its last
 * group. Nested environments of the same name are matched by depth.
 */
public class EnvironmentEncapsulator implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(EnvironmentEncapsulator.class);

    @Override
    public String getName() {
        return "IncapsulateCommands";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        encapsulate(root, context);
    }

    private void encapsulate(Expression node, ConversionContext context) {
        for (int g : TreeUtils.contentGroups(node)) {
            encapsulateSequence(node, g, context);
        }
    }

    private void encapsulateSequence(Expression parent, int group, ConversionContext context) {
        int i = 0;
        while (i < parent.group(group).size()) {
            Expression child = parent.group(group).get(i);
            if (child.isCommand("begin")) {
                String environment = TreeUtils.argumentText(child, 0);
                int end = findMatchingEnd(parent.group(group), i, environment);
                if (end < 0) {
                    throw LatexSyntaxException.unterminated("environment " + environment, child.getLine(), null);
                }
                Expression block = wrap(parent, group, i, end, child, environment);
                encapsulate(block, context);
            } else if (child.isCommand("end")) {
                String environment = TreeUtils.argumentText(child, 0);
                logger.warn("\\end{{}} without matching \\begin at line {}", environment, child.getLine());
                context.report(Diagnostic.Kind.STRAY_END, environment, "no matching \\begin", child.getLine());
            } else {
                encapsulate(child, context);
            }
            i++;
        }
    }

    private static int findMatchingEnd(List<Expression> sequence, int begin, String environment) {
        int depth = 0;
        for (int k = begin + 1; k < sequence.size(); k++) {
            Expression node = sequence.get(k);
            if (node.isCommand("begin") && environment.equals(TreeUtils.argumentText(node, 0))) {
                depth++;
            } else if (node.isCommand("end") && environment.equals(TreeUtils.argumentText(node, 0))) {
                if (depth == 0) {
                    return k;
                }
                depth--;
            }
        }
        return -1;
    }

    private static Expression wrap(Expression parent, int group, int begin, int end, Expression beginCommand,
                                   String environment) {
        List<Expression> body = parent.extractRange(group, begin + 1, end);

        Expression block = Expression.block(environment, beginCommand.isMathMode());
        block.setLine(beginCommand.getLine());
        block.setWhitespaceBefore(beginCommand.isWhitespaceBefore());
        for (int g = 1; g < beginCommand.groupCount(); g++) {
            block.addRawArgument(beginCommand.getRawArguments().get(g));
            block.addGroup(beginCommand.extractRange(g, 0, beginCommand.group(g).size()));
        }
        beginCommand.getOptions().ifPresent(options -> {
            beginCommand.getRawOptions().forEach(block::addRawOption);
            beginCommand.setOptions(null);
            block.setOptions(options);
        });
        block.addGroup(body);

        // begin and end are now adjacent
        parent.replaceRange(group, begin, begin + 2, List.of(block));
        return block;
    }
}
