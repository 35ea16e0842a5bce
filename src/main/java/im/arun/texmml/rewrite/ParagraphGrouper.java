package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps runs of inline content into {@code paragraph} blocks.
 *
 * <p>The document body (or the top level when there is no document environment)
 * is always partitioned. Nested sequences outside math are partitioned only when
 * they contain something that breaks a paragraph: a {@code \paragraph} command or
 * blank line, a sectioning command, display math, a named environment block or a
 * verbatim span. Such splitters stay in place; a {@code \paragraph} command is
 * turned into the paragraph block that absorbs the run after it, with its title as
 * the first group.
 */
public class ParagraphGrouper implements RewritePass {

    @Override
    public String getName() {
        return "BuildParagraphs";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        Expression document = TreeUtils.findDocument(root).orElse(null);
        if (document != null) {
            partition(document, TreeUtils.bodyGroup(document), true);
        } else {
            partition(root, 0, true);
        }
    }

    private void partition(Expression parent, int group, boolean forced) {
        for (Expression child : new ArrayList<>(parent.group(group))) {
            descend(child);
        }
        if (!forced && parent.group(group).stream().noneMatch(ParagraphGrouper::isSplitter)) {
            return;
        }

        List<Expression> nodes = parent.extractRange(group, 0, parent.group(group).size());
        List<Expression> result = new ArrayList<>();
        List<Expression> run = new ArrayList<>();
        Expression open = null;
        for (Expression node : nodes) {
            if (isParagraphCommand(node)) {
                flush(run, result);
                open = Expression.block("paragraph", false);
                open.setLine(node.getLine());
                open.setWhitespaceBefore(node.isWhitespaceBefore());
                if (node.groupCount() > 0) {
                    open.addRawArgument(node.getRawArguments().isEmpty() ? "" : node.getRawArguments().get(0));
                    open.addGroup(node.removeGroup(0));
                }
                open.addGroup(new ArrayList<>());
                result.add(open);
            } else if (isSplitter(node)) {
                flush(run, result);
                result.add(node);
                open = null;
            } else if (open != null) {
                open.appendChild(TreeUtils.bodyGroup(open), node);
            } else {
                run.add(node);
            }
        }
        flush(run, result);
        parent.setGroup(group, result);
    }

    private void descend(Expression node) {
        if (node.isMathMode() || TreeUtils.isMath(node)) {
            return;
        }
        for (int g = 0; g < node.groupCount(); g++) {
            partition(node, g, false);
        }
    }

    private static void flush(List<Expression> run, List<Expression> result) {
        if (run.isEmpty()) {
            return;
        }
        if (run.stream().allMatch(node -> node.is(ExpressionType.COMMENT))) {
            result.addAll(run);
        } else {
            Expression paragraph = Expression.block("paragraph", false);
            paragraph.setLine(run.get(0).getLine());
            paragraph.setWhitespaceBefore(run.get(0).isWhitespaceBefore());
            paragraph.addGroup(new ArrayList<>(run));
            result.add(paragraph);
        }
        run.clear();
    }

    private static boolean isParagraphCommand(Expression node) {
        return node.is(ExpressionType.COMMAND) && !node.isMathMode()
                && ConstructCatalog.PARAGRAPH_COMMANDS.contains(node.getName());
    }

    private static boolean isSplitter(Expression node) {
        switch (node.getType()) {
            case COMMAND:
                return ConstructCatalog.isSectionCommand(node.getName()) || isParagraphCommand(node);
            case BLOCK_MATH:
            case VERBATIM:
                return true;
            case BLOCK:
                return !node.getName().isEmpty() && !node.getName().equals("{}");
            default:
                return false;
        }
    }
}
