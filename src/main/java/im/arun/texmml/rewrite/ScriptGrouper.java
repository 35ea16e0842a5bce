package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.model.ScriptOrder;
import im.arun.texmml.model.ScriptTag;
import im.arun.texmml.tree.TreeUtils;

import java.util.List;

/**
 * Combines a base with the {@code ^}/{@code _} block(s) right after it into a
 * script container: {@code script^} or {@code script_} for one script,
 * {@code script^_} or {@code script_^} when both follow in that order. Group 0 of
 * the container holds the base, the next groups the script contents. A
 * {@code \limits} between base and script is absorbed into the container's tag.
 *
 * <p>Script containers are never used as a base, so running the pass twice
 * changes nothing.
 */
public class ScriptGrouper implements RewritePass {

    @Override
    public String getName() {
        return "BuildScripts";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        visit(root);
    }

    private void visit(Expression node) {
        for (int g : TreeUtils.contentGroups(node)) {
            groupSequence(node, g);
            for (Expression child : node.group(g)) {
                visit(child);
            }
        }
    }

    private void groupSequence(Expression parent, int group) {
        int i = 1;
        while (i < parent.group(group).size()) {
            List<Expression> sequence = parent.group(group);
            Expression first = sequence.get(i);
            if (!isRawScript(first)) {
                i++;
                continue;
            }

            int baseIndex = i - 1;
            boolean limits = false;
            Expression candidate = sequence.get(baseIndex);
            if ((candidate.isCommand("limits") || candidate.isCommand("nolimits")) && baseIndex > 0) {
                limits = candidate.isCommand("limits");
                baseIndex--;
                candidate = sequence.get(baseIndex);
            }
            if (!canBeBase(candidate)) {
                i++;
                continue;
            }

            Expression second = null;
            if (i + 1 < sequence.size() && isRawScript(sequence.get(i + 1))
                    && !sequence.get(i + 1).getName().equals(first.getName())) {
                second = sequence.get(i + 1);
            }
            int end = second == null ? i + 1 : i + 2;
            ScriptOrder order = ScriptOrder.of(first.getName(), second == null ? null : second.getName());

            List<Expression> parts = parent.extractRange(group, baseIndex, end);
            Expression base = parts.get(0);
            Expression container = Expression.block(order.getContainerName(), true);
            container.setLine(base.getLine());
            container.setWhitespaceBefore(base.isWhitespaceBefore());
            container.setTag(new ScriptTag(order, limits));
            container.addGroup(List.of(base));
            container.addGroup(first.extractRange(0, 0, first.group(0).size()));
            if (second != null) {
                container.addGroup(second.extractRange(0, 0, second.group(0).size()));
            }
            parent.insertChildren(group, baseIndex, List.of(container));
            i = baseIndex + 2;
        }
    }

    static boolean isRawScript(Expression node) {
        return node.isBlock("^") || node.isBlock("_");
    }

    static boolean isScriptContainer(Expression node) {
        return node.is(ExpressionType.BLOCK) && node.getName().startsWith("script")
                && node.getTag() instanceof ScriptTag;
    }

    private static boolean canBeBase(Expression node) {
        if (isRawScript(node) || isScriptContainer(node)) {
            return false;
        }
        if (node.is(ExpressionType.COMMENT)) {
            return false;
        }
        if (node.is(ExpressionType.PLAIN_TEXT) && "&".equals(node.getName())) {
            return false;
        }
        return !(node.isCommand(ConstructCatalog.INVISIBLE_TIMES)
                || node.isCommand("limits")
                || node.isCommand("nolimits"));
    }
}
