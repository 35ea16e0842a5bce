package im.arun.texmml.rewrite;

import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;

import java.util.List;

/**
 * Text such as {@code 1$^{st}$} puts a script at the start of an inline math span
 * with nothing to attach to. The script is moved out of the span, just before it,
 * and rendered as text.
 */
public class BaselessScriptSimplifier implements RewritePass {

    @Override
    public String getName() {
        return "SimplifyBaselessScripts";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        visit(root);
    }

    private void visit(Expression parent) {
        for (int g : TreeUtils.contentGroups(parent)) {
            int i = 0;
            while (i < parent.group(g).size()) {
                Expression child = parent.group(g).get(i);
                if (child.is(ExpressionType.INLINE_MATH) && startsWithScript(child)) {
                    Expression script = child.removeChild(0, 0);
                    script.setMathModeRecursive(false);
                    script.setWhitespaceBefore(child.isWhitespaceBefore());
                    child.setWhitespaceBefore(false);
                    parent.insertChildren(g, i, List.of(script));
                    i += 2;
                    continue;
                }
                if (child.is(ExpressionType.COMMAND) || child.is(ExpressionType.BLOCK)) {
                    visit(child);
                }
                i++;
            }
        }
    }

    private static boolean startsWithScript(Expression math) {
        List<Expression> content = math.groupOrEmpty(0);
        return !content.isEmpty() && ScriptGrouper.isRawScript(content.get(0));
    }
}
