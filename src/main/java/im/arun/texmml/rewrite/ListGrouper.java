package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ListKind;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Inside itemize, enumerate and description blocks, moves the nodes following each
 * {@code \item} into a single group of that item. Nodes before the first item
 * stay where they are.
 */
public class ListGrouper implements RewritePass {

    @Override
    public String getName() {
        return "BuildLists";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        visit(root);
    }

    private void visit(Expression node) {
        if (node.is(ExpressionType.BLOCK) && ListKind.fromEnvironment(node.getName()).isPresent()) {
            groupItems(node);
        }
        for (int g : TreeUtils.contentGroups(node)) {
            for (Expression child : node.group(g)) {
                visit(child);
            }
        }
    }

    private void groupItems(Expression list) {
        int body = TreeUtils.bodyGroup(list);
        int i = 0;
        while (i < list.group(body).size() && !list.group(body).get(i).isCommand("item")) {
            i++;
        }
        while (i < list.group(body).size()) {
            Expression item = list.group(body).get(i);
            int next = i + 1;
            while (next < list.group(body).size() && !list.group(body).get(next).isCommand("item")) {
                next++;
            }
            List<Expression> run = list.extractRange(body, i + 1, next);

            List<Expression> content = new ArrayList<>();
            // Groups the item captured itself are kept as brace groups in front
            while (item.groupCount() > 0) {
                Expression captured = Expression.block("{}", item.isMathMode());
                captured.setLine(item.getLine());
                captured.addGroup(item.removeGroup(0));
                content.add(captured);
            }
            content.addAll(run);
            item.addGroup(content);
            i++;
        }
    }
}
