package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-segments the body of tabular-like blocks into rows and cells.
 *
 * <p>The body becomes a list of anonymous row blocks, each holding one group of
 * anonymous cell blocks. Rows are split on {@code \\} and {@code \cr}, cells on
 * {@code &}. Rules such as {@code \hline}, comments and paragraph breaks are
 * dropped. Empty cells are kept so columns stay aligned; the empty row produced
 * by a trailing {@code \\} is not.
 */
public class TablePostParser implements RewritePass {

    @Override
    public String getName() {
        return "PostParseTables";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        visit(root);
    }

    private void visit(Expression node) {
        if (node.is(ExpressionType.BLOCK) && ConstructCatalog.TABLE_ENVIRONMENTS.contains(node.getName())) {
            restructure(node);
        }
        for (int g : TreeUtils.contentGroups(node)) {
            for (Expression child : node.group(g)) {
                visit(child);
            }
        }
    }

    private void restructure(Expression table) {
        int body = TreeUtils.bodyGroup(table);
        List<Expression> content = table.extractRange(body, 0, table.group(body).size());

        List<List<List<Expression>>> rows = new ArrayList<>();
        List<List<Expression>> row = newRow();
        for (Expression node : content) {
            if (node.is(ExpressionType.COMMAND) && ConstructCatalog.ROW_SEPARATORS.contains(node.getName())) {
                rows.add(row);
                row = newRow();
            } else if (node.is(ExpressionType.PLAIN_TEXT) && "&".equals(node.getName())) {
                row.add(new ArrayList<>());
            } else if (isDropped(node)) {
                continue;
            } else {
                row.get(row.size() - 1).add(node);
            }
        }
        rows.add(row);

        List<List<Expression>> last = rows.get(rows.size() - 1);
        if (last.size() == 1 && last.get(0).isEmpty()) {
            rows.remove(rows.size() - 1);
        }

        List<Expression> rowBlocks = new ArrayList<>(rows.size());
        for (List<List<Expression>> cells : rows) {
            List<Expression> cellBlocks = new ArrayList<>(cells.size());
            for (List<Expression> cellContent : cells) {
                Expression cell = Expression.block("", table.isMathMode());
                cell.setLine(cellContent.isEmpty() ? table.getLine() : cellContent.get(0).getLine());
                cell.addGroup(cellContent);
                cellBlocks.add(cell);
            }
            Expression rowBlock = Expression.block("", table.isMathMode());
            rowBlock.setLine(cellBlocks.get(0).getLine());
            rowBlock.addGroup(cellBlocks);
            rowBlocks.add(rowBlock);
        }
        table.setGroup(body, rowBlocks);
    }

    private static List<List<Expression>> newRow() {
        List<List<Expression>> row = new ArrayList<>();
        row.add(new ArrayList<>());
        return row;
    }

    private static boolean isDropped(Expression node) {
        if (node.is(ExpressionType.COMMENT)) {
            return true;
        }
        if (!node.is(ExpressionType.COMMAND)) {
            return false;
        }
        return ConstructCatalog.TABLE_RULES.contains(node.getName())
                || (node.getName().equals("paragraph") && node.groupCount() == 0);
    }
}
