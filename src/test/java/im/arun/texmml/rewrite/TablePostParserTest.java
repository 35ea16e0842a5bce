package im.arun.texmml.rewrite;

import im.arun.texmml.TestTrees;
import im.arun.texmml.model.Expression;
import im.arun.texmml.tree.TreeUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

final class TablePostParserTest {

    private static Expression table(String source) {
        Expression root = TestTrees.runThrough(source, TablePostParser.class);
        TreeUtils.checkInvariants(root);
        return TestTrees.findFirst(root, node -> node.isBlock("tabular") || node.isBlock("pmatrix"));
    }

    private static List<Expression> rows(Expression table) {
        return table.group(TreeUtils.bodyGroup(table));
    }

    private static String cellText(Expression table, int row, int cell) {
        return TestTrees.text(rows(table).get(row).group(0).get(cell).group(0));
    }

    @Test
    void rowsAndCellsAreSplitOut() {
        Expression table = table("\\begin{tabular}{cc}a & b \\\\ c & d \\\\ \\hline\\end{tabular}");

        assertThat(rows(table)).hasSize(2);
        assertThat(rows(table)).allSatisfy(row -> {
            assertThat(row.isBlock("")).isTrue();
            assertThat(row.group(0)).hasSize(2).allMatch(cell -> cell.isBlock(""));
        });
        assertThat(cellText(table, 0, 0)).isEqualTo("a");
        assertThat(cellText(table, 0, 1)).isEqualTo("b");
        assertThat(cellText(table, 1, 0)).isEqualTo("c");
        assertThat(cellText(table, 1, 1)).isEqualTo("d");
    }

    @Test
    void emptyCellsAreKept() {
        Expression table = table("\\begin{tabular}{ccc}a & & c\\end{tabular}");

        assertThat(rows(table)).hasSize(1);
        assertThat(rows(table).get(0).group(0)).hasSize(3);
        assertThat(rows(table).get(0).group(0).get(1).group(0)).isEmpty();
    }

    @Test
    void columnSpecificationStaysInItsOwnGroup() {
        Expression table = table("\\begin{tabular}{lr}x & y\\end{tabular}");

        assertThat(table.group(0)).extracting(Expression::getName).containsExactly("lr");
    }

    @Test
    void matrixInMathIsSplitToo() {
        Expression matrix = table("$\\begin{pmatrix}1 & 0\\\\0 & 1\\end{pmatrix}$");

        assertThat(matrix.isMathMode()).isTrue();
        assertThat(rows(matrix)).hasSize(2);
        assertThat(rows(matrix)).allMatch(Expression::isMathMode);
        assertThat(cellText(matrix, 1, 1)).isEqualTo("1");
    }

    @Test
    void rulesAndCommentsAreDropped() {
        Expression table = table("\\begin{tabular}{c}\n\\toprule\n% note\nx \\\\\n\\bottomrule\n\\end{tabular}");

        assertThat(rows(table)).hasSize(1);
        assertThat(rows(table).get(0).group(0)).singleElement()
                .satisfies(cell -> assertThat(TestTrees.text(cell.group(0))).isEqualTo("x"));
    }
}
