package im.arun.texmml.rewrite;

import im.arun.texmml.TestTrees;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Expression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

final class BlockNumbererTest {

    @Test
    void blocksAreNumberedPerNameInDocumentOrder() {
        ConversionContext context = new ConversionContext();
        Expression root = TestTrees.runThrough(
                "\\begin{equation}a\\end{equation}\\begin{figure}b\\end{figure}"
                        + "\\begin{equation}c\\end{equation}", context, BlockNumberer.class);

        List<Expression> equations = TestTrees.findAll(root, node -> node.isBlock("equation"));
        assertThat(equations).extracting(Expression::getTag).containsExactly(1, 2);
        assertThat(TestTrees.findFirst(root, node -> node.isBlock("figure")).getTag()).isEqualTo(1);
        assertThat(context.getCounter("equation")).isEqualTo(2);
    }

    @Test
    void outerBlockIsNumberedBeforeInnerOne() {
        Expression root = TestTrees.runThrough(
                "\\begin{theorem}\\begin{theorem}x\\end{theorem}\\end{theorem}", BlockNumberer.class);

        List<Expression> theorems = TestTrees.findAll(root, node -> node.isBlock("theorem"));
        assertThat(theorems).extracting(Expression::getTag).containsExactly(1, 2);
    }

    @Test
    void anonymousBlocksStayUntagged() {
        Expression root = TestTrees.runThrough("a {b} $x^2$", BlockNumberer.class);

        assertThat(TestTrees.findAll(root, node -> node.getTag() instanceof Integer)).isEmpty();
    }

    @Test
    void documentCounterIsResetForLabels() {
        ConversionContext context = new ConversionContext();
        Expression root = TestTrees.runThrough("\\begin{document}x\\end{document}", context, BlockNumberer.class);

        assertThat(TestTrees.findFirst(root, node -> node.isBlock("document")).getTag()).isEqualTo(1);
        assertThat(context.getCounter("document")).isZero();
    }
}
