package im.arun.texmml.tree;

import im.arun.texmml.model.Expression;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class TreeUtilsTest {

    private static Expression parse(String source) {
        return new ExpressionTreeBuilder().parseDocument(source, "test.tex");
    }

    @Test
    void walkSkipsAltText() {
        Expression root = parse("$x$");

        // root, the math span and x
        assertThat(TreeUtils.countNodes(root)).isEqualTo(3);
    }

    @Test
    void walkVisitsOptionExpressionsBeforeArguments() {
        Expression root = parse("$\\sqrt[a]{b}$");

        List<Expression> leaves = TreeUtils.collect(root, node -> node.getName().equals("a") || node.getName().equals("b"));

        assertThat(leaves).extracting(Expression::getName).containsExactly("a", "b");
        Expression sqrt = leaves.get(0).getParent();
        assertThat(TreeUtils.contentGroups(sqrt)).containsExactly(Expression.OPTIONS_GROUP, 0);
        TreeUtils.checkInvariants(root);
    }

    @Test
    void keyValueOptionsAreNotContent() {
        Expression root = parse("\\includegraphics[width=3cm]{a.png}");

        assertThat(TreeUtils.contentGroups(root.group(0).get(0))).containsExactly(0);
    }

    @Test
    void collectReturnsDocumentOrder() {
        Expression root = parse("\\textbf{a} b \\emph{c}");

        List<Expression> commands = TreeUtils.collect(root, node -> node.getType().name().equals("COMMAND"));

        assertThat(commands).extracting(Expression::getName).containsExactly("textbf", "emph");
    }

    @Test
    void flattenTextKeepsWordSpacing() {
        Expression root = parse("Hello \\textbf{big} world");

        assertThat(TreeUtils.flattenText(root.group(0))).isEqualTo("Hello big world");
    }

    @Test
    void argumentTextReadsEnvironmentName() {
        Expression begin = parse("\\begin{ itemize }").group(0).get(0);

        assertThat(TreeUtils.argumentText(begin, 0)).isEqualTo("itemize");
        assertThat(TreeUtils.argumentText(begin, 3)).isEmpty();
    }

    @Test
    void findAncestorStopsAtNearestMatch() {
        Expression root = parse("{a {b}}");
        Expression inner = root.group(0).get(0).group(0).get(1);
        Expression b = inner.group(0).get(0);

        assertThat(TreeUtils.findAncestor(b, node -> node.isBlock("{}"))).containsSame(inner);
        assertThat(TreeUtils.findAncestor(root, node -> true)).isEmpty();
    }

    @Test
    void findDocumentLooksAtTopLevelOnly() {
        Expression root = Expression.root();
        Expression document = Expression.block("document", false);
        document.addGroup(List.of());
        root.appendChild(0, document);

        assertThat(TreeUtils.findDocument(root)).containsSame(document);
        assertThat(TreeUtils.findDocument(parse("text"))).isEmpty();
    }

    @Test
    void movingNodeKeepsBothParentsConsistent() {
        Expression root = Expression.root();
        Expression a = Expression.plainText("a", false);
        Expression b = Expression.plainText("b", false);
        root.appendChild(0, a);
        root.appendChild(0, b);
        Expression other = Expression.root();
        other.appendChild(0, b);

        TreeUtils.checkInvariants(root);
        TreeUtils.checkInvariants(other);
        assertThat(b.getParent()).isSameAs(other);
        assertThat(root.group(0)).containsExactly(a);
    }

    @Test
    void replacingRangeWithItsOwnSiblingIsRejected() {
        Expression root = Expression.root();
        Expression a = Expression.plainText("a", false);
        root.appendChild(0, a);
        root.appendChild(0, Expression.plainText("b", false));

        assertThatThrownBy(() -> root.replaceRange(0, 1, 2, List.of(a)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Expression.plainText("x", false).replaceWith(List.of()))
                .isInstanceOf(IllegalStateException.class);
    }
}
