package im.arun.texmml.rewrite;

import im.arun.texmml.TestTrees;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.error.LatexConversionException;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.tree.TreeUtils;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class CustomCommandExpanderTest {

    private static Expression expand(String source, ConversionContext context) {
        return TestTrees.runThrough(source, context, CustomCommandExpander.class);
    }

    private static Expression expand(String source) {
        return expand(source, new ConversionContext());
    }

    /** Top-level nodes after the definitions. */
    private static List<Expression> afterDefinitions(Expression root) {
        return root.group(0).stream()
                .filter(node -> !node.isCommand("newcommand") && !node.isCommand("renewcommand"))
                .collect(Collectors.toList());
    }

    @Test
    void argumentIsSplicedBetweenBodyText() {
        Expression root = expand("\\newcommand{\\foo}[1]{X#1Y}\\foo{Z}");

        List<Expression> top = root.group(0);
        assertThat(top).extracting(Expression::getName).containsExactly("newcommand", "X", "Z", "Y");
        for (int i = 1; i < top.size(); i++) {
            assertThat(top.get(i).getParent()).isSameAs(root);
            assertThat(top.get(i).getIndexInGroup()).isEqualTo(i);
        }
        TreeUtils.checkInvariants(root);
    }

    @Test
    void expansionInMathKeepsScripts() {
        Expression root = expand("\\newcommand{\\sq}[1]{#1^2}$\\sq{a}$");

        Expression math = root.group(0).get(1);
        assertThat(math.group(0)).extracting(Expression::getName).containsExactly("a", "^");
        assertThat(math.group(0)).allMatch(Expression::isMathMode);
    }

    @Test
    void macroInsideOptionExpressionIsExpanded() {
        Expression root = expand("\\newcommand{\\nn}{3}$\\sqrt[\\nn]{x}$");

        Expression sqrt = root.group(0).get(1).group(0).get(0);
        assertThat(sqrt.isCommand("sqrt")).isTrue();
        assertThat(sqrt.getOptions().get().getExpressions()).singleElement().satisfies(index -> {
            assertThat(index.getType()).isEqualTo(ExpressionType.PLAIN_TEXT);
            assertThat(index.getName()).isEqualTo("3");
            assertThat(index.getParent()).isSameAs(sqrt);
            assertThat(index.getGroupIndex()).isEqualTo(Expression.OPTIONS_GROUP);
        });
        assertThat(TestTrees.findAll(root, node -> node.isCommand("nn"))).isEmpty();
        TreeUtils.checkInvariants(root);
    }

    @Test
    void placeholderInsideBodyOptionIsSubstituted() {
        Expression root = expand("\\newcommand{\\rt}[2]{\\sqrt[#1]{#2}}$\\rt{k}{y}$");

        Expression sqrt = root.group(0).get(1).group(0).get(0);
        assertThat(sqrt.getOptions().get().getExpressions()).extracting(Expression::getName).containsExactly("k");
        assertThat(sqrt.group(0)).extracting(Expression::getName).containsExactly("y");
        assertThat(sqrt.getRawOptions()).containsExactly("k");
    }

    @Test
    void optionalParameterTakesDefault() {
        Expression root = expand("\\newcommand{\\greet}[2][Hello]{#1, #2!}\\greet{Bob} \\greet[Hi]{Ann}");

        assertThat(TestTrees.text(afterDefinitions(root))).isEqualTo("Hello, Bob! Hi, Ann!");
    }

    @Test
    void newcommandDoesNotRedefineButRenewcommandDoes() {
        Expression root = expand("\\newcommand{\\x}{A}\\newcommand{\\x}{B}\\x\\renewcommand{\\x}{C}\\x");

        assertThat(afterDefinitions(root)).extracting(Expression::getName).containsExactly("A", "C");
    }

    @Test
    void parameterlessMacroPassesFollowingGroupToItsLastCommand() {
        Expression root = expand("\\newcommand{\\R}{\\mathbb}$\\R{R}$");

        Expression math = root.group(0).get(1);
        Expression mathbb = math.group(0).get(0);
        assertThat(mathbb.isCommand("mathbb")).isTrue();
        assertThat(mathbb.group(0)).extracting(Expression::getName).containsExactly("R");
    }

    @Test
    void surplusGroupStaysAfterExpansion() {
        Expression root = expand("\\newcommand{\\one}[1]{<#1>}\\one{a}{b}");

        List<Expression> expanded = afterDefinitions(root);
        assertThat(expanded).extracting(Expression::getName).containsExactly("<", "a", ">", "{}");
        assertThat(expanded.get(3).group(0).get(0).getName()).isEqualTo("b");
    }

    @Test
    void nameWithoutBracesIsAccepted() {
        ConversionContext context = new ConversionContext();
        Expression root = expand("\\newcommand\\two{2}\\two", context);

        assertThat(root.group(0)).extracting(Expression::getName).containsExactly("newcommand", "2");
        assertThat(context.findMacro("two")).isPresent();
    }

    @Test
    void nonNumericArityIsReported() {
        ConversionContext context = new ConversionContext();
        expand("\\newcommand{\\bad}[x]{y}", context);

        assertThat(context.findMacro("bad")).isEmpty();
        assertThat(context.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.MALFORMED_DEFINITION);
    }

    @Test
    void runawayRecursionIsStopped() {
        assertThatThrownBy(() -> expand("\\newcommand{\\again}{\\again}\\again"))
                .isInstanceOf(LatexConversionException.class)
                .hasMessageContaining("again");
    }

    @Test
    void nestedMacrosExpandInsideArguments() {
        Expression root = expand("\\newcommand{\\b}[1]{[#1]}\\newcommand{\\a}{\\b{in}}\\textbf{\\a}");

        Expression textbf = afterDefinitions(root).get(0);
        assertThat(textbf.isCommand("textbf")).isTrue();
        assertThat(textbf.group(0)).allMatch(node -> node.is(ExpressionType.PLAIN_TEXT));
        assertThat(TestTrees.text(textbf.group(0))).isEqualTo("[in]");
    }
}
