package im.arun.texmml.verification;

import im.arun.texmml.TestTrees;
import im.arun.texmml.bibliography.BibliographyAttacher;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.tree.TreeUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

final class TreeVerifierTest {

    private final TreeVerifier verifier = new TreeVerifier();

    private TreeVerifier.VerificationResult verify(String source, ConversionContext context) {
        Expression root = TestTrees.runThrough(source, context, BibliographyAttacher.class);
        return verifier.verify(root, context);
    }

    @Test
    void knownConstructsVerifyClean() {
        ConversionContext context = new ConversionContext();
        TreeVerifier.VerificationResult result = verify(
                "\\section{A} text $\\frac{a}{b}^2$\n\n\\begin{itemize}\\item x\\end{itemize}", context);

        assertThat(result.isClean()).isTrue();
        assertThat(result.nodeCount).isGreaterThan(5);
        assertThat(context.getDiagnostics()).isEmpty();
    }

    @Test
    void unknownCommandIsReported() {
        ConversionContext context = new ConversionContext();
        TreeVerifier.VerificationResult result = verify("\\frobnicate x", context);

        assertThat(result.diagnostics).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.getKind()).isEqualTo(Diagnostic.Kind.UNKNOWN_CONSTRUCT);
            assertThat(diagnostic.getName()).isEqualTo("frobnicate");
        });
        assertThat(context.getDiagnostics()).hasSize(1);
    }

    @Test
    void unknownEnvironmentIsReported() {
        TreeVerifier.VerificationResult result = verify("\\begin{weird}a\\end{weird}", new ConversionContext());

        assertThat(result.diagnostics).extracting(Diagnostic::getName).containsExactly("weird");
    }

    @Test
    void missingArgumentIsReported() {
        TreeVerifier.VerificationResult result = verify("$\\frac{a}$", new ConversionContext());

        assertThat(result.diagnostics).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.getKind()).isEqualTo(Diagnostic.Kind.ARGUMENT_SHAPE);
            assertThat(diagnostic.getName()).isEqualTo("frac");
        });
    }

    @Test
    void macroNamesAreNotUnknown() {
        TreeVerifier.VerificationResult result = verify("\\newcommand{\\foo}{x}\\foo", new ConversionContext());

        assertThat(result.isClean()).isTrue();
    }

    @Test
    void nodeCountMatchesWalk() {
        ConversionContext context = new ConversionContext();
        Expression root = TestTrees.runThrough("a $b$ c", context, BibliographyAttacher.class);

        assertThat(verifier.verify(root, context).nodeCount).isEqualTo(TreeUtils.countNodes(root));
    }
}
