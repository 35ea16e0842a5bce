package im.arun.texmml.rewrite;

import im.arun.texmml.TestTrees;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.LabeledReference;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

final class LabelResolverTest {

    private static final String DOCUMENT = "\\begin{document}\n"
            + "\\section{Intro}\\label{sec}\n"
            + "\\begin{equation}x\\label{eq:a}\\end{equation}\n"
            + "\\begin{equation}y\\label{eq:b}\\end{equation}\n"
            + "See \\ref{eq:b} and \\eqref{missing}.\n"
            + "\\end{document}";

    @Test
    void labelsPointAtEnclosingBlock() {
        ConversionContext context = new ConversionContext();
        TestTrees.runThrough(DOCUMENT, context, LabelResolver.class);

        assertThat(context.resolveReference("sec")).hasValue(new LabeledReference("document", 1));
        assertThat(context.resolveReference("eq:a")).hasValue(new LabeledReference("equation", 1));
        assertThat(context.resolveReference("eq:b")).hasValue(new LabeledReference("equation", 2));
    }

    @Test
    void referencesAreTaggedWithTheirKey() {
        ConversionContext context = new ConversionContext();
        Expression root = TestTrees.runThrough(DOCUMENT, context, LabelResolver.class);

        assertThat(TestTrees.findFirst(root, node -> node.isCommand("ref")).getTag()).isEqualTo("eq:b");
        assertThat(TestTrees.findFirst(root, node -> node.isCommand("label")).getTag()).isEqualTo("sec");
    }

    @Test
    void undefinedReferenceIsReported() {
        ConversionContext context = new ConversionContext();
        TestTrees.runThrough(DOCUMENT, context, LabelResolver.class);

        assertThat(context.getDiagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.getKind()).isEqualTo(Diagnostic.Kind.UNDEFINED_REFERENCE);
            assertThat(diagnostic.getName()).isEqualTo("missing");
            assertThat(diagnostic.getLine()).isEqualTo(5);
        });
    }

    @Test
    void firstOfDuplicateLabelsWins() {
        ConversionContext context = new ConversionContext();
        TestTrees.runThrough("\\begin{figure}\\label{f}\\end{figure}\\begin{table}\\label{f}\\end{table}",
                context, LabelResolver.class);

        assertThat(context.resolveReference("f")).hasValue(new LabeledReference("figure", 1));
        assertThat(context.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.DUPLICATE_LABEL);
    }

    @Test
    void documentLevelLabelsWithoutDocumentAreNumberedToo() {
        ConversionContext context = new ConversionContext();
        TestTrees.runThrough("a\\label{one} b\\label{two}", context, LabelResolver.class);

        assertThat(context.resolveReference("one")).hasValue(new LabeledReference("document", 1));
        assertThat(context.resolveReference("two")).hasValue(new LabeledReference("document", 2));
    }

    @Test
    void hyperrefTakesKeyFromOption() {
        ConversionContext context = new ConversionContext();
        Expression root = TestTrees.runThrough("\\label{k}\\hyperref[k]{see here}", context, LabelResolver.class);

        assertThat(TestTrees.findFirst(root, node -> node.isCommand("hyperref")).getTag()).isEqualTo("k");
        assertThat(context.getDiagnostics()).isEmpty();
    }

    @Test
    void emptyLabelIsReported() {
        ConversionContext context = new ConversionContext();
        TestTrees.runThrough("\\label{ }", context, LabelResolver.class);

        assertThat(context.getReferences()).isEmpty();
        assertThat(context.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.ARGUMENT_SHAPE);
    }
}
