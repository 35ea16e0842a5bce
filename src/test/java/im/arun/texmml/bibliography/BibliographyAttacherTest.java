package im.arun.texmml.bibliography;

import im.arun.texmml.TestTrees;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.error.ResourceException;
import im.arun.texmml.model.BibliographyRecord;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.tree.ExpressionTreeBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

final class BibliographyAttacherTest {

    @TempDir
    Path dir;

    private ConversionContext context() {
        return new ConversionContext(dir.resolve("main.tex"), "en", StandardCharsets.UTF_8);
    }

    private static BibliographyAttacher attacher(boolean failOnMissing) {
        return new BibliographyAttacher(new BibtexParser(new ExpressionTreeBuilder()), failOnMissing);
    }

    @Test
    void citationsAreTaggedAndCheckedAgainstBibliography() throws IOException {
        Files.writeString(dir.resolve("refs.bib"), "@book{a, title = {A}}");
        ConversionContext context = context();
        Expression root = TestTrees.parse("\\cite{a, b} \\bibliography{refs}");

        attacher(false).apply(root, context);

        assertThat(context.findCitation("a")).isPresent();
        Expression cite = TestTrees.findFirst(root, node -> node.isCommand("cite"));
        assertThat(cite.getTag()).isEqualTo(List.of("a", "b"));
        assertThat(context.getDiagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.getKind()).isEqualTo(Diagnostic.Kind.UNDEFINED_CITATION);
            assertThat(diagnostic.getName()).isEqualTo("b");
        });
    }

    @Test
    void severalFilesContinueNumbering() throws IOException {
        Files.writeString(dir.resolve("one.bib"), "@misc{x, note = {1}}");
        Files.writeString(dir.resolve("two.bib"), "@misc{y, note = {2}}");
        ConversionContext context = context();

        attacher(true).apply(TestTrees.parse("\\bibliography{one, two.bib}"), context);

        assertThat(context.getBibliography().values()).extracting(BibliographyRecord::getNumber).containsExactly(1, 2);
    }

    @Test
    void missingFileIsReportedWhenLenient() {
        ConversionContext context = context();

        attacher(false).apply(TestTrees.parse("\\bibliography{absent}"), context);

        assertThat(context.getBibliography()).isEmpty();
        assertThat(context.getDiagnostics()).extracting(Diagnostic::getKind)
                .containsExactly(Diagnostic.Kind.MISSING_RESOURCE);
    }

    @Test
    void missingFileFailsWhenRequired() {
        assertThatThrownBy(() -> attacher(true).apply(TestTrees.parse("\\bibliography{absent}"), context()))
                .isInstanceOf(ResourceException.class)
                .hasMessageContaining("absent.bib");
    }

    @Test
    void resolveAddsExtensionOnce() {
        assertThat(BibliographyAttacher.resolve(dir, "refs").getFileName().toString()).isEqualTo("refs.bib");
        assertThat(BibliographyAttacher.resolve(dir, "refs.bib").getFileName().toString()).isEqualTo("refs.bib");
        assertThat(BibliographyAttacher.resolve(dir, "refs.txt").getFileName().toString()).isEqualTo("refs.txt");
    }

    @Test
    void explicitExtensionIsKept() throws IOException {
        Files.writeString(dir.resolve("refs.txt"), "@article{k, title = {K}}");
        ConversionContext context = context();

        attacher(true).apply(TestTrees.parse("\\cite{k} \\bibliography{refs.txt}"), context);

        assertThat(context.findCitation("k")).isPresent();
        assertThat(context.getDiagnostics()).isEmpty();
    }
}
