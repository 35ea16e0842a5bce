package im.arun.texmml.context;

import im.arun.texmml.catalog.TextSize;
import im.arun.texmml.catalog.TextStyle;
import im.arun.texmml.model.BibliographyRecord;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.LabeledReference;
import im.arun.texmml.model.MacroDefinition;
import im.arun.texmml.model.SectionEntry;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one conversion, passed explicitly to every rewrite pass.
 *
 * <p>Passes write counters (numbering), references (label resolution), macros
 * (custom command expansion), the bibliography (bibliography attachment) and the
 * section outline; the renderer reads all of them along with the text size and
 * style it updates while walking the tree. A context is never shared between
 * two documents. Collections are exposed as read-only views.
 */
public class ConversionContext {
    private static final Logger logger = LoggerFactory.getLogger(ConversionContext.class);

    private final Map<String, Integer> counters = new LinkedHashMap<>();
    private final Map<String, LabeledReference> references = new LinkedHashMap<>();
    private final Map<String, MacroDefinition> macros = new LinkedHashMap<>();
    private final Map<String, BibliographyRecord> bibliography = new LinkedHashMap<>();
    private final List<SectionEntry> sectionContents = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<TextStyle> textStyle = EnumSet.noneOf(TextStyle.class);
    @Getter @Setter
    private TextSize textSize = TextSize.NORMALSIZE;

    @Getter
    private final String localization;
    @Getter
    private final Path sourcePath;
    @Getter
    private final Charset encoding;
    @Getter @Setter
    private Path outputPath;

    public ConversionContext(Path sourcePath, String localization, Charset encoding) {
        this.sourcePath = sourcePath;
        this.localization = localization == null ? "en" : localization;
        this.encoding = encoding == null ? StandardCharsets.UTF_8 : encoding;
    }

    public ConversionContext() {
        this(null, "en", StandardCharsets.UTF_8);
    }

    // Counters

    public int nextCounter(String blockName) {
        return counters.merge(blockName, 1, Integer::sum);
    }

    public int getCounter(String blockName) {
        return counters.getOrDefault(blockName, 0);
    }

    public void resetCounter(String blockName) {
        counters.put(blockName, 0);
    }

    public Map<String, Integer> getCounters() {
        return Collections.unmodifiableMap(counters);
    }

    // References

    /** Records a label; returns {@code false} when the key was already taken, keeping the first entry. */
    public boolean addReference(String key, LabeledReference reference) {
        if (references.containsKey(key)) {
            return false;
        }
        references.put(key, reference);
        return true;
    }

    public Optional<LabeledReference> resolveReference(String key) {
        return Optional.ofNullable(references.get(key));
    }

    public Map<String, LabeledReference> getReferences() {
        return Collections.unmodifiableMap(references);
    }

    // Macros

    public Optional<MacroDefinition> findMacro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    public void defineMacro(MacroDefinition definition) {
        macros.put(definition.getName(), definition);
    }

    public Map<String, MacroDefinition> getMacros() {
        return Collections.unmodifiableMap(macros);
    }

    // Bibliography

    public void attachBibliography(Map<String, BibliographyRecord> records) {
        records.forEach(bibliography::putIfAbsent);
    }

    public Optional<BibliographyRecord> findCitation(String key) {
        return Optional.ofNullable(bibliography.get(key));
    }

    public Map<String, BibliographyRecord> getBibliography() {
        return Collections.unmodifiableMap(bibliography);
    }

    // Section outline

    public void addSection(SectionEntry entry) {
        sectionContents.add(entry);
    }

    public List<SectionEntry> getSectionContents() {
        return Collections.unmodifiableList(sectionContents);
    }

    // Diagnostics

    public void report(Diagnostic.Kind kind, String name, String detail, int line) {
        logger.debug("{} {}: {} (line {})", kind, name, detail, line);
        diagnostics.add(new Diagnostic(kind, name, detail, line));
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    // Text state tracked by the renderer

    public Set<TextStyle> getTextStyle() {
        return Collections.unmodifiableSet(textStyle);
    }

    public void enableStyle(TextStyle style) {
        textStyle.add(style);
    }

    public void disableStyle(TextStyle style) {
        textStyle.remove(style);
    }

    // Paths and localization

    /** Directory relative paths in the document are resolved against. */
    public Path getSourceDirectory() {
        if (sourcePath == null) {
            return Paths.get("").toAbsolutePath();
        }
        Path absolute = sourcePath.toAbsolutePath();
        return absolute.getParent() == null ? absolute : absolute.getParent();
    }

    public String getContentsTitle() {
        return "ru".equals(localization) ? "Содержание" : "Contents";
    }

    public String getBibliographyTitle() {
        return "ru".equals(localization) ? "Список литературы" : "References";
    }
}
