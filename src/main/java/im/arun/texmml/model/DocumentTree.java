package im.arun.texmml.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * The finished tree of a document together with the side tables the renderer reads.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentTree {

    @JsonProperty("doc_name")
    private String docName;

    @JsonProperty("localization")
    private String localization;

    @JsonProperty("structure")
    private ExpressionView structure;

    @JsonProperty("counters")
    private Map<String, Integer> counters;

    @JsonProperty("references")
    private Map<String, LabeledReference> references;

    @JsonProperty("bibliography")
    private Map<String, BibliographyRecord> bibliography;

    @JsonProperty("contents")
    private List<SectionEntry> contents;

    @JsonProperty("diagnostics")
    private List<Diagnostic> diagnostics;
}
