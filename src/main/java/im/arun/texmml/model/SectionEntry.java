package im.arun.texmml.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Table-of-contents accumulator for one section.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SectionEntry {

    @JsonProperty("title")
    private String title;

    @JsonProperty("numbered")
    private boolean numbered;

    @JsonProperty("subsections")
    private List<String> numberedSubsections = new ArrayList<>();

    @JsonProperty("unnumbered_subsections")
    private List<String> unnumberedSubsections = new ArrayList<>();

    public SectionEntry(String title, boolean numbered) {
        this.title = title;
        this.numbered = numbered;
    }
}
