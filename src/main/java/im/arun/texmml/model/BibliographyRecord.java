package im.arun.texmml.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One {@code @type{key, ...}} entry of a bibliography file.
 * Field values are kept both raw and parsed, so they may carry markup.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BibliographyRecord {

    @JsonProperty("type")
    private String type;

    @JsonProperty("key")
    private String key;

    @JsonProperty("number")
    private int number;

    @JsonProperty("raw_fields")
    private Map<String, String> rawFields = new LinkedHashMap<>();

    // Parsed nodes link back to their parents and are left out of the JSON view
    @JsonIgnore
    private Map<String, List<Expression>> fields = new LinkedHashMap<>();
}
