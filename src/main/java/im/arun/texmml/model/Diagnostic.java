package im.arun.texmml.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A non-fatal anomaly found while rewriting or verifying the tree.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Diagnostic {

    public enum Kind {
        ARGUMENT_SHAPE,
        UNKNOWN_CONSTRUCT,
        UNDEFINED_REFERENCE,
        UNDEFINED_CITATION,
        DUPLICATE_LABEL,
        STRAY_END,
        MISSING_RESOURCE,
        MALFORMED_DEFINITION
    }

    @JsonProperty("kind")
    private Kind kind;

    @JsonProperty("name")
    private String name;

    @JsonProperty("detail")
    private String detail;

    @JsonProperty("line")
    private int line;
}
