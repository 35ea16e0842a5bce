package im.arun.texmml.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a {@code \label} points at: the name of the enclosing block and its number.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LabeledReference {

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("number")
    private int number;
}
