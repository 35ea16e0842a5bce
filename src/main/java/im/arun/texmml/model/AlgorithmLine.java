package im.arun.texmml.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tag attached to a line of an algorithmic block: its line number and indentation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlgorithmLine {

    @JsonProperty("line")
    private int line;

    @JsonProperty("indentation")
    private int indentation;
}
