package im.arun.texmml.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A user macro registered by {@code \newcommand} and its relatives.
 * The body is kept as source text and re-read at every call site.
 */
@Data
@AllArgsConstructor
public class MacroDefinition {
    private String name;
    private int arity;
    /** Default for an optional first parameter, or {@code null} when every parameter is mandatory. */
    private String defaultArgument;
    private String body;
    private int line;

    public boolean hasOptionalFirstParameter() {
        return defaultArgument != null;
    }
}
