package im.arun.texmml.lexer;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Unparsed contents of a bracket or brace group and the line it starts on.
 */
@Data
@AllArgsConstructor
public class RawGroup {
    private String text;
    private int line;
}
