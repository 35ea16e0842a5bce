package im.arun.texmml.error;

/**
 * Raised when the source cannot be read into a balanced tree: an unterminated
 * brace group, math span, option bracket, verbatim region or environment, a
 * script with no argument, or a closing brace with no opening one.
 */
public class LatexSyntaxException extends LatexConversionException {
    private final String construct;
    private final int line;
    private final String source;

    private LatexSyntaxException(String message, String construct, int line, String source) {
        super(source == null ? message : message + " in " + source);
        this.construct = construct;
        this.line = line;
        this.source = source;
    }

    public static LatexSyntaxException unterminated(String construct, int line, String source) {
        return new LatexSyntaxException(
                String.format("Unterminated %s starting at line %d", construct, line), construct, line, source);
    }

    public static LatexSyntaxException missingArgument(String construct, int line, String source) {
        return new LatexSyntaxException(
                String.format("Missing argument for %s at line %d", construct, line), construct, line, source);
    }

    public static LatexSyntaxException unexpected(String construct, int line, String source) {
        return new LatexSyntaxException(
                String.format("Unexpected %s at line %d", construct, line), construct, line, source);
    }

    public String getConstruct() {
        return construct;
    }

    public int getLine() {
        return line;
    }

    public String getSource() {
        return source;
    }
}
