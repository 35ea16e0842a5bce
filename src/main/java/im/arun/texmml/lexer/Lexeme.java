package im.arun.texmml.lexer;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * One lexical unit produced by {@link LatexTokenizer}.
 *
 * <p>{@code text} holds the command name, the text run, the script character
 * ({@code ^} or {@code _}), the math delimiter, or the raw contents of a group,
 * comment or verbatim region depending on the kind. Commands and scripts carry
 * their argument groups unparsed.
 */
@Getter
public class Lexeme {
    private final LexemeKind kind;
    private final String text;
    private final int line;
    private final boolean whitespaceBefore;
    private final List<RawGroup> arguments = new ArrayList<>();
    private final List<RawGroup> options = new ArrayList<>();

    public Lexeme(LexemeKind kind, String text, int line, boolean whitespaceBefore) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.whitespaceBefore = whitespaceBefore;
    }

    void addArgument(RawGroup argument) {
        arguments.add(argument);
    }

    void addOption(RawGroup option) {
        options.add(option);
    }

    /** The raw contents of the group, for single-group lexemes such as math spans and brace groups. */
    public RawGroup content() {
        return arguments.get(0);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")" + (arguments.isEmpty() ? "" : arguments);
    }
}
