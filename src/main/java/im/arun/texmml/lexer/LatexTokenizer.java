package im.arun.texmml.lexer;

import im.arun.texmml.catalog.Accent;
import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.error.LatexSyntaxException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Splits LaTeX source into {@link Lexeme}s by character-class scanning.
 *
 * <p>The tokenizer has no notion of tree structure: brace groups, math spans and
 * command arguments are returned as raw text and parsed recursively by the
 * caller. The caller passes the current math mode with every call because the
 * set of stop characters and the meaning of {@code ^}, {@code _} and blank lines
 * depend on it. The only state carried between calls, apart from the position,
 * is the verbatim flag set after {@code \begin{verbatim}}.
 */
public class LatexTokenizer {
    private static final String VERBATIM_END = "\\end{verbatim}";
    private static final Set<String> OPTION_ONLY_COMMANDS = Set.of("\\", "item", "newline");
    private static final int UNLIMITED = Integer.MAX_VALUE;

    private final String text;
    private final String sourceName;
    private final int firstLine;
    private final boolean paragraphBreaks;
    private final int[] newlineOffsets;

    private int pos;
    private boolean verbatimPending;
    private boolean emittedAny;

    /**
     * @param text            the text to scan
     * @param sourceName      file name used in error messages, may be {@code null}
     * @param firstLine       line number of the first character of {@code text}
     * @param paragraphBreaks whether blank lines in text mode produce paragraph breaks;
     *                        only true for the top level of a file
     */
    public LatexTokenizer(String text, String sourceName, int firstLine, boolean paragraphBreaks) {
        this.text = text;
        this.sourceName = sourceName;
        this.firstLine = firstLine;
        this.paragraphBreaks = paragraphBreaks;
        this.newlineOffsets = indexNewlines(text);
    }

    private static int[] indexNewlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        int[] offsets = new int[count];
        int k = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                offsets[k++] = i;
            }
        }
        return offsets;
    }

    /** Line number of the character at {@code offset}. */
    int lineAt(int offset) {
        int index = Arrays.binarySearch(newlineOffsets, offset);
        int newlinesBefore = index >= 0 ? index : -index - 1;
        return firstLine + newlinesBefore;
    }

    public boolean isVerbatimPending() {
        return verbatimPending;
    }

    /**
     * Reads everything that is left, assuming the math mode never changes.
     */
    public List<Lexeme> readAll(boolean mathMode) {
        List<Lexeme> lexemes = new ArrayList<>();
        Lexeme lexeme;
        while ((lexeme = next(mathMode)) != null) {
            lexemes.add(lexeme);
        }
        return lexemes;
    }

    /**
     * Returns the next lexeme, or {@code null} at the end of input.
     */
    public Lexeme next(boolean mathMode) {
        if (verbatimPending) {
            verbatimPending = false;
            return emit(readVerbatim());
        }

        int wsStart = pos;
        int newlines = skipWhitespace();
        boolean whitespaceBefore = pos > wsStart;
        if (pos >= text.length()) {
            return null;
        }
        if (newlines >= 2 && paragraphBreaks && !mathMode && emittedAny) {
            return emit(new Lexeme(LexemeKind.PARAGRAPH_BREAK, "paragraph", lineAt(pos), false));
        }

        char c = text.charAt(pos);
        switch (c) {
            case '\\':
                if (peek(1) == '[') {
                    return emit(readMath(LexemeKind.BLOCK_MATH, "[", "\\]", whitespaceBefore));
                }
                if (peek(1) == '(') {
                    return emit(readMath(LexemeKind.INLINE_MATH, "(", "\\)", whitespaceBefore));
                }
                return emit(readCommand(mathMode, whitespaceBefore));
            case '$':
                if (peek(1) == '$') {
                    return emit(readMath(LexemeKind.BLOCK_MATH, "$$", "$$", whitespaceBefore));
                }
                return emit(readMath(LexemeKind.INLINE_MATH, "$", "$", whitespaceBefore));
            case '{': {
                int line = lineAt(pos);
                Lexeme group = new Lexeme(LexemeKind.BRACE_GROUP, "{}", line, whitespaceBefore);
                group.addArgument(readBraceGroup());
                return emit(group);
            }
            case '}':
                throw LatexSyntaxException.unexpected("closing brace", lineAt(pos), sourceName);
            case '%':
                return emit(readComment(whitespaceBefore));
            case '&':
                pos++;
                return emit(new Lexeme(LexemeKind.CELL_SEPARATOR, "&", lineAt(pos - 1), whitespaceBefore));
            case '^':
            case '_':
                if (mathMode) {
                    return emit(readScript(whitespaceBefore));
                }
                return emit(readText(mathMode, whitespaceBefore));
            default:
                return emit(readText(mathMode, whitespaceBefore));
        }
    }

    private Lexeme emit(Lexeme lexeme) {
        emittedAny = true;
        return lexeme;
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    /** Skips whitespace and returns the number of newlines crossed. */
    private int skipWhitespace() {
        int newlines = 0;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            if (text.charAt(pos) == '\n') {
                newlines++;
            }
            pos++;
        }
        return newlines;
    }

    // Commands

    private Lexeme readCommand(boolean mathMode, boolean whitespaceBefore) {
        int start = pos;
        int line = lineAt(start);
        pos++;
        if (pos >= text.length()) {
            throw LatexSyntaxException.unterminated("command", line, sourceName);
        }

        String name;
        if (isAsciiLetter(text.charAt(pos))) {
            int nameStart = pos;
            while (pos < text.length() && isAsciiLetter(text.charAt(pos))) {
                pos++;
            }
            if (pos < text.length() && text.charAt(pos) == '*') {
                pos++;
            }
            name = text.substring(nameStart, pos);
        } else {
            char symbol = text.charAt(pos);
            pos++;
            name = Character.isWhitespace(symbol) ? " " : String.valueOf(symbol);
        }

        Lexeme command = new Lexeme(LexemeKind.COMMAND, name, line, whitespaceBefore);
        scanArguments(command, mathMode);
        if ("begin".equals(name) && opensVerbatim(command)) {
            verbatimPending = true;
        }
        return command;
    }

    private static boolean opensVerbatim(Lexeme command) {
        return command.getArguments().size() == 1
                && "verbatim".equals(command.getArguments().get(0).getText().trim());
    }

    private void scanArguments(Lexeme command, boolean mathMode) {
        String name = command.getText();
        if (ConstructCatalog.NO_ARGUMENT_COMMANDS.contains(name)) {
            return;
        }
        if (name.length() == 1 && !isAsciiLetter(name.charAt(0))) {
            if (Accent.isSymbolAccent(name)) {
                scanAccentArgument(command);
            } else if ("\\".equals(name)) {
                scanGroups(command, 0, true, false);
            }
            return;
        }

        int braceLimit;
        boolean takesOptions;
        if (OPTION_ONLY_COMMANDS.contains(name)) {
            braceLimit = 0;
            takesOptions = true;
        } else if (ConstructCatalog.PARAGRAPH_COMMANDS.contains(name)) {
            braceLimit = 1;
            takesOptions = true;
        } else if ("begin".equals(name)) {
            braceLimit = UNLIMITED;
            takesOptions = true;
        } else {
            OptionalInt expected = ConstructCatalog.expectedArguments(name);
            braceLimit = expected.isPresent() ? expected.getAsInt() : UNLIMITED;
            takesOptions = braceLimit > 0;
        }
        scanGroups(command, braceLimit, takesOptions, mathMode);
    }

    /**
     * Reads the {@code [...]} and {@code {...}} groups that follow a command. Whitespace and
     * comments may separate them, but not a blank line. In math mode, and after the
     * first brace group, a bracket only counts when it directly follows.
     */
    private void scanGroups(Lexeme command, int braceLimit, boolean takesOptions, boolean strictBrackets) {
        int braces = 0;
        while (true) {
            int save = pos;
            boolean skipped = skipSeparators();
            if (pos >= text.length()) {
                pos = save;
                return;
            }
            char c = text.charAt(pos);
            boolean bracketAllowed = takesOptions && !((strictBrackets || braces > 0) && skipped);
            if (c == '[' && bracketAllowed) {
                command.addOption(readBracketGroup());
            } else if (c == '{' && braces < braceLimit) {
                command.addArgument(readBraceGroup());
                braces++;
                if ("begin".equals(command.getText()) && opensVerbatim(command)) {
                    return;
                }
            } else {
                pos = save;
                return;
            }
        }
    }

    /**
     * Skips whitespace and comments between a command and its groups, stopping in front
     * of a blank line. Returns whether anything was skipped.
     */
    private boolean skipSeparators() {
        int start = pos;
        int newlines = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\n') {
                newlines++;
                if (newlines >= 2) {
                    pos = start;
                    return false;
                }
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '%') {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
                if (pos < text.length()) {
                    pos++;
                }
                newlines = 0;
            } else {
                break;
            }
        }
        return pos > start;
    }

    private void scanAccentArgument(Lexeme command) {
        if (pos >= text.length()) {
            return;
        }
        char c = text.charAt(pos);
        if (c == '{') {
            command.addArgument(readBraceGroup());
        } else if (Character.isLetter(c)) {
            command.addArgument(new RawGroup(String.valueOf(c), lineAt(pos)));
            pos++;
        }
    }

    // Groups

    /** Reads a balanced {@code {...}} group starting at the current position. */
    private RawGroup readBraceGroup() {
        int open = pos;
        int line = lineAt(open);
        int depth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '%') {
                skipToLineEnd();
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    pos++;
                    return new RawGroup(text.substring(open + 1, pos - 1), line);
                }
            }
            pos++;
        }
        throw LatexSyntaxException.unterminated("brace group", line, sourceName);
    }

    /** Reads a {@code [...]} group; brackets inside braces or comments do not count. */
    private RawGroup readBracketGroup() {
        int open = pos;
        int line = lineAt(open);
        int braceDepth = 0;
        int bracketDepth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '%') {
                skipToLineEnd();
                continue;
            }
            if (c == '{') {
                braceDepth++;
            } else if (c == '}') {
                braceDepth--;
            } else if (braceDepth == 0 && c == '[') {
                bracketDepth++;
            } else if (braceDepth == 0 && c == ']') {
                bracketDepth--;
                if (bracketDepth == 0) {
                    pos++;
                    return new RawGroup(text.substring(open + 1, pos - 1), line);
                }
            }
            pos++;
        }
        throw LatexSyntaxException.unterminated("option bracket", line, sourceName);
    }

    private void skipToLineEnd() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
    }

    // Math

    private Lexeme readMath(LexemeKind kind, String delimiter, String closing, boolean whitespaceBefore) {
        int line = lineAt(pos);
        int contentStart = pos + (delimiter.equals("$") ? 1 : 2);
        pos = contentStart;
        int depth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (depth == 0 && text.startsWith(closing, pos)) {
                Lexeme math = new Lexeme(kind, delimiter, line, whitespaceBefore);
                math.addArgument(new RawGroup(text.substring(contentStart, pos), lineAt(contentStart)));
                pos += closing.length();
                return math;
            }
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '%') {
                skipToLineEnd();
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            pos++;
        }
        String construct = kind == LexemeKind.INLINE_MATH ? "inline math" : "display math";
        throw LatexSyntaxException.unterminated(construct, line, sourceName);
    }

    private Lexeme readScript(boolean whitespaceBefore) {
        char script = text.charAt(pos);
        int line = lineAt(pos);
        pos++;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        if (pos >= text.length()) {
            throw LatexSyntaxException.missingArgument("script " + script, line, sourceName);
        }

        Lexeme lexeme = new Lexeme(LexemeKind.SCRIPT, String.valueOf(script), line, whitespaceBefore);
        char c = text.charAt(pos);
        if (c == '{') {
            lexeme.addArgument(readBraceGroup());
        } else if (c == '\\') {
            int start = pos;
            readCommand(true, false);
            lexeme.addArgument(new RawGroup(text.substring(start, pos), lineAt(start)));
        } else if (c == '}' || c == '$' || c == '^' || c == '_' || c == '&' || c == '%') {
            throw LatexSyntaxException.missingArgument("script " + script, line, sourceName);
        } else {
            int end = pos + Character.charCount(text.codePointAt(pos));
            lexeme.addArgument(new RawGroup(text.substring(pos, end), lineAt(pos)));
            pos = end;
        }
        return lexeme;
    }

    // Text, comments, verbatim

    private Lexeme readComment(boolean whitespaceBefore) {
        int line = lineAt(pos);
        int start = pos + 1;
        skipToLineEnd();
        String content = text.substring(start, pos);
        if (pos < text.length()) {
            pos++;
        }
        return new Lexeme(LexemeKind.COMMENT, content, line, whitespaceBefore);
    }

    private Lexeme readVerbatim() {
        int line = lineAt(pos);
        int end = text.indexOf(VERBATIM_END, pos);
        if (end < 0) {
            throw LatexSyntaxException.unterminated("verbatim", line, sourceName);
        }
        String content = text.substring(pos, end);
        if (content.startsWith("\n")) {
            content = content.substring(1);
        } else if (content.startsWith(" \n")) {
            content = content.substring(2);
        }
        pos = end;
        return new Lexeme(LexemeKind.VERBATIM, content, line, false);
    }

    private Lexeme readText(boolean mathMode, boolean whitespaceBefore) {
        int start = pos;
        int line = lineAt(start);
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (isStopCharacter(c, mathMode) && pos > start) {
                break;
            }
            if (c == '\n' && paragraphBreaks && !mathMode && blankLineFollows(pos)) {
                break;
            }
            pos++;
        }
        // Trailing whitespace belongs to whatever comes next
        int end = pos;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        pos = end;
        String run = text.substring(start, end).replaceAll("\\s+", " ");
        return new Lexeme(LexemeKind.TEXT, run, line, whitespaceBefore);
    }

    private static boolean isStopCharacter(char c, boolean mathMode) {
        switch (c) {
            case '\\':
            case '$':
            case '{':
            case '}':
            case '%':
            case '&':
                return true;
            case '^':
            case '_':
                return mathMode;
            default:
                return false;
        }
    }

    private boolean blankLineFollows(int newlineIndex) {
        int i = newlineIndex + 1;
        while (i < text.length() && text.charAt(i) != '\n' && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i < text.length() && text.charAt(i) == '\n';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
