package im.arun.texmml.tree;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.lexer.LatexTokenizer;
import im.arun.texmml.lexer.Lexeme;
import im.arun.texmml.lexer.LexemeKind;
import im.arun.texmml.lexer.MathTextSegmenter;
import im.arun.texmml.lexer.Preformatter;
import im.arun.texmml.lexer.RawGroup;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionOptions;
import im.arun.texmml.model.ExpressionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns LaTeX source into expression nodes.
 *
 * <p>Lexemes are read one at a time; every group they carry (command arguments,
 * brace groups, math spans, script arguments) is parsed recursively from its
 * raw text. Math mode is switched on by math spans, scripts and math
 * environments such as {@code equation}, and switched off again for the
 * arguments of text commands such as {@code \text}.
 */
public class ExpressionTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionTreeBuilder.class);

    private static final Pattern KEY_VALUE_OPTIONS = Pattern.compile(
            "\\s*[\\w.\\-]+\\s*(=[^,=]*)?(\\s*,\\s*[\\w.\\-]+\\s*(=[^,=]*)?)*\\s*,?\\s*");

    /**
     * Parses a whole file. The preformatting rules are applied first and blank lines
     * become paragraph breaks.
     */
    public Expression parseDocument(String source, String sourceName) {
        Expression root = Expression.root();
        root.setGroup(0, parseFile(source, sourceName));
        return root;
    }

    /** Parses a whole file into the top-level sequence of nodes without wrapping it in a root. */
    public List<Expression> parseFile(String source, String sourceName) {
        String preformatted = Preformatter.apply(source);
        logger.debug("Parsing {} ({} characters)", sourceName, preformatted.length());
        return build(new LatexTokenizer(preformatted, sourceName, 1, true), false, sourceName);
    }

    /**
     * Parses a piece of source found inside a group, a macro body or a bibliography field.
     */
    public List<Expression> parseFragment(String fragment, boolean mathMode, int firstLine, String sourceName) {
        return build(new LatexTokenizer(fragment, sourceName, firstLine, false), mathMode, sourceName);
    }

    private List<Expression> build(LatexTokenizer tokenizer, boolean baseMathMode, String sourceName) {
        List<Expression> result = new ArrayList<>();
        Deque<String> mathEnvironments = new ArrayDeque<>();
        Lexeme lexeme;
        while ((lexeme = tokenizer.next(baseMathMode || !mathEnvironments.isEmpty())) != null) {
            boolean mathMode = baseMathMode || !mathEnvironments.isEmpty();
            switch (lexeme.getKind()) {
                case COMMAND:
                    result.add(buildCommand(lexeme, mathMode, mathEnvironments, sourceName));
                    break;
                case TEXT:
                    if (mathMode && lexeme.getText().length() > 1) {
                        result.addAll(MathTextSegmenter.segment(
                                lexeme.getText(), lexeme.getLine(), lexeme.isWhitespaceBefore()));
                    } else {
                        result.add(leaf(ExpressionType.PLAIN_TEXT, lexeme.getText(), mathMode, lexeme));
                    }
                    break;
                case BRACE_GROUP: {
                    Expression block = leaf(ExpressionType.BLOCK, "{}", mathMode, lexeme);
                    RawGroup content = lexeme.content();
                    block.addGroup(parseFragment(content.getText(), mathMode, content.getLine(), sourceName));
                    result.add(block);
                    break;
                }
                case INLINE_MATH:
                case BLOCK_MATH: {
                    ExpressionType type = lexeme.getKind() == LexemeKind.INLINE_MATH
                            ? ExpressionType.INLINE_MATH
                            : ExpressionType.BLOCK_MATH;
                    Expression math = leaf(type, lexeme.getText(), true, lexeme);
                    RawGroup content = lexeme.content();
                    math.addGroup(parseFragment(content.getText(), true, content.getLine(), sourceName));
                    Expression altText = Expression.plainText(content.getText().trim(), false);
                    altText.setLine(content.getLine());
                    math.addGroup(List.of(altText));
                    result.add(math);
                    break;
                }
                case SCRIPT: {
                    Expression script = leaf(ExpressionType.BLOCK, lexeme.getText(), true, lexeme);
                    RawGroup argument = lexeme.content();
                    script.addGroup(parseFragment(argument.getText(), true, argument.getLine(), sourceName));
                    result.add(script);
                    break;
                }
                case COMMENT:
                    result.add(leaf(ExpressionType.COMMENT, lexeme.getText(), mathMode, lexeme));
                    break;
                case VERBATIM:
                    result.add(leaf(ExpressionType.VERBATIM, lexeme.getText(), false, lexeme));
                    break;
                case CELL_SEPARATOR:
                    result.add(leaf(ExpressionType.PLAIN_TEXT, "&", mathMode, lexeme));
                    break;
                case PARAGRAPH_BREAK:
                    result.add(leaf(ExpressionType.COMMAND, "paragraph", false, lexeme));
                    break;
                default:
                    throw new IllegalStateException("Unhandled lexeme " + lexeme);
            }
        }
        return result;
    }

    private Expression buildCommand(Lexeme lexeme, boolean mathMode, Deque<String> mathEnvironments,
                                    String sourceName) {
        String name = lexeme.getText();
        Expression command = leaf(ExpressionType.COMMAND, name, mathMode, lexeme);

        // Environment boundaries switch math mode for what follows
        if (("begin".equals(name) || "end".equals(name)) && !lexeme.getArguments().isEmpty()) {
            String environment = lexeme.getArguments().get(0).getText().trim();
            if ("begin".equals(name) && ConstructCatalog.isMathEnvironment(environment)) {
                if (!mathMode) {
                    mathEnvironments.push(environment);
                }
                command.setMathMode(true);
            } else if ("end".equals(name) && !mathEnvironments.isEmpty()
                    && mathEnvironments.peek().equals(environment)) {
                mathEnvironments.pop();
            }
        }

        boolean literal = ConstructCatalog.LITERAL_ARGUMENT_COMMANDS.contains(name);
        boolean argumentMath = command.isMathMode() && !ConstructCatalog.TEXT_ARGUMENT_COMMANDS.contains(name);
        for (RawGroup argument : lexeme.getArguments()) {
            command.addRawArgument(argument.getText());
            if (literal) {
                Expression text = Expression.plainText(argument.getText().trim(), false);
                text.setLine(argument.getLine());
                command.addGroup(List.of(text));
            } else {
                command.addGroup(parseFragment(argument.getText(), argumentMath, argument.getLine(), sourceName));
            }
        }

        for (RawGroup option : lexeme.getOptions()) {
            command.addRawOption(option.getText());
        }
        if (!lexeme.getOptions().isEmpty()) {
            RawGroup first = lexeme.getOptions().get(0);
            command.setOptions(parseOptions(first, command.isMathMode(), sourceName));
        }
        return command;
    }

    /**
     * A comma separated list of {@code key} or {@code key=value} items becomes a key-value
     * mapping; anything else is parsed as expressions.
     */
    ExpressionOptions parseOptions(RawGroup option, boolean mathMode, String sourceName) {
        String raw = option.getText();
        boolean keyValueShape = (raw.indexOf('=') >= 0 || raw.indexOf(',') >= 0)
                && KEY_VALUE_OPTIONS.matcher(raw).matches();
        if (keyValueShape) {
            Map<String, String> values = new LinkedHashMap<>();
            for (String item : raw.split(",")) {
                if (item.isBlank()) {
                    continue;
                }
                int eq = item.indexOf('=');
                String key = (eq < 0 ? item : item.substring(0, eq)).trim();
                String value = eq < 0 ? "" : item.substring(eq + 1).trim();
                values.putIfAbsent(key, value);
            }
            return ExpressionOptions.ofKeyValues(raw, values);
        }
        return ExpressionOptions.ofExpressions(raw, parseFragment(raw, mathMode, option.getLine(), sourceName));
    }

    private static Expression leaf(ExpressionType type, String name, boolean mathMode, Lexeme lexeme) {
        Expression expression = new Expression(type, name, mathMode);
        expression.setLine(lexeme.getLine());
        expression.setWhitespaceBefore(lexeme.isWhitespaceBefore());
        return expression;
    }
}
