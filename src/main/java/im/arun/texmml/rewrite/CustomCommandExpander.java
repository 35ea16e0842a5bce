package im.arun.texmml.rewrite;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.context.ConversionContext;
import im.arun.texmml.error.LatexConversionException;
import im.arun.texmml.model.Diagnostic;
import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;
import im.arun.texmml.model.MacroDefinition;
import im.arun.texmml.tree.ExpressionTreeBuilder;
import im.arun.texmml.tree.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registers {@code \newcommand}, {@code \renewcommand} and {@code \providecommand}
 * definitions and expands later uses of the defined macros.
 *
 * <p>Definitions and uses are found by the same walk, so a macro is only known
 * after its definition. The body is parsed again at every call site, in the
 * call site's math mode, and the {@code #k} placeholders in its text are replaced
 * by copies of the call's argument groups. Macros appearing in the result are
 * expanded in turn, up to the configured depth.
 */
public class CustomCommandExpander implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(CustomCommandExpander.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("#(\\d)");

    private final ExpressionTreeBuilder builder;
    private final int maxExpansionDepth;

    public CustomCommandExpander(ExpressionTreeBuilder builder, int maxExpansionDepth) {
        this.builder = builder;
        this.maxExpansionDepth = maxExpansionDepth;
    }

    @Override
    public String getName() {
        return "RecursiveParseCustomCommands";
    }

    @Override
    public void apply(Expression root, ConversionContext context) {
        expandGroups(root, context, 0);
        logger.info("Known macros after expansion: {}", context.getMacros().keySet());
    }

    private void expandGroups(Expression node, ConversionContext context, int depth) {
        for (int g : TreeUtils.contentGroups(node)) {
            expandSequence(node, g, context, depth);
        }
    }

    private void expandSequence(Expression parent, int group, ConversionContext context, int depth) {
        int i = 0;
        while (i < parent.group(group).size()) {
            Expression child = parent.group(group).get(i);
            if (child.is(ExpressionType.COMMAND) && ConstructCatalog.DEFINITION_COMMANDS.contains(child.getName())) {
                register(child, context);
                i++;
                continue;
            }
            Optional<MacroDefinition> definition = child.is(ExpressionType.COMMAND)
                    ? context.findMacro(child.getName())
                    : Optional.empty();
            if (definition.isPresent()) {
                List<Expression> expansion = expand(child, definition.get(), context, depth);
                child.replaceWith(expansion);
                i += expansion.size();
                continue;
            }
            expandGroups(child, context, depth);
            i++;
        }
    }

    // Definitions

    private void register(Expression definitionCommand, ConversionContext context) {
        String kind = definitionCommand.getName();
        Expression source = definitionCommand;
        String macroName;
        String body;
        int bodyIndex;

        if (definitionCommand.groupCount() >= 2) {
            macroName = stripBackslash(definitionCommand.getRawArguments().get(0));
            bodyIndex = 1;
        } else if (definitionCommand.groupCount() == 0
                && definitionCommand.nextSibling().filter(s -> s.is(ExpressionType.COMMAND)).isPresent()) {
            // \newcommand\name[n]{body}: the name was read as a command of its own
            source = definitionCommand.nextSibling().get();
            macroName = source.getName();
            bodyIndex = 0;
            source.removeFromParent();
        } else {
            malformed(definitionCommand, context, "expected a name and a body");
            return;
        }
        if (source.getRawArguments().size() <= bodyIndex || macroName.isEmpty()) {
            malformed(definitionCommand, context, "expected a name and a body");
            return;
        }
        body = source.getRawArguments().get(bodyIndex);

        List<String> options = source.getRawOptions();
        int arity = 0;
        if (!options.isEmpty()) {
            try {
                arity = Integer.parseInt(options.get(0).trim());
            } catch (NumberFormatException e) {
                malformed(definitionCommand, context, "parameter count is not a number: " + options.get(0));
                return;
            }
            if (arity < 0 || arity > 9) {
                malformed(definitionCommand, context, "parameter count out of range: " + arity);
                return;
            }
        }
        String defaultArgument = options.size() > 1 && arity > 0 ? options.get(1) : null;

        boolean exists = context.findMacro(macroName).isPresent();
        if (exists && !"renewcommand".equals(kind)) {
            logger.warn("\\{} does not redefine existing macro \\{} (line {})",
                    kind, macroName, definitionCommand.getLine());
            return;
        }
        context.defineMacro(new MacroDefinition(macroName, arity, defaultArgument, body, definitionCommand.getLine()));
        logger.debug("Registered macro \\{} with {} parameter(s)", macroName, arity);
    }

    private static String stripBackslash(String raw) {
        String name = raw.trim();
        return name.startsWith("\\") ? name.substring(1).trim() : name;
    }

    private static void malformed(Expression command, ConversionContext context, String detail) {
        logger.warn("Malformed \\{} at line {}: {}", command.getName(), command.getLine(), detail);
        context.report(Diagnostic.Kind.MALFORMED_DEFINITION, command.getName(), detail, command.getLine());
    }

    // Expansion

    private List<Expression> expand(Expression invocation, MacroDefinition definition, ConversionContext context,
                                    int depth) {
        if (depth >= maxExpansionDepth) {
            throw new LatexConversionException(String.format(
                    "Macro \\%s nests deeper than %d expansions at line %d",
                    definition.getName(), maxExpansionDepth, invocation.getLine()));
        }

        boolean mathMode = invocation.isMathMode();
        Expression holder = Expression.root();
        holder.setGroup(0, builder.parseFragment(definition.getBody(), mathMode, invocation.getLine(), null));

        int consumedGroups = 0;
        if (definition.getArity() > 0) {
            List<Argument> arguments = new ArrayList<>();
            int remaining = definition.getArity();
            if (definition.hasOptionalFirstParameter()) {
                String value = invocation.getRawOptions().isEmpty()
                        ? definition.getDefaultArgument()
                        : invocation.getRawOptions().get(0);
                arguments.add(new Argument(value, null, mathMode));
                remaining--;
            }
            for (int k = 0; k < remaining; k++) {
                if (consumedGroups < invocation.groupCount()) {
                    arguments.add(new Argument(invocation.getRawArguments().get(consumedGroups),
                            invocation.group(consumedGroups), mathMode));
                    consumedGroups++;
                } else {
                    arguments.add(null);
                }
            }
            substitute(holder, arguments);
        } else if (invocation.groupCount() > 0 || invocation.getOptions().isPresent()) {
            relocateArguments(holder, invocation);
        }

        // Groups the macro did not take stay behind as plain brace groups
        for (int g = consumedGroups; g < invocation.groupCount(); g++) {
            Expression extra = Expression.block("{}", mathMode);
            extra.setLine(invocation.getLine());
            extra.addGroup(invocation.extractRange(g, 0, invocation.group(g).size()));
            holder.appendChild(0, extra);
        }

        expandGroups(holder, context, depth + 1);

        List<Expression> expansion = holder.extractRange(0, 0, holder.group(0).size());
        if (!expansion.isEmpty()) {
            expansion.get(0).setWhitespaceBefore(invocation.isWhitespaceBefore());
        }
        return expansion;
    }

    /** One actual parameter: its source text and, when it came from a group, the parsed nodes. */
    private static final class Argument {
        final String raw;
        final List<Expression> nodes;
        final boolean mathMode;

        Argument(String raw, List<Expression> nodes, boolean mathMode) {
            this.raw = raw;
            this.nodes = nodes;
            this.mathMode = mathMode;
        }
    }

    private void substitute(Expression node, List<Argument> arguments) {
        boolean literal = node.is(ExpressionType.COMMAND)
                && ConstructCatalog.LITERAL_ARGUMENT_COMMANDS.contains(node.getName());
        for (int r = 0; r < node.getRawArguments().size(); r++) {
            node.setRawArgument(r, replaceTextually(node.getRawArguments().get(r), arguments));
        }
        for (int r = 0; r < node.getRawOptions().size(); r++) {
            node.setRawOption(r, replaceTextually(node.getRawOptions().get(r), arguments));
        }
        for (int g : TreeUtils.contentGroups(node)) {
            int i = 0;
            while (i < node.group(g).size()) {
                Expression child = node.group(g).get(i);
                if (child.is(ExpressionType.PLAIN_TEXT) && PLACEHOLDER.matcher(child.getName()).find()) {
                    if (literal) {
                        child.setName(replaceTextually(child.getName(), arguments));
                        i++;
                    } else {
                        List<Expression> pieces = splice(child, arguments);
                        child.replaceWith(pieces);
                        i += pieces.size();
                    }
                } else {
                    substitute(child, arguments);
                    i++;
                }
            }
        }
    }

    /** Splits a text leaf around its placeholders, putting argument copies in between. */
    private List<Expression> splice(Expression text, List<Argument> arguments) {
        List<Expression> pieces = new ArrayList<>();
        String value = text.getName();
        Matcher matcher = PLACEHOLDER.matcher(value);
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                pieces.add(textPiece(text, value.substring(last, matcher.start()), pieces.isEmpty()));
            }
            int index = Integer.parseInt(matcher.group(1)) - 1;
            Argument argument = index >= 0 && index < arguments.size() ? arguments.get(index) : null;
            List<Expression> copies = instantiate(argument, text.isMathMode(), text.getLine());
            if (pieces.isEmpty() && !copies.isEmpty()) {
                copies.get(0).setWhitespaceBefore(text.isWhitespaceBefore());
            }
            pieces.addAll(copies);
            last = matcher.end();
        }
        if (last < value.length()) {
            pieces.add(textPiece(text, value.substring(last), pieces.isEmpty()));
        }
        return pieces;
    }

    private static Expression textPiece(Expression original, String value, boolean first) {
        Expression piece = Expression.plainText(value, original.isMathMode());
        piece.setLine(original.getLine());
        piece.setWhitespaceBefore(first && original.isWhitespaceBefore());
        return piece;
    }

    private List<Expression> instantiate(Argument argument, boolean mathMode, int line) {
        List<Expression> copies = new ArrayList<>();
        if (argument == null) {
            return copies;
        }
        if (argument.nodes != null && argument.mathMode == mathMode) {
            for (Expression node : argument.nodes) {
                copies.add(node.deepCopy());
            }
            return copies;
        }
        copies.addAll(builder.parseFragment(argument.raw, mathMode, line, null));
        return copies;
    }

    private static String replaceTextually(String value, List<Argument> arguments) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1)) - 1;
            Argument argument = index >= 0 && index < arguments.size() ? arguments.get(index) : null;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(argument == null ? "" : argument.raw.trim()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    // Parameterless macros called with arguments

    /**
     * A macro declared without parameters but called with groups or options hands them
     * to the last command of its body, e.g. {@code \newcommand{\R}{\mathbb}} called as
     * {@code \R{R}}. When that command is followed by {@code ^} or {@code _} scripts the
     * group contents are placed after the scripts instead, so {@code \int_a^b} style
     * bodies keep their limits. Without any command in the body the groups are left as
     * brace groups after the expansion.
     */
    private void relocateArguments(Expression holder, Expression invocation) {
        Expression handler = findLastCommand(holder.group(0));
        if (handler == null) {
            logger.debug("No command in the body of \\{} to take its arguments", invocation.getName());
            return;
        }

        Expression anchor = handler;
        for (int k = 0; k < 2; k++) {
            Optional<Expression> next = anchor.nextSibling();
            if (next.isPresent() && isRawScript(next.get())) {
                anchor = next.get();
            } else {
                break;
            }
        }

        if (anchor != handler) {
            List<Expression> moved = new ArrayList<>();
            while (invocation.groupCount() > 0) {
                moved.addAll(invocation.removeGroup(0));
            }
            anchor.getParent().insertChildren(anchor.getGroupIndex(), anchor.getIndexInGroup() + 1, moved);
            return;
        }

        int groups = invocation.groupCount();
        for (int g = 0; g < groups; g++) {
            handler.addRawArgument(invocation.getRawArguments().get(g));
            handler.addGroup(invocation.extractRange(g, 0, invocation.group(g).size()));
        }
        while (invocation.groupCount() > 0) {
            invocation.removeGroup(0);
        }
        if (handler.getOptions().isEmpty() && invocation.getOptions().isPresent()) {
            invocation.getRawOptions().forEach(handler::addRawOption);
            handler.setOptions(invocation.getOptions().get());
            invocation.setOptions(null);
        }
    }

    private static Expression findLastCommand(List<Expression> sequence) {
        for (int i = sequence.size() - 1; i >= 0; i--) {
            Expression node = sequence.get(i);
            if (node.is(ExpressionType.COMMAND) && !ConstructCatalog.INVISIBLE_TIMES.equals(node.getName())) {
                return node;
            }
            if (node.is(ExpressionType.BLOCK) || TreeUtils.isMath(node)) {
                for (int g = TreeUtils.contentGroupCount(node) - 1; g >= 0; g--) {
                    Expression found = findLastCommand(node.group(g));
                    if (found != null) {
                        return found;
                    }
                }
            }
        }
        return null;
    }

    private static boolean isRawScript(Expression node) {
        return node.isBlock("^") || node.isBlock("_");
    }
}
