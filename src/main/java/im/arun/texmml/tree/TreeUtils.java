package im.arun.texmml.tree;

import im.arun.texmml.model.Expression;
import im.arun.texmml.model.ExpressionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Traversal and lookup helpers shared by the rewrite passes.
 */
public class TreeUtils {

    /**
     * Visits {@code node} and every node below it in document order, option expressions
     * before argument groups. The alt-text group of math spans is not visited.
     */
    public static void walk(Expression node, Consumer<Expression> visitor) {
        visitor.accept(node);
        for (int g : contentGroups(node)) {
            // Copy so the visitor may rewrite the group it is standing in
            for (Expression child : new ArrayList<>(node.group(g))) {
                walk(child, visitor);
            }
        }
    }

    /** Every node matching {@code predicate}, in document order. */
    public static List<Expression> collect(Expression node, Predicate<Expression> predicate) {
        List<Expression> found = new ArrayList<>();
        walk(node, expression -> {
            if (predicate.test(expression)) {
                found.add(expression);
            }
        });
        return found;
    }

    public static int countNodes(Expression node) {
        int[] count = {0};
        walk(node, expression -> count[0]++);
        return count[0];
    }

    /**
     * Indices of the groups holding parsed content, in document order: {@link Expression#OPTIONS_GROUP}
     * first when the options are an expression list, then the argument and body groups.
     */
    public static List<Integer> contentGroups(Expression node) {
        int count = contentGroupCount(node);
        List<Integer> indices = new ArrayList<>(count + 1);
        if (node.hasOptionExpressions()) {
            indices.add(Expression.OPTIONS_GROUP);
        }
        for (int g = 0; g < count; g++) {
            indices.add(g);
        }
        return indices;
    }

    /** Number of groups holding parsed content; math spans keep their alt-text in a trailing group. */
    public static int contentGroupCount(Expression node) {
        if (isMath(node)) {
            return Math.min(1, node.groupCount());
        }
        return node.groupCount();
    }

    public static boolean isMath(Expression node) {
        return node.is(ExpressionType.INLINE_MATH) || node.is(ExpressionType.BLOCK_MATH);
    }

    /**
     * Concatenates the plain text below the given nodes in document order, with a single
     * space wherever a node was preceded by whitespace.
     */
    public static String flattenText(List<Expression> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Expression node : nodes) {
            appendText(node, sb);
        }
        return sb.toString();
    }

    private static void appendText(Expression node, StringBuilder sb) {
        if (node.isWhitespaceBefore() && sb.length() > 0 && sb.charAt(sb.length() - 1) != ' ') {
            sb.append(' ');
        }
        if (node.is(ExpressionType.PLAIN_TEXT)) {
            sb.append(node.getName());
            return;
        }
        int groups = contentGroupCount(node);
        for (int g = 0; g < groups; g++) {
            for (Expression child : node.group(g)) {
                appendText(child, sb);
            }
        }
    }

    /** Text of the given group of a command, e.g. the environment name of {@code \begin}. */
    public static String argumentText(Expression command, int group) {
        return command.hasGroup(group) ? flattenText(command.group(group)).trim() : "";
    }

    /** The {@code document} block, searching the top level of the root. */
    public static Optional<Expression> findDocument(Expression root) {
        if (root.groupCount() == 0) {
            return Optional.empty();
        }
        for (Expression child : root.group(0)) {
            if (child.isBlock("document")) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /** Index of the group holding the body of an encapsulated environment. */
    public static int bodyGroup(Expression block) {
        return block.groupCount() - 1;
    }

    /** The nearest ancestor matching {@code predicate}. */
    public static Optional<Expression> findAncestor(Expression node, Predicate<Expression> predicate) {
        Expression current = node.getParent();
        while (current != null) {
            if (predicate.test(current)) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * Checks that every node's parent, group index and index in group match its actual
     * position. Throws {@link IllegalStateException} naming the first offending node.
     */
    public static void checkInvariants(Expression root) {
        checkNode(root);
    }

    private static void checkNode(Expression node) {
        List<Integer> indices = new ArrayList<>();
        if (node.hasOptionExpressions()) {
            indices.add(Expression.OPTIONS_GROUP);
        }
        for (int g = 0; g < node.groupCount(); g++) {
            indices.add(g);
        }
        for (int g : indices) {
            List<Expression> group = node.group(g);
            for (int i = 0; i < group.size(); i++) {
                Expression child = group.get(i);
                if (child.getParent() != node || child.getGroupIndex() != g || child.getIndexInGroup() != i) {
                    throw new IllegalStateException(String.format(
                            "Node %s at [%d][%d] of %s reports position [%d][%d] under %s",
                            child, g, i, describe(node), child.getGroupIndex(), child.getIndexInGroup(),
                            child.getParent() == null ? "no parent" : describe(child.getParent())));
                }
                checkNode(child);
            }
        }
    }

    private static String describe(Expression node) {
        return node.getType() + "(" + node.getName() + ")";
    }
}
