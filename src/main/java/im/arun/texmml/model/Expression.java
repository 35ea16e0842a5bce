package im.arun.texmml.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the parsed document tree.
 *
 * <p>A node owns an ordered list of children groups (one per argument or content
 * slot) and keeps a back-reference to its parent together with its coordinates
 * in the parent: the group it sits in and its index inside that group. Every
 * structural mutation goes through the methods of this class, which keep those
 * coordinates in sync with the actual position of each child.
 */
public class Expression {
    /**
     * Group index of the expressions that live in a node's options rather than its groups.
     * The group methods accept it wherever the options hold expressions.
     */
    public static final int OPTIONS_GROUP = -1;

    @Getter
    private final ExpressionType type;
    @Getter @Setter
    private String name;
    @Getter @Setter
    private Object tag;
    @Getter @Setter
    private boolean mathMode;
    @Getter @Setter
    private boolean whitespaceBefore;
    @Getter @Setter
    private int line;

    private ExpressionOptions options;
    private final List<List<Expression>> groups = new ArrayList<>();
    private final List<String> rawArguments = new ArrayList<>();
    private final List<String> rawOptions = new ArrayList<>();

    @Getter
    private Expression parent;
    @Getter
    private int groupIndex = -1;
    @Getter
    private int indexInGroup = -1;

    public Expression(ExpressionType type, String name, boolean mathMode) {
        this.type = Objects.requireNonNull(type);
        this.name = name == null ? "" : name;
        this.mathMode = mathMode;
    }

    public static Expression root() {
        Expression root = new Expression(ExpressionType.ROOT, "", false);
        root.addGroup(new ArrayList<>());
        return root;
    }

    public static Expression plainText(String text, boolean mathMode) {
        return new Expression(ExpressionType.PLAIN_TEXT, text, mathMode);
    }

    public static Expression command(String name, boolean mathMode) {
        return new Expression(ExpressionType.COMMAND, name, mathMode);
    }

    public static Expression block(String name, boolean mathMode) {
        return new Expression(ExpressionType.BLOCK, name, mathMode);
    }

    public boolean is(ExpressionType expected) {
        return type == expected;
    }

    public boolean isCommand(String commandName) {
        return type == ExpressionType.COMMAND && name.equals(commandName);
    }

    public boolean isBlock(String blockName) {
        return type == ExpressionType.BLOCK && name.equals(blockName);
    }

    public <T> Optional<T> tagAs(Class<T> tagType) {
        return tagType.isInstance(tag) ? Optional.of(tagType.cast(tag)) : Optional.empty();
    }

    // Options

    public Optional<ExpressionOptions> getOptions() {
        return Optional.ofNullable(options);
    }

    public void setOptions(ExpressionOptions newOptions) {
        this.options = newOptions;
        if (newOptions != null) {
            List<Expression> expressions = newOptions.getExpressions();
            for (int i = 0; i < expressions.size(); i++) {
                Expression expression = expressions.get(i);
                expression.parent = this;
                expression.groupIndex = OPTIONS_GROUP;
                expression.indexInGroup = i;
            }
        }
    }

    /** True when the options hold an expression list, addressable as {@link #OPTIONS_GROUP}. */
    public boolean hasOptionExpressions() {
        return options != null && !options.isKeyValue();
    }

    public List<String> getRawArguments() {
        return Collections.unmodifiableList(rawArguments);
    }

    public void addRawArgument(String raw) {
        rawArguments.add(raw);
    }

    public void setRawArgument(int index, String raw) {
        rawArguments.set(index, raw);
    }

    public List<String> getRawOptions() {
        return Collections.unmodifiableList(rawOptions);
    }

    public void addRawOption(String raw) {
        rawOptions.add(raw);
    }

    public void setRawOption(int index, String raw) {
        rawOptions.set(index, raw);
    }

    // Groups

    public int groupCount() {
        return groups.size();
    }

    public boolean hasGroup(int index) {
        if (index == OPTIONS_GROUP) {
            return hasOptionExpressions();
        }
        return index >= 0 && index < groups.size();
    }

    public List<Expression> group(int index) {
        return Collections.unmodifiableList(slot(index));
    }

    private List<Expression> slot(int index) {
        if (index == OPTIONS_GROUP) {
            if (options == null) {
                throw new IllegalStateException("Node has no options: " + this);
            }
            return options.expressionSlot();
        }
        return groups.get(index);
    }

    /** The group at {@code index}, or an empty list when the node has fewer groups. */
    public List<Expression> groupOrEmpty(int index) {
        return hasGroup(index) ? group(index) : Collections.emptyList();
    }

    public List<List<Expression>> getGroups() {
        List<List<Expression>> view = new ArrayList<>(groups.size());
        for (List<Expression> group : groups) {
            view.add(Collections.unmodifiableList(group));
        }
        return Collections.unmodifiableList(view);
    }

    public List<Expression> lastGroup() {
        return group(groups.size() - 1);
    }

    public int addGroup(List<Expression> children) {
        groups.add(new ArrayList<>());
        int index = groups.size() - 1;
        insertChildren(index, 0, children);
        return index;
    }

    public void insertGroup(int index, List<Expression> children) {
        groups.add(index, new ArrayList<>());
        renumberGroupsFrom(index + 1);
        insertChildren(index, 0, children);
    }

    /** Removes a whole group, detaching its children, and returns them. */
    public List<Expression> removeGroup(int index) {
        List<Expression> removed = groups.remove(index);
        for (Expression child : removed) {
            child.detach();
        }
        renumberGroupsFrom(index);
        return removed;
    }

    public void setGroup(int index, List<Expression> children) {
        List<Expression> target = slot(index);
        replaceRange(index, 0, target.size(), children);
    }

    public void appendChild(int groupIndex, Expression child) {
        insertChildren(groupIndex, slot(groupIndex).size(), List.of(child));
    }

    public void insertChildren(int groupIndex, int index, List<Expression> children) {
        replaceRange(groupIndex, index, index, children);
    }

    public Expression removeChild(int groupIndex, int index) {
        return extractRange(groupIndex, index, index + 1).get(0);
    }

    /** Removes children {@code [from, to)} of a group, detaches them and returns them in order. */
    public List<Expression> extractRange(int groupIndex, int from, int to) {
        List<Expression> target = slot(groupIndex);
        List<Expression> slice = target.subList(from, to);
        List<Expression> removed = new ArrayList<>(slice);
        slice.clear();
        for (Expression child : removed) {
            child.detach();
        }
        renumber(groupIndex, from);
        return removed;
    }

    /**
     * Replaces children {@code [from, to)} of a group with {@code replacement}. Nodes of the
     * replacement still attached somewhere else are detached from their old position first.
     */
    public void replaceRange(int groupIndex, int from, int to, List<Expression> replacement) {
        List<Expression> target = slot(groupIndex);
        List<Expression> incoming = new ArrayList<>(replacement);
        if (to > from) {
            extractRange(groupIndex, from, to);
        }
        for (Expression child : incoming) {
            if (child.isAttached()) {
                if (child.parent == this && child.groupIndex == groupIndex) {
                    throw new IllegalStateException("Cannot move a node within the group being replaced: " + child);
                }
                child.removeFromParent();
            }
        }
        target.addAll(from, incoming);
        for (Expression child : incoming) {
            child.parent = this;
        }
        renumber(groupIndex, from);
    }

    public void removeFromParent() {
        if (isAttached()) {
            parent.extractRange(groupIndex, indexInGroup, indexInGroup + 1);
        } else {
            detach();
        }
    }

    /** Puts {@code replacement} where this node is and detaches this node. */
    public void replaceWith(List<Expression> replacement) {
        if (!isAttached()) {
            throw new IllegalStateException("Node is not attached to a parent: " + this);
        }
        parent.replaceRange(groupIndex, indexInGroup, indexInGroup + 1, replacement);
    }

    public Optional<Expression> nextSibling() {
        return sibling(1);
    }

    public Optional<Expression> previousSibling() {
        return sibling(-1);
    }

    private Optional<Expression> sibling(int offset) {
        if (!isAttached()) {
            return Optional.empty();
        }
        List<Expression> siblings = parent.slot(groupIndex);
        int index = indexInGroup + offset;
        return index >= 0 && index < siblings.size() ? Optional.of(siblings.get(index)) : Optional.empty();
    }

    public boolean isAttached() {
        if (parent == null || !parent.hasGroup(groupIndex)) {
            return false;
        }
        List<Expression> siblings = parent.slot(groupIndex);
        return indexInGroup >= 0 && indexInGroup < siblings.size() && siblings.get(indexInGroup) == this;
    }

    private void detach() {
        parent = null;
        groupIndex = -1;
        indexInGroup = -1;
    }

    private void renumber(int groupIndex, int from) {
        List<Expression> target = slot(groupIndex);
        for (int i = from; i < target.size(); i++) {
            Expression child = target.get(i);
            child.parent = this;
            child.groupIndex = groupIndex;
            child.indexInGroup = i;
        }
    }

    private void renumberGroupsFrom(int firstGroup) {
        for (int g = firstGroup; g < groups.size(); g++) {
            renumber(g, 0);
        }
    }

    // Copies and bulk updates

    /** An independent copy of this subtree; the copy has no parent. */
    public Expression deepCopy() {
        Expression copy = new Expression(type, name, mathMode);
        copy.tag = tag;
        copy.whitespaceBefore = whitespaceBefore;
        copy.line = line;
        copy.rawArguments.addAll(rawArguments);
        copy.rawOptions.addAll(rawOptions);
        if (options != null) {
            copy.setOptions(options.copy());
        }
        for (List<Expression> group : groups) {
            List<Expression> children = new ArrayList<>(group.size());
            for (Expression child : group) {
                children.add(child.deepCopy());
            }
            copy.addGroup(children);
        }
        return copy;
    }

    public void setMathModeRecursive(boolean value) {
        mathMode = value;
        if (hasOptionExpressions()) {
            for (Expression child : options.getExpressions()) {
                child.setMathModeRecursive(value);
            }
        }
        for (List<Expression> group : groups) {
            for (Expression child : group) {
                child.setMathModeRecursive(value);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        switch (type) {
            case PLAIN_TEXT:
                sb.append('"').append(name).append('"');
                break;
            case COMMAND:
                sb.append('\\').append(name);
                break;
            case COMMENT:
                sb.append('%').append(name);
                break;
            default:
                sb.append(type).append(name.isEmpty() ? "" : "(" + name + ")");
        }
        if (options != null) {
            sb.append(options);
        }
        for (List<Expression> group : groups) {
            sb.append(group);
        }
        return sb.toString();
    }
}
