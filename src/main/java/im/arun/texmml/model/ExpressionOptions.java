package im.arun.texmml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contents of a command's first {@code [...]} group.
 * Holds either a key-value mapping or a parsed expression list, never both;
 * callers must check {@link #isKeyValue()} before reading.
 */
public final class ExpressionOptions {
    private final String raw;
    private final Map<String, String> keyValues;
    private final List<Expression> expressions;

    private ExpressionOptions(String raw, Map<String, String> keyValues, List<Expression> expressions) {
        this.raw = raw;
        this.keyValues = keyValues;
        this.expressions = expressions;
    }

    public static ExpressionOptions ofKeyValues(String raw, Map<String, String> keyValues) {
        return new ExpressionOptions(raw, new LinkedHashMap<>(keyValues), null);
    }

    public static ExpressionOptions ofExpressions(String raw, List<Expression> expressions) {
        return new ExpressionOptions(raw, null, new ArrayList<>(expressions));
    }

    public boolean isKeyValue() {
        return keyValues != null;
    }

    public String getRaw() {
        return raw;
    }

    public Map<String, String> getKeyValues() {
        return keyValues == null ? Collections.emptyMap() : Collections.unmodifiableMap(keyValues);
    }

    public List<Expression> getExpressions() {
        return expressions == null ? Collections.emptyList() : Collections.unmodifiableList(expressions);
    }

    /** The backing expression list, mutated by {@link Expression} when passes rewrite option content. */
    List<Expression> expressionSlot() {
        if (expressions == null) {
            throw new IllegalStateException("Key-value options hold no expressions: " + this);
        }
        return expressions;
    }

    public Optional<String> get(String key) {
        return keyValues == null ? Optional.empty() : Optional.ofNullable(keyValues.get(key));
    }

    ExpressionOptions copy() {
        if (isKeyValue()) {
            return ofKeyValues(raw, keyValues);
        }
        List<Expression> copies = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            copies.add(expression.deepCopy());
        }
        return ofExpressions(raw, copies);
    }

    @Override
    public String toString() {
        return "[" + raw + "]";
    }
}
