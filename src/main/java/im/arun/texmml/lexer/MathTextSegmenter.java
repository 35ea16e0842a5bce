package im.arun.texmml.lexer;

import im.arun.texmml.catalog.ConstructCatalog;
import im.arun.texmml.model.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a run of math text into per-symbol tokens: letter runs, numbers, macro
 * parameter placeholders ({@code #1}) and single punctuation characters. An
 * {@code InvisibleTimes} command is placed wherever two tokens meet as an
 * implicit product, e.g. {@code 2x(} becomes {@code 2}, marker, {@code x}, marker, {@code (}.
 */
public final class MathTextSegmenter {

    private enum TokenClass {
        LETTER,
        DIGIT,
        OPEN,
        CLOSE,
        OTHER
    }

    private MathTextSegmenter() {
    }

    public static List<Expression> segment(String run, int line, boolean whitespaceBefore) {
        List<Expression> result = new ArrayList<>();
        TokenClass previous = null;
        boolean pendingSpace = whitespaceBefore;
        int i = 0;
        while (i < run.length()) {
            char c = run.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                i++;
                continue;
            }

            int end = tokenEnd(run, i);
            String token = run.substring(i, end);
            TokenClass current = classify(token);
            if (previous != null && isImplicitProduct(previous, current)) {
                Expression marker = Expression.command(ConstructCatalog.INVISIBLE_TIMES, true);
                marker.setLine(line);
                result.add(marker);
            }
            Expression node = Expression.plainText(token, true);
            node.setLine(line);
            node.setWhitespaceBefore(pendingSpace);
            result.add(node);

            pendingSpace = false;
            previous = current;
            i = end;
        }
        return result;
    }

    private static int tokenEnd(String run, int start) {
        char c = run.charAt(start);
        int i = start + 1;
        if (Character.isLetter(c)) {
            while (i < run.length() && Character.isLetter(run.charAt(i))) {
                i++;
            }
        } else if (Character.isDigit(c)) {
            while (i < run.length() && Character.isDigit(run.charAt(i))) {
                i++;
            }
            if (i + 1 < run.length() && run.charAt(i) == '.' && Character.isDigit(run.charAt(i + 1))) {
                i++;
                while (i < run.length() && Character.isDigit(run.charAt(i))) {
                    i++;
                }
            }
        } else if (c == '#') {
            while (i < run.length() && Character.isDigit(run.charAt(i))) {
                i++;
            }
        } else if ((c == '<' || c == '>') && i < run.length() && run.charAt(i) == '=') {
            i++;
        } else if (Character.isHighSurrogate(c) && i < run.length()) {
            i++;
        }
        return i;
    }

    private static TokenClass classify(String token) {
        char c = token.charAt(0);
        if (Character.isLetter(c) || (c == '#' && token.length() > 1)) {
            return TokenClass.LETTER;
        }
        if (Character.isDigit(c)) {
            return TokenClass.DIGIT;
        }
        if (c == '(') {
            return TokenClass.OPEN;
        }
        if (c == ')') {
            return TokenClass.CLOSE;
        }
        return TokenClass.OTHER;
    }

    private static boolean isImplicitProduct(TokenClass left, TokenClass right) {
        boolean leftOperand = left == TokenClass.LETTER || left == TokenClass.DIGIT || left == TokenClass.CLOSE;
        boolean rightOperand = right == TokenClass.LETTER || right == TokenClass.DIGIT || right == TokenClass.OPEN;
        return leftOperand && rightOperand && !(left == TokenClass.DIGIT && right == TokenClass.DIGIT);
    }
}
