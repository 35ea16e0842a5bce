package im.arun.texmml.bibliography;

import im.arun.texmml.model.BibliographyRecord;
import im.arun.texmml.model.Expression;
import im.arun.texmml.tree.ExpressionTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@code @type{key, field = value, ...}} records from the text of a {@code .bib} file.
 *
 * <p>Entry bodies may be delimited by braces or parentheses. Values may be braced,
 * quoted, numeric or bare words, and parts joined with {@code #} are concatenated.
 * {@code @comment}, {@code @string} and {@code @preamble} are skipped. Records are
 * numbered in the order they appear; when a key repeats, the first record wins.
 * Every field value is parsed into expression nodes so it may carry markup.
 */
public class BibtexParser {
    private static final Logger logger = LoggerFactory.getLogger(BibtexParser.class);

    private static final Set<String> SKIPPED_TYPES = Set.of("comment", "string", "preamble");

    private final ExpressionTreeBuilder builder;

    private String input;
    private String sourceName;
    private int pos;

    public BibtexParser(ExpressionTreeBuilder builder) {
        this.builder = builder;
    }

    public Map<String, BibliographyRecord> parse(String text, String sourceName) {
        return parse(text, sourceName, 1);
    }

    /** Parses {@code text}, numbering the records from {@code firstNumber}. */
    public Map<String, BibliographyRecord> parse(String text, String sourceName, int firstNumber) {
        this.input = text == null ? "" : text;
        this.sourceName = sourceName;
        this.pos = 0;

        Map<String, BibliographyRecord> records = new LinkedHashMap<>();
        int number = firstNumber;
        while (true) {
            int at = input.indexOf('@', pos);
            if (at < 0) {
                break;
            }
            pos = at + 1;
            skipWhitespace();
            String type = readWord().toLowerCase(Locale.ROOT);
            if (type.isEmpty()) {
                continue;
            }
            skipWhitespace();
            if (pos >= input.length() || (input.charAt(pos) != '{' && input.charAt(pos) != '(')) {
                continue;
            }
            char close = input.charAt(pos) == '{' ? '}' : ')';
            int bodyStart = pos + 1;
            int bodyEnd = findClosing(pos, input.charAt(pos), close);
            if (bodyEnd < 0) {
                logger.warn("Unclosed @{} entry at line {} in {}", type, lineAt(at), sourceName);
                break;
            }
            if (SKIPPED_TYPES.contains(type)) {
                pos = bodyEnd + 1;
                continue;
            }

            BibliographyRecord record = parseBody(type, bodyStart, bodyEnd);
            pos = bodyEnd + 1;
            if (record.getKey().isEmpty()) {
                logger.warn("@{} entry without key at line {} in {}", type, lineAt(at), sourceName);
                continue;
            }
            if (records.containsKey(record.getKey())) {
                logger.warn("Duplicate bibliography key '{}' at line {} in {}, keeping the first",
                        record.getKey(), lineAt(at), sourceName);
                continue;
            }
            record.setNumber(number++);
            records.put(record.getKey(), record);
        }
        logger.debug("Read {} bibliography record(s) from {}", records.size(), sourceName);
        return records;
    }

    private BibliographyRecord parseBody(String type, int start, int end) {
        BibliographyRecord record = new BibliographyRecord();
        record.setType(type);

        int comma = indexOfTopLevel(',', start, end);
        int keyEnd = comma < 0 ? end : comma;
        record.setKey(input.substring(start, keyEnd).trim());
        if (comma < 0) {
            return record;
        }

        pos = comma + 1;
        while (pos < end) {
            skipSeparators(end);
            if (pos >= end) {
                break;
            }
            String field = readWord().toLowerCase(Locale.ROOT);
            skipWhitespace();
            if (field.isEmpty() || pos >= end || input.charAt(pos) != '=') {
                // Not a field assignment; resume after the next comma
                int next = indexOfTopLevel(',', pos, end);
                pos = next < 0 ? end : next + 1;
                continue;
            }
            pos++;
            int valueLine = lineAt(pos);
            String value = readValue(end);
            record.getRawFields().putIfAbsent(field, value);
            if (!record.getFields().containsKey(field)) {
                List<Expression> parsed = builder.parseFragment(value, false, valueLine, sourceName);
                record.getFields().put(field, parsed);
            }
        }
        return record;
    }

    private String readValue(int end) {
        StringBuilder value = new StringBuilder();
        while (pos < end) {
            skipWhitespace();
            if (pos >= end) {
                break;
            }
            char c = input.charAt(pos);
            if (c == '{') {
                int close = findClosing(pos, '{', '}');
                close = close < 0 || close > end ? end : close;
                value.append(input, pos + 1, close);
                pos = Math.min(close + 1, end);
            } else if (c == '"') {
                int close = findClosingQuote(pos + 1, end);
                value.append(input, pos + 1, close);
                pos = Math.min(close + 1, end);
            } else {
                int wordStart = pos;
                while (pos < end && input.charAt(pos) != ',' && input.charAt(pos) != '#'
                        && !Character.isWhitespace(input.charAt(pos))) {
                    pos++;
                }
                value.append(input, wordStart, pos);
            }
            skipWhitespace();
            if (pos < end && input.charAt(pos) == '#') {
                pos++;
                continue;
            }
            break;
        }
        return value.toString().trim();
    }

    private int findClosing(int openIndex, char open, char close) {
        int depth = 0;
        boolean inQuotes = false;
        for (int i = openIndex; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"' && open == '(') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == open) {
                depth++;
            } else if (!inQuotes && c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private int findClosingQuote(int from, int end) {
        int depth = 0;
        for (int i = from; i < end; i++) {
            char c = input.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '"' && depth == 0) {
                return i;
            }
        }
        return end;
    }

    private int indexOfTopLevel(char target, int from, int end) {
        int depth = 0;
        boolean inQuotes = false;
        for (int i = from; i < end; i++) {
            char c = input.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"' && depth == 0) {
                inQuotes = !inQuotes;
            } else if (!inQuotes && c == '{') {
                depth++;
            } else if (!inQuotes && c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (!inQuotes && depth == 0 && c == target) {
                return i;
            }
        }
        return -1;
    }

    private String readWord() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        return input.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void skipSeparators(int end) {
        while (pos < end && (Character.isWhitespace(input.charAt(pos)) || input.charAt(pos) == ',')) {
            pos++;
        }
    }

    private int lineAt(int index) {
        int line = 1;
        for (int i = 0; i < index && i < input.length(); i++) {
            if (input.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
