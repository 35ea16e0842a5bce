package im.arun.texmml.catalog;

import java.util.Map;
import java.util.Optional;

/**
 * Text style flags and the commands that switch them on.
 */
public enum TextStyle {
    BOLD,
    ITALIC,
    UNDERLINED,
    STRIKETHROUGH;

    private static final Map<String, TextStyle> BY_COMMAND = Map.of(
            "textbf", BOLD,
            "bf", BOLD,
            "textit", ITALIC,
            "emph", ITALIC,
            "it", ITALIC,
            "underline", UNDERLINED,
            "sout", STRIKETHROUGH);

    public static Optional<TextStyle> fromCommand(String command) {
        return Optional.ofNullable(BY_COMMAND.get(command));
    }

    static Iterable<String> commands() {
        return BY_COMMAND.keySet();
    }
}
