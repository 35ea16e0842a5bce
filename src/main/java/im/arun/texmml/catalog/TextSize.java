package im.arun.texmml.catalog;

import java.util.Optional;

/**
 * Font size switches and their CSS equivalents.
 */
public enum TextSize {
    TINY("tiny", "xx-small"),
    SCRIPTSIZE("scriptsize", "x-small"),
    FOOTNOTESIZE("footnotesize", "small"),
    SMALL("small", "small"),
    NORMALSIZE("normalsize", "medium"),
    LARGE("large", "large"),
    LARGER("Large", "x-large"),
    LARGEST("LARGE", "x-large"),
    HUGE("huge", "xx-large"),
    HUGER("Huge", "xx-large");

    private final String command;
    private final String cssName;

    TextSize(String command, String cssName) {
        this.command = command;
        this.cssName = cssName;
    }

    public String getCommand() {
        return command;
    }

    public String getCssName() {
        return cssName;
    }

    public static Optional<TextSize> fromCommand(String command) {
        for (TextSize size : values()) {
            if (size.command.equals(command)) {
                return Optional.of(size);
            }
        }
        return Optional.empty();
    }
}
