package im.arun.texmml.catalog;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accent commands with the entity the renderer places over their argument.
 */
public enum Accent {
    OVERLINE("overline", "&#x00AF;", true, true),
    HAT("hat", "&#x005E;", false, true),
    WIDEHAT("widehat", "&#x005E;", true, true),
    CHECK("check", "&#x02C7;", false, true),
    TILDE("tilde", "&#x007E;", false, true),
    WIDETILDE("widetilde", "&#x007E;", true, true),
    ACUTE("acute", "&#x00B4;", false, true),
    GRAVE("grave", "&#x0060;", false, true),
    DOT("dot", "&#x02D9;", false, true),
    DDOT("ddot", "&#x00A8;", false, true),
    BREVE("breve", "&#x02D8;", false, true),
    BAR("bar", "&#x00AF;", false, true),
    VEC("vec", "&#x2192;", false, true),
    CIRCUMFLEX_TEXT("^", "&#x0302;", false, false),
    CARON_TEXT("v", "&#x030C;", false, false),
    TILDE_TEXT("~", "&#x0303;", false, false),
    ACUTE_TEXT("'", "&#x0301;", false, false),
    GRAVE_TEXT("`", "&#x0300;", false, false),
    DOT_TEXT(".", "&#x0307;", false, false),
    UMLAUT_TEXT("\"", "&#x0308;", false, false),
    BREVE_TEXT("u", "&#x0306;", false, false),
    MACRON_TEXT("=", "&#x0304;", false, false);

    private static final Map<String, Accent> BY_COMMAND;

    static {
        Map<String, Accent> byCommand = new HashMap<>();
        for (Accent accent : values()) {
            byCommand.put(accent.command, accent);
        }
        BY_COMMAND = Collections.unmodifiableMap(byCommand);
    }

    private final String command;
    private final String entity;
    private final boolean stretchy;
    private final boolean mathMode;

    Accent(String command, String entity, boolean stretchy, boolean mathMode) {
        this.command = command;
        this.entity = entity;
        this.stretchy = stretchy;
        this.mathMode = mathMode;
    }

    public String getCommand() {
        return command;
    }

    public String getEntity() {
        return entity;
    }

    public boolean isStretchy() {
        return stretchy;
    }

    public boolean isMathMode() {
        return mathMode;
    }

    public static Optional<Accent> fromCommand(String command) {
        return Optional.ofNullable(BY_COMMAND.get(command));
    }

    /** Whether {@code symbol} is a single-character text accent such as {@code \'} or {@code \"}. */
    public static boolean isSymbolAccent(String symbol) {
        Accent accent = BY_COMMAND.get(symbol);
        return accent != null && !accent.mathMode && symbol.length() == 1 && !Character.isLetter(symbol.charAt(0));
    }
}
