package im.arun.texmml.catalog;

import java.util.Optional;

/**
 * List environments and the XHTML element each renders to.
 */
public enum ListKind {
    ITEMIZE("itemize", "ul"),
    ENUMERATE("enumerate", "ol"),
    DESCRIPTION("description", "dl");

    private final String environment;
    private final String element;

    ListKind(String environment, String element) {
        this.environment = environment;
        this.element = element;
    }

    public String getEnvironment() {
        return environment;
    }

    public String getElement() {
        return element;
    }

    public static Optional<ListKind> fromEnvironment(String environment) {
        for (ListKind kind : values()) {
            if (kind.environment.equals(environment)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
