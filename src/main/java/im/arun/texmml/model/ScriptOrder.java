package im.arun.texmml.model;

/**
 * Order of the scripts gathered into a script container.
 */
public enum ScriptOrder {
    SUPERSCRIPT("script^"),
    SUBSCRIPT("script_"),
    SUPERSCRIPT_SUBSCRIPT("script^_"),
    SUBSCRIPT_SUPERSCRIPT("script_^");

    private final String containerName;

    ScriptOrder(String containerName) {
        this.containerName = containerName;
    }

    public String getContainerName() {
        return containerName;
    }

    public boolean isDouble() {
        return this == SUPERSCRIPT_SUBSCRIPT || this == SUBSCRIPT_SUPERSCRIPT;
    }

    public static ScriptOrder of(String first, String second) {
        if (second == null) {
            return "^".equals(first) ? SUPERSCRIPT : SUBSCRIPT;
        }
        return "^".equals(first) ? SUPERSCRIPT_SUBSCRIPT : SUBSCRIPT_SUPERSCRIPT;
    }
}
