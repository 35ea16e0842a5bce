package im.arun.texmml.lexer;

import java.util.List;

/**
 * Literal substitutions applied to the whole source before it is tokenized.
 */
public final class Preformatter {

    private static final List<String[]> RULES = List.of(
            new String[] {"\r\n", "\n"},
            new String[] {"\r", "\n"},
            new String[] {"]\n", "] \n"},
            new String[] {"}\n", "} \n"},
            new String[] {"$\n", "$ \n"},
            new String[] {"\\\\", "\\\\ "});

    private Preformatter() {
    }

    public static String apply(String source) {
        String result = source;
        for (String[] rule : RULES) {
            result = result.replace(rule[0], rule[1]);
        }
        return result;
    }
}
