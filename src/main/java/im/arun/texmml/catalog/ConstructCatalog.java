package im.arun.texmml.catalog;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Static lookup tables describing the commands and environments the pipeline and
 * the renderer understand, and how the reader should scan their arguments.
 */
public final class ConstructCatalog {

    /** Environments whose body is read in math mode. */
    public static final Set<String> MATH_ENVIRONMENTS = Set.of(
            "equation", "equation*", "eqnarray", "eqnarray*", "align", "align*",
            "gather", "gather*", "multline", "multline*", "displaymath", "math");

    /** Environments re-segmented into a row and cell grid. */
    public static final Set<String> TABLE_ENVIRONMENTS = Set.of(
            "array", "eqnarray", "eqnarray*", "tabular", "tabular*", "align", "align*",
            "matrix", "pmatrix", "bmatrix", "vmatrix", "Vmatrix", "cases");

    public static final Set<String> ALGORITHM_ENVIRONMENTS = Set.of("algorithmic", "algorithmicx");

    /** Commands whose arguments are kept as one raw text leaf instead of being parsed. */
    public static final Set<String> LITERAL_ARGUMENT_COMMANDS = Set.of(
            "begin", "end", "label", "ref", "eqref", "pageref", "cite", "input", "include",
            "bibliography", "bibliographystyle", "includegraphics", "url", "usepackage", "documentclass");

    /** Commands that never take arguments, so a following bracket or brace is left alone. */
    public static final Set<String> NO_ARGUMENT_COMMANDS = Set.of(
            "left", "right", "middle", "big", "Big", "bigg", "Bigg", "bigl", "bigr",
            "Bigl", "Bigr", "biggl", "biggr", "Biggl", "Biggr", "limits", "nolimits");

    /** Commands whose arguments are text even when the command itself appears in math. */
    public static final Set<String> TEXT_ARGUMENT_COMMANDS = Set.of(
            "text", "mbox", "hbox", "textrm", "textnormal", "textbf", "textit", "emph");

    public static final Set<String> SECTION_COMMANDS = Set.of(
            "part", "chapter", "section", "section*", "subsection", "subsection*",
            "subsubsection", "subsubsection*");

    public static final Set<String> PARAGRAPH_COMMANDS = Set.of("paragraph", "subparagraph");

    public static final Set<String> METADATA_COMMANDS = Set.of("author", "title", "date");

    public static final Set<String> DEFINITION_COMMANDS = Set.of("newcommand", "renewcommand", "providecommand");

    public static final Set<String> IMPORT_COMMANDS = Set.of("input", "include");

    public static final Set<String> ROW_SEPARATORS = Set.of("\\", "cr");

    public static final Set<String> TABLE_RULES = Set.of("hline", "cline", "toprule", "midrule", "bottomrule");

    public static final Set<String> REFERENCE_COMMANDS = Set.of("ref", "eqref", "pageref", "hyperref");

    /** Name of the implicit multiplication marker inserted between math tokens. */
    public static final String INVISIBLE_TIMES = "InvisibleTimes";

    private static final Set<String> ANONYMOUS_BLOCKS = Set.of(
            "", "{}", "paragraph", "subparagraph", "^", "_", "script^", "script_", "script^_", "script_^");

    private static final Set<String> KNOWN_ENVIRONMENTS = Set.of(
            "document", "itemize", "enumerate", "description", "equation", "equation*", "eqnarray",
            "eqnarray*", "align", "align*", "gather", "gather*", "multline", "multline*", "displaymath",
            "math", "array", "tabular", "tabular*", "matrix", "pmatrix", "bmatrix", "vmatrix", "Vmatrix",
            "cases", "table", "table*", "figure", "figure*", "center", "flushleft", "flushright", "quote",
            "quotation", "abstract", "verbatim", "thebibliography", "algorithm", "algorithmic",
            "algorithmicx", "minipage", "proof", "theorem", "lemma", "definition");

    private static final Map<String, Integer> EXPECTED_ARGUMENTS;

    static {
        Map<String, Integer> expected = new HashMap<>();
        register(expected, 0,
                // document structure
                "maketitle", "tableofcontents", "item", "paragraph", "subparagraph", "centering",
                "noindent", "newline", "newpage", "clearpage", "linebreak", "indent", "appendix",
                "hline", "toprule", "midrule", "bottomrule", "cr", "\\", "limits", "nolimits",
                "left", "right", "middle", "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr",
                "biggl", "biggr", "Biggl", "Biggr", "LaTeX", "TeX", "today", "ldots", "dots", "cdots",
                "vdots", "ddots", "quad", "qquad", "displaystyle", "textstyle", INVISIBLE_TIMES,
                // single symbol commands
                ",", ";", ":", "!", " ", "{", "}", "%", "$", "&", "#", "_", "|", "-",
                // greek letters
                "alpha", "beta", "gamma", "delta", "epsilon", "varepsilon", "zeta", "eta", "theta",
                "vartheta", "iota", "kappa", "lambda", "mu", "nu", "xi", "pi", "varpi", "rho", "varrho",
                "sigma", "varsigma", "tau", "upsilon", "phi", "varphi", "chi", "psi", "omega", "Gamma",
                "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi", "Omega",
                // operators and relations
                "sum", "prod", "coprod", "int", "iint", "iiint", "oint", "bigcup", "bigcap", "bigoplus",
                "bigotimes", "lim", "limsup", "liminf", "sup", "inf", "max", "min", "sin", "cos", "tan",
                "cot", "sec", "csc", "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh", "log", "ln",
                "lg", "exp", "det", "dim", "ker", "deg", "gcd", "arg", "Pr", "pm", "mp", "times", "div",
                "cdot", "ast", "star", "circ", "bullet", "cap", "cup", "wedge", "vee", "oplus", "otimes",
                "setminus", "leq", "le", "geq", "ge", "neq", "ne", "approx", "equiv", "sim", "simeq",
                "cong", "propto", "ll", "gg", "subset", "supset", "subseteq", "supseteq", "in", "notin",
                "ni", "mid", "parallel", "perp", "forall", "exists", "neg", "lnot", "land", "lor",
                "infty", "partial", "nabla", "emptyset", "varnothing", "aleph", "hbar", "ell", "Re",
                "Im", "wp", "prime", "angle", "triangle", "langle", "rangle", "lfloor", "rfloor",
                "lceil", "rceil", "lbrace", "rbrace", "vert", "Vert",
                // arrows
                "to", "gets", "leftarrow", "rightarrow", "Leftarrow", "Rightarrow", "leftrightarrow",
                "Leftrightarrow", "mapsto", "longrightarrow", "longleftarrow", "Longrightarrow",
                "Longleftarrow", "iff", "implies", "uparrow", "downarrow", "Uparrow", "Downarrow",
                // algorithmicx lines without arguments
                "State", "Statex", "Else", "EndIf", "EndFor", "EndWhile", "EndLoop", "EndProcedure",
                "EndFunction", "Loop", "Repeat", "Begin", "End", "Require", "Ensure", "Return");
        register(expected, 1,
                "documentclass", "usepackage", "title", "author", "date", "part", "chapter", "section",
                "section*", "subsection", "subsection*", "subsubsection", "subsubsection*", "label", "ref",
                "eqref", "pageref", "hyperref", "cite", "bibliography", "bibliographystyle",
                "includegraphics", "caption", "footnote", "url", "input", "include", "begin", "end",
                "textbf", "textit", "emph", "underline", "sout", "texttt", "textsf", "textrm", "textsc",
                "textnormal", "text", "mbox", "hbox", "mathrm", "mathbf", "mathit", "mathbb", "mathcal",
                "mathfrak", "mathsf", "mathtt", "operatorname", "sqrt", "boldsymbol", "overbrace",
                "underbrace", "cline", "thanks", "If", "ElsIf", "For", "ForAll", "While", "Until",
                "Comment");
        register(expected, 2,
                "frac", "dfrac", "tfrac", "binom", "href", "newcommand", "renewcommand", "providecommand",
                "Procedure", "Function", "Call", "stackrel", "overset", "underset");
        register(expected, 3, "multicolumn");
        for (Accent accent : Accent.values()) {
            expected.put(accent.getCommand(), 1);
        }
        for (TextSize size : TextSize.values()) {
            expected.put(size.getCommand(), 0);
        }
        for (String styleCommand : TextStyle.commands()) {
            expected.putIfAbsent(styleCommand, 0);
        }
        EXPECTED_ARGUMENTS = Collections.unmodifiableMap(expected);
    }

    private ConstructCatalog() {
    }

    private static void register(Map<String, Integer> target, int count, String... names) {
        for (String name : names) {
            target.put(name, count);
        }
    }

    public static boolean isKnownCommand(String name) {
        return EXPECTED_ARGUMENTS.containsKey(name);
    }

    public static boolean isKnownEnvironment(String name) {
        return KNOWN_ENVIRONMENTS.contains(name);
    }

    /** Number of argument groups the renderer expects for a known command. */
    public static OptionalInt expectedArguments(String name) {
        Integer count = EXPECTED_ARGUMENTS.get(name);
        return count == null ? OptionalInt.empty() : OptionalInt.of(count);
    }

    /** Blocks that neither get a number nor can be the target of a label. */
    public static boolean isAnonymousBlock(String name) {
        return ANONYMOUS_BLOCKS.contains(name);
    }

    public static boolean isMathEnvironment(String name) {
        return MATH_ENVIRONMENTS.contains(name);
    }

    public static boolean isSectionCommand(String name) {
        return SECTION_COMMANDS.contains(name);
    }
}
