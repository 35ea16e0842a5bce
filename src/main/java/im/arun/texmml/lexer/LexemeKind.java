package im.arun.texmml.lexer;

public enum LexemeKind {
    COMMAND,
    TEXT,
    BRACE_GROUP,
    INLINE_MATH,
    BLOCK_MATH,
    SCRIPT,
    COMMENT,
    VERBATIM,
    CELL_SEPARATOR,
    PARAGRAPH_BREAK
}
