package im.arun.texmml.model;

/**
 * Variant kind of an {@link Expression}.
 */
public enum ExpressionType {
    ROOT,
    PLAIN_TEXT,
    COMMAND,
    INLINE_MATH,
    BLOCK_MATH,
    BLOCK,
    COMMENT,
    VERBATIM
}
