package ed.inf.adbs.emberdb.expression;

/**
 * Tag of every bound scalar expression variant, used for exhaustive dispatch
 * by the expression compiler.
 */
public enum ExpressionKind {
    COLUMN,
    LITERAL,
    COMPARISON,
    AND,
    OR,
    NOT,
    ARITHMETIC,
    IS_NULL
}
