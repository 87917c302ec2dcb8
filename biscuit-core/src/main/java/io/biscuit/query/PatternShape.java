package io.biscuit.query;

/**
 * Matching strategy selected for a compiled pattern.
 */
public enum PatternShape {
    /** One fixed window pinned to both ends: {@code 'abc'}, {@code 'a_c'}. */
    EXACT,
    /** One window pinned to the start: {@code 'abc%'}. */
    PREFIX,
    /** One window pinned to the end: {@code '%abc'}. */
    SUFFIX,
    /** One floating window: {@code '%abc%'}. */
    SUBSTRING,
    /** No literal bytes at all: {@code '%'}, {@code '___'}, {@code '%__'}. */
    PURE_GAP,
    /** Two or more windows separated by {@code %}. */
    COMPLEX
}
