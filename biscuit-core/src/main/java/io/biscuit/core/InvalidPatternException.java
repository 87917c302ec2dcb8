package io.biscuit.core;

/**
 * A LIKE pattern that cannot be compiled, e.g. one ending in an unpaired escape.
 * <p>
 * Raised before any bitmap is touched; the failing query produces no rows.
 */
public final class InvalidPatternException extends BiscuitException {

    private final String pattern;
    private final int position;

    public InvalidPatternException(String pattern, int position, String reason) {
        super(reason + " at position " + position + " in pattern '" + pattern + "'");
        this.pattern = pattern;
        this.position = position;
    }

    public String pattern() {
        return pattern;
    }

    public int position() {
        return position;
    }
}
