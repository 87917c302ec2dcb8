package io.biscuit.index;

/**
 * Composite bitmap key: a byte value and a signed position.
 * Forward positions count from 0 at the start; backward positions are negative,
 * {@code -1} being the last byte.
 */
public record PositionKey(int symbol, int position) {
    public PositionKey {
        if (symbol < 0 || symbol > 0xFF) {
            throw new IllegalArgumentException("symbol out of byte range: " + symbol);
        }
    }
}
