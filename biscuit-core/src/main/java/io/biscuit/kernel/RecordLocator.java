package io.biscuit.kernel;

/**
 * Physical address of a host record: the block holding the tuple and the item
 * offset inside that block, printed as {@code (block,offset)}.
 * <p>
 * Both parts are unsigned. The pair is packed into a non-negative long as
 * {@code block << 16 | offset}, so numeric order of {@link #value()} is heap order:
 * by block, then by offset within the block. Sorting locators this way turns
 * random fetches into a sequential scan.
 */
public final class RecordLocator implements Comparable<RecordLocator> {

    public static final long MAX_BLOCK = 0xFFFF_FFFFL;
    public static final int MAX_OFFSET = 0xFFFF;

    private static final int OFFSET_SHIFT = 16;

    private final long packed;

    private RecordLocator(long packed) {
        this.packed = packed;
    }

    /**
     * @param blockNumber unsigned 32-bit block number
     * @param offset      unsigned 16-bit item offset
     */
    public static RecordLocator of(long blockNumber, int offset) {
        if (blockNumber < 0 || blockNumber > MAX_BLOCK) {
            throw new IllegalArgumentException("block number out of range: " + blockNumber);
        }
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new IllegalArgumentException("offset out of range: " + offset);
        }
        return new RecordLocator(blockNumber << OFFSET_SHIFT | offset);
    }

    /**
     * Inverse of {@link #value()}.
     */
    public static RecordLocator fromLong(long packed) {
        if (packed < 0 || packed >>> OFFSET_SHIFT > MAX_BLOCK) {
            throw new IllegalArgumentException("packed locator out of range: " + packed);
        }
        return new RecordLocator(packed);
    }

    /**
     * Parse the {@code (block,offset)} form produced by {@link #toString()}.
     */
    public static RecordLocator parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("locator text required");
        }
        var trimmed = text.strip();
        var comma = trimmed.indexOf(',');
        if (!trimmed.startsWith("(") || !trimmed.endsWith(")") || comma < 0) {
            throw new IllegalArgumentException("expected (block,offset): " + text);
        }
        try {
            var block = Long.parseLong(trimmed.substring(1, comma).strip());
            var offset = Integer.parseInt(trimmed.substring(comma + 1, trimmed.length() - 1).strip());
            return of(block, offset);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected (block,offset): " + text, e);
        }
    }

    public long value() {
        return packed;
    }

    /**
     * Block number as an unsigned value in {@code [0, MAX_BLOCK]}.
     */
    public long blockNumber() {
        return packed >>> OFFSET_SHIFT;
    }

    public int offset() {
        return (int) packed & MAX_OFFSET;
    }

    /**
     * Heap order: block number first, then offset.
     */
    @Override
    public int compareTo(RecordLocator other) {
        var byBlock = Long.compare(blockNumber(), other.blockNumber());
        return byBlock != 0 ? byBlock : Integer.compare(offset(), other.offset());
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RecordLocator other && other.packed == packed;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(packed);
    }

    @Override
    public String toString() {
        return "(" + blockNumber() + "," + offset() + ")";
    }
}
