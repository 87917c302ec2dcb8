package io.biscuit.index;

import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-column positional bitmaps answering "which slots hold byte {@code c} at position {@code p}".
 *
 * <p>Four position families are maintained for every indexed value {@code v}:
 * <ul>
 *   <li>forward: {@code (v[i], i)}</li>
 *   <li>backward: {@code (v[i], i - len(v))}, so {@code -1} is the last byte</li>
 *   <li>forward and backward over the ASCII-folded bytes, used by ILIKE</li>
 * </ul>
 * plus two length families: {@code lengthEquals(n)} and {@code lengthAtLeast(n)}.
 * {@code lengthAtLeast(0)} is therefore every slot holding a non-null value.
 *
 * <p>Entries are created lazily as new {@code (byte, position)} pairs appear; there is no
 * upper bound on value length. Slots are removed from the bitmaps only by
 * {@link #purgeTombstones(RoaringBitmap)} or by an explicit {@link #remove(int, String)};
 * a logical delete never touches this store.
 *
 * <p><strong>Performance characteristics:</strong>
 * <ul>
 *   <li>insert(): O(n) bitmap additions for a value of n bytes</li>
 *   <li>lookups: one hash probe</li>
 *   <li>purgeTombstones(): O(number of bitmap entries)</li>
 * </ul>
 *
 * <p>Not thread-safe. Writers are serialized by the host; lookups return the live
 * bitmaps, which callers must treat as read-only.
 */
public class PositionalBitmapStore {

    private static final long ENTRY_OVERHEAD_BYTES = 64L;

    private final String column;
    private final Map<PositionKey, RoaringBitmap> forward = new HashMap<>();
    private final Map<PositionKey, RoaringBitmap> backward = new HashMap<>();
    private final Map<PositionKey, RoaringBitmap> forwardFolded = new HashMap<>();
    private final Map<PositionKey, RoaringBitmap> backwardFolded = new HashMap<>();
    private final List<RoaringBitmap> lengthEquals = new ArrayList<>();
    private final List<RoaringBitmap> lengthAtLeast = new ArrayList<>();
    private int maxLength;

    public PositionalBitmapStore(String column) {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("column required");
        }
        this.column = column;
    }

    public String column() {
        return column;
    }

    /**
     * Index {@code value} under {@code slot}. A null value is not indexed.
     */
    public void insert(int slot, String value) {
        if (value == null) {
            return;
        }
        var bytes = AsciiCaseFolding.encode(value);
        var len = bytes.length;
        for (var i = 0; i < len; i++) {
            var symbol = bytes[i] & 0xFF;
            var folded = AsciiCaseFolding.fold(symbol);
            bitmap(forward, new PositionKey(symbol, i)).add(slot);
            bitmap(backward, new PositionKey(symbol, i - len)).add(slot);
            bitmap(forwardFolded, new PositionKey(folded, i)).add(slot);
            bitmap(backwardFolded, new PositionKey(folded, i - len)).add(slot);
        }
        lengthBitmap(lengthEquals, len).add(slot);
        for (var k = 0; k <= len; k++) {
            lengthBitmap(lengthAtLeast, k).add(slot);
        }
        if (len > maxLength) {
            maxLength = len;
        }
    }

    /**
     * Remove {@code slot} from every entry {@link #insert(int, String)} would have touched
     * for {@code value}. Entries left empty are dropped.
     */
    public void remove(int slot, String value) {
        if (value == null) {
            return;
        }
        var bytes = AsciiCaseFolding.encode(value);
        var len = bytes.length;
        for (var i = 0; i < len; i++) {
            var symbol = bytes[i] & 0xFF;
            var folded = AsciiCaseFolding.fold(symbol);
            removeFrom(forward, new PositionKey(symbol, i), slot);
            removeFrom(backward, new PositionKey(symbol, i - len), slot);
            removeFrom(forwardFolded, new PositionKey(folded, i), slot);
            removeFrom(backwardFolded, new PositionKey(folded, i - len), slot);
        }
        if (len < lengthEquals.size()) {
            lengthEquals.get(len).remove(slot);
        }
        for (var k = 0; k <= len && k < lengthAtLeast.size(); k++) {
            lengthAtLeast.get(k).remove(slot);
        }
        trimLengths();
    }

    /**
     * Clear every dead slot from every entry of every family: {@code entry &= ~deadSlots}.
     * Empty position entries are dropped and the maximum length recomputed.
     *
     * @return number of bitmap entries visited
     */
    public int purgeTombstones(RoaringBitmap deadSlots) {
        var visited = purgeFamily(forward, deadSlots)
                + purgeFamily(backward, deadSlots)
                + purgeFamily(forwardFolded, deadSlots)
                + purgeFamily(backwardFolded, deadSlots);
        for (var bitmap : lengthEquals) {
            bitmap.andNot(deadSlots);
        }
        for (var bitmap : lengthAtLeast) {
            bitmap.andNot(deadSlots);
        }
        visited += lengthEquals.size() + lengthAtLeast.size();
        trimLengths();
        return visited;
    }

    /**
     * Slots with byte {@code symbol} at forward position {@code position}, or null if none.
     */
    public RoaringBitmap forward(int symbol, int position, boolean caseSensitive) {
        var family = caseSensitive ? forward : forwardFolded;
        return family.get(new PositionKey(symbol, position));
    }

    /**
     * Slots with byte {@code symbol} at backward position {@code position} ({@code -1} = last byte),
     * or null if none.
     */
    public RoaringBitmap backward(int symbol, int position, boolean caseSensitive) {
        if (position >= 0) {
            throw new IllegalArgumentException("backward position must be negative: " + position);
        }
        var family = caseSensitive ? backward : backwardFolded;
        return family.get(new PositionKey(symbol, position));
    }

    /**
     * Slots whose value is exactly {@code length} bytes long, or null if none.
     */
    public RoaringBitmap lengthEquals(int length) {
        if (length < 0 || length >= lengthEquals.size()) {
            return null;
        }
        return lengthEquals.get(length);
    }

    /**
     * Slots whose value is at least {@code length} bytes long, or null if none.
     * Negative lengths are treated as zero.
     */
    public RoaringBitmap lengthAtLeast(int length) {
        var k = Math.max(length, 0);
        if (k >= lengthAtLeast.size()) {
            return null;
        }
        return lengthAtLeast.get(k);
    }

    /**
     * Every slot holding a non-null value in this column (live or tombstoned).
     */
    public RoaringBitmap nonNull() {
        var all = lengthAtLeast(0);
        return all == null ? new RoaringBitmap() : all;
    }

    /**
     * Length in bytes of the longest value still referenced by this store.
     */
    public int maxLength() {
        return maxLength;
    }

    /**
     * Number of distinct bitmap entries across all families.
     */
    public int entryCount() {
        return forward.size() + backward.size() + forwardFolded.size() + backwardFolded.size()
                + lengthEquals.size() + lengthAtLeast.size();
    }

    /**
     * Run-length optimise every bitmap.
     */
    public void runOptimize() {
        forward.values().forEach(RoaringBitmap::runOptimize);
        backward.values().forEach(RoaringBitmap::runOptimize);
        forwardFolded.values().forEach(RoaringBitmap::runOptimize);
        backwardFolded.values().forEach(RoaringBitmap::runOptimize);
        lengthEquals.forEach(RoaringBitmap::runOptimize);
        lengthAtLeast.forEach(RoaringBitmap::runOptimize);
    }

    public long estimateMemoryBytes() {
        return familyBytes(forward) + familyBytes(backward)
                + familyBytes(forwardFolded) + familyBytes(backwardFolded)
                + lengthBytes(lengthEquals) + lengthBytes(lengthAtLeast);
    }

    public void clear() {
        forward.clear();
        backward.clear();
        forwardFolded.clear();
        backwardFolded.clear();
        lengthEquals.clear();
        lengthAtLeast.clear();
        maxLength = 0;
    }

    private static RoaringBitmap bitmap(Map<PositionKey, RoaringBitmap> family, PositionKey key) {
        var bitmap = family.get(key);
        if (bitmap == null) {
            bitmap = new RoaringBitmap();
            family.put(key, bitmap);
        }
        return bitmap;
    }

    private static RoaringBitmap lengthBitmap(List<RoaringBitmap> family, int length) {
        while (family.size() <= length) {
            family.add(new RoaringBitmap());
        }
        return family.get(length);
    }

    private static void removeFrom(Map<PositionKey, RoaringBitmap> family, PositionKey key, int slot) {
        var bitmap = family.get(key);
        if (bitmap != null) {
            bitmap.remove(slot);
            if (bitmap.isEmpty()) {
                family.remove(key);
            }
        }
    }

    private static int purgeFamily(Map<PositionKey, RoaringBitmap> family, RoaringBitmap deadSlots) {
        var visited = family.size();
        var it = family.values().iterator();
        while (it.hasNext()) {
            var bitmap = it.next();
            bitmap.andNot(deadSlots);
            if (bitmap.isEmpty()) {
                it.remove();
            }
        }
        return visited;
    }

    // Drops empty trailing length entries so maxLength tracks the longest remaining value.
    private void trimLengths() {
        while (!lengthEquals.isEmpty() && lengthEquals.get(lengthEquals.size() - 1).isEmpty()) {
            lengthEquals.remove(lengthEquals.size() - 1);
        }
        while (!lengthAtLeast.isEmpty() && lengthAtLeast.get(lengthAtLeast.size() - 1).isEmpty()) {
            lengthAtLeast.remove(lengthAtLeast.size() - 1);
        }
        maxLength = Math.max(lengthEquals.size() - 1, 0);
    }

    private static long familyBytes(Map<PositionKey, RoaringBitmap> family) {
        var bytes = 0L;
        for (var bitmap : family.values()) {
            bytes += ENTRY_OVERHEAD_BYTES + bitmap.getLongSizeInBytes();
        }
        return bytes;
    }

    private static long lengthBytes(List<RoaringBitmap> family) {
        var bytes = 0L;
        for (var bitmap : family) {
            bytes += 16L + bitmap.getLongSizeInBytes();
        }
        return bytes;
    }
}
