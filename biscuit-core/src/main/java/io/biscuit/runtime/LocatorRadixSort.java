package io.biscuit.runtime;

import java.util.Arrays;

/**
 * LSD radix sort of packed locators ({@code block << 16 | offset}).
 * <p>
 * Two 8-bit passes over the offset, then four over the 32-bit block number. Every
 * pass is a stable counting sort, so the result is ordered by (block, offset), the
 * same order as {@link Arrays#sort(long[])} on the packed values. No
 * assumption is made about the range or density of block numbers.
 */
final class LocatorRadixSort {

    private static final int RADIX_BITS = 8;
    private static final int BUCKETS = 1 << RADIX_BITS;
    private static final int MASK = BUCKETS - 1;
    private static final int PASSES = 6;

    private LocatorRadixSort() {
    }

    /**
     * Sort {@code locators[0, length)} in place.
     */
    static void sort(long[] locators, int length) {
        if (length < 2) {
            return;
        }
        var source = locators;
        var target = new long[length];
        var counts = new int[BUCKETS];
        for (var pass = 0; pass < PASSES; pass++) {
            var shift = pass * RADIX_BITS;
            Arrays.fill(counts, 0);
            for (var i = 0; i < length; i++) {
                counts[(int) (source[i] >>> shift) & MASK]++;
            }
            if (counts[(int) (source[0] >>> shift) & MASK] == length) {
                continue; // every key shares this digit
            }
            var sum = 0;
            for (var b = 0; b < BUCKETS; b++) {
                var c = counts[b];
                counts[b] = sum;
                sum += c;
            }
            for (var i = 0; i < length; i++) {
                var value = source[i];
                target[counts[(int) (value >>> shift) & MASK]++] = value;
            }
            var swap = source;
            source = target;
            target = swap;
        }
        if (source != locators) {
            System.arraycopy(source, 0, locators, 0, length);
        }
    }
}
