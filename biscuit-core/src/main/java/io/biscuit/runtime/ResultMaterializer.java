package io.biscuit.runtime;

import io.biscuit.core.BiscuitConfiguration;
import io.biscuit.kernel.SlotTable;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Turns a candidate slot bitmap into a {@link LocatorCursor}.
 * <p>
 * Ordered results are resolved eagerly into a packed locator array and sorted:
 * comparison sort up to {@link BiscuitConfiguration#radixSortThreshold()} locators,
 * radix sort above it. Large results are resolved by rank-contiguous shards on the
 * common fork-join pool, each shard filling its own range of the array. A limit is
 * applied after sorting.
 * <p>
 * Unordered results are resolved lazily while the cursor is advanced, and stop at
 * the limit without touching the remaining slots.
 */
public final class ResultMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(ResultMaterializer.class);

    private final SlotTable slotTable;
    private final BiscuitConfiguration configuration;

    public ResultMaterializer(SlotTable slotTable, BiscuitConfiguration configuration) {
        this.slotTable = slotTable;
        this.configuration = configuration;
    }

    /**
     * @param candidates slots to deliver; must be a private copy, the cursor keeps it
     */
    public LocatorCursor materialize(RoaringBitmap candidates, QueryOptions options) {
        if (!options.needsOrder()) {
            return LocatorCursor.lazy(candidates, slotTable, slotTable.currentGeneration(), options.limit());
        }
        var locators = collect(candidates);
        sort(locators);
        var length = options.hasLimit() ? Math.min(options.limit(), locators.length) : locators.length;
        return LocatorCursor.sorted(locators, length);
    }

    /**
     * Packed locators of {@code candidates}, in slot order.
     */
    long[] collect(RoaringBitmap candidates) {
        var size = candidates.getCardinality();
        var out = new long[size];
        var threshold = configuration.parallelCollectionThreshold();
        if (!configuration.parallelCollectionEnabled() || size < threshold) {
            fill(candidates, out, 0, size);
            return out;
        }
        var shards = Math.min(configuration.maxCollectionWorkers(), (size + threshold - 1) / threshold + 1);
        var shardSize = (size + shards - 1) / shards;
        logger.debug("Collecting {} locators in {} shards", size, shards);
        IntStream.range(0, shards).parallel().forEach(shard -> {
            var from = shard * shardSize;
            var to = Math.min(size, from + shardSize);
            if (from < to) {
                fill(candidates, out, from, to);
            }
        });
        return out;
    }

    void sort(long[] locators) {
        if (usesRadixSort(locators.length)) {
            LocatorRadixSort.sort(locators, locators.length);
        } else {
            Arrays.sort(locators);
        }
    }

    boolean usesRadixSort(int size) {
        return size > configuration.radixSortThreshold();
    }

    // Resolves the slots of rank [from, to).
    private void fill(RoaringBitmap candidates, long[] out, int from, int to) {
        var it = candidates.getIntIterator();
        it.advanceIfNeeded(candidates.select(from));
        for (var i = from; i < to; i++) {
            out[i] = slotTable.locatorAt(it.next());
        }
    }
}
