package io.biscuit.runtime;

import io.biscuit.kernel.RecordLocator;
import io.biscuit.kernel.SlotTable;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Finite, non-restartable sequence of query results.
 * <p>
 * An ordered cursor walks a pre-sorted locator array. A lazy cursor resolves slots
 * through the {@link SlotTable} as it is advanced; it remembers the table's generation
 * at query time and skips slots that have since been reclaimed or handed to a newer
 * record. Abandoning a cursor early is always safe.
 */
public abstract class LocatorCursor implements Iterator<RecordLocator> {

    private int returned;

    LocatorCursor() {
    }

    static LocatorCursor sorted(long[] locators, int length) {
        return new Sorted(locators, length);
    }

    static LocatorCursor lazy(RoaringBitmap slots, SlotTable slotTable, long generation, int limit) {
        return new Lazy(slots, slotTable, generation, limit);
    }

    @Override
    public final RecordLocator next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        returned++;
        return RecordLocator.fromLong(advance());
    }

    /**
     * Number of locators returned so far.
     */
    public final int returned() {
        return returned;
    }

    /**
     * Drain the remaining locators.
     */
    public final List<RecordLocator> toList() {
        var result = new ArrayList<RecordLocator>();
        while (hasNext()) {
            result.add(next());
        }
        return result;
    }

    abstract long advance();

    private static final class Sorted extends LocatorCursor {
        private final long[] locators;
        private final int length;
        private int position;

        Sorted(long[] locators, int length) {
            this.locators = locators;
            this.length = length;
        }

        @Override
        public boolean hasNext() {
            return position < length;
        }

        @Override
        long advance() {
            return locators[position++];
        }
    }

    private static final class Lazy extends LocatorCursor {
        private static final long NONE = -1L;

        private final IntIterator slots;
        private final SlotTable slotTable;
        private final long generation;
        private final int limit;
        private long pending = NONE;

        Lazy(RoaringBitmap slots, SlotTable slotTable, long generation, int limit) {
            this.slots = slots.getIntIterator();
            this.slotTable = slotTable;
            this.generation = generation;
            this.limit = limit;
        }

        @Override
        public boolean hasNext() {
            if (pending != NONE) {
                return true;
            }
            if (limit != QueryOptions.NO_LIMIT && returned() >= limit) {
                return false;
            }
            while (slots.hasNext()) {
                var slot = slots.next();
                var locator = slotTable.locatorAt(slot);
                if (locator == NONE || slotTable.generationAt(slot) > generation) {
                    continue;
                }
                pending = locator;
                return true;
            }
            return false;
        }

        @Override
        long advance() {
            var locator = pending;
            pending = NONE;
            return locator;
        }
    }
}
