package io.biscuit.kernel;

import io.biscuit.core.UnknownRecordHandleException;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.Arrays;

/**
 * Dense slot to locator mapping with tombstone tracking and slot reuse.
 * <p>
 * A slot is in exactly one of three states:
 * <ul>
 *   <li><b>live</b> - mapped to a locator, member of {@link #liveSlots()}</li>
 *   <li><b>tombstoned</b> - still mapped and still referenced from column bitmaps,
 *       excluded from results, awaiting {@link #reclaim(RoaringBitmap)}</li>
 *   <li><b>free</b> - unmapped, on the free list</li>
 * </ul>
 * <p>
 * Every allocation stamps the slot with a fresh generation taken from a
 * strictly increasing counter, which lets handles and lazy cursors detect
 * that a slot has been recycled.
 * <p>
 * Not thread-safe: writers are serialized by the host.
 */
public final class SlotTable {

    private static final long NO_LOCATOR = -1L;
    private static final int INITIAL_CAPACITY = 1024;

    private long[] locators;
    private long[] generations;
    private int nextSlot;
    private long globalGeneration;

    private final RoaringBitmap live = new RoaringBitmap();
    private RoaringBitmap tombstones = new RoaringBitmap();
    private final FreeSlotList freeList = new FreeSlotList();

    public SlotTable() {
        this.locators = new long[INITIAL_CAPACITY];
        this.generations = new long[INITIAL_CAPACITY];
        Arrays.fill(locators, NO_LOCATOR);
    }

    /**
     * Allocate a slot for a new record, reusing a freed slot when one exists.
     *
     * @param locator the record's physical locator
     * @return handle carrying the slot and its new generation
     */
    public RecordHandle allocate(RecordLocator locator) {
        if (locator == null) {
            throw new IllegalArgumentException("locator required");
        }
        var slot = freeList.pop();
        if (slot < 0) {
            ensureCapacity(nextSlot + 1);
            slot = nextSlot++;
        }
        var generation = ++globalGeneration;
        locators[slot] = locator.value();
        generations[slot] = generation;
        live.add(slot);
        return new RecordHandle(slot, generation);
    }

    /**
     * Undo an {@link #allocate(RecordLocator)} whose index writes failed.
     */
    public void release(RecordHandle handle) {
        var slot = handle.slot();
        if (!isCurrent(handle)) {
            return;
        }
        live.remove(slot);
        locators[slot] = NO_LOCATOR;
        generations[slot] = 0L;
        freeList.push(slot);
    }

    /**
     * Move a live slot to the tombstone set.
     *
     * @throws UnknownRecordHandleException if the handle is not live or is stale
     */
    public void tombstone(RecordHandle handle) {
        requireLive(handle);
        var slot = handle.slot();
        live.remove(slot);
        tombstones.add(slot);
    }

    /**
     * Check a handle without mutating anything.
     *
     * @throws UnknownRecordHandleException if the handle is not live or is stale
     */
    public void requireLive(RecordHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle required");
        }
        var slot = handle.slot();
        if (slot >= nextSlot) {
            throw new UnknownRecordHandleException("unknown slot " + slot);
        }
        if (tombstones.contains(slot)) {
            throw new UnknownRecordHandleException("slot " + slot + " is already deleted");
        }
        if (!live.contains(slot)) {
            throw new UnknownRecordHandleException("slot " + slot + " is not live");
        }
        if (generations[slot] != handle.generation()) {
            throw new UnknownRecordHandleException("stale handle for slot " + slot
                    + ": generation " + handle.generation() + ", current " + generations[slot]);
        }
    }

    /**
     * Unmap purged slots and put them on the free list. The caller must already
     * have removed them from every column bitmap.
     *
     * @param purged slots previously tombstoned
     */
    public void reclaim(RoaringBitmap purged) {
        IntIterator it = purged.getIntIterator();
        while (it.hasNext()) {
            var slot = it.next();
            locators[slot] = NO_LOCATOR;
            generations[slot] = 0L;
            freeList.push(slot);
        }
        tombstones = RoaringBitmap.andNot(tombstones, purged);
    }

    /**
     * Live slots. The returned bitmap is owned by this table and must not be mutated.
     */
    public RoaringBitmap liveSlots() {
        return live;
    }

    /**
     * Tombstoned slots. The returned bitmap is owned by this table and must not be mutated.
     */
    public RoaringBitmap tombstones() {
        return tombstones;
    }

    /**
     * Packed locator of a mapped slot, or -1 when the slot is free.
     */
    public long locatorAt(int slot) {
        if (slot < 0 || slot >= nextSlot) {
            return NO_LOCATOR;
        }
        return locators[slot];
    }

    public long generationAt(int slot) {
        if (slot < 0 || slot >= nextSlot) {
            return 0L;
        }
        return generations[slot];
    }

    public long currentGeneration() {
        return globalGeneration;
    }

    public int liveCount() {
        return live.getCardinality();
    }

    public int tombstoneCount() {
        return tombstones.getCardinality();
    }

    public int freeSlotCount() {
        return freeList.size();
    }

    /**
     * Number of slot ids ever handed out (live + tombstoned + free).
     */
    public int totalSlots() {
        return nextSlot;
    }

    public void clear() {
        locators = new long[INITIAL_CAPACITY];
        generations = new long[INITIAL_CAPACITY];
        Arrays.fill(locators, NO_LOCATOR);
        nextSlot = 0;
        live.clear();
        tombstones = new RoaringBitmap();
        freeList.clear();
    }

    public long estimateMemoryBytes() {
        return 16L * locators.length
                + live.getLongSizeInBytes()
                + tombstones.getLongSizeInBytes()
                + freeList.estimateMemoryBytes();
    }

    private boolean isCurrent(RecordHandle handle) {
        var slot = handle.slot();
        return slot < nextSlot && generations[slot] == handle.generation();
    }

    private void ensureCapacity(int required) {
        if (required <= locators.length) {
            return;
        }
        var newLength = Math.max(locators.length * 2, required);
        var grownLocators = Arrays.copyOf(locators, newLength);
        Arrays.fill(grownLocators, locators.length, newLength, NO_LOCATOR);
        var grownGenerations = Arrays.copyOf(generations, newLength);
        locators = grownLocators;
        generations = grownGenerations;
    }
}
