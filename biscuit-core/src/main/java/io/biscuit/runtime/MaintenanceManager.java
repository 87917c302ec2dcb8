package io.biscuit.runtime;

import io.biscuit.core.BiscuitConfiguration;
import io.biscuit.core.InconsistentStateException;
import io.biscuit.core.ResourceExhaustedException;
import io.biscuit.core.UnknownRecordHandleException;
import io.biscuit.index.PositionalBitmapStore;
import io.biscuit.kernel.IndexRecord;
import io.biscuit.kernel.RecordHandle;
import io.biscuit.kernel.RecordLocator;
import io.biscuit.kernel.SlotTable;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Applies inserts, updates and deletes to the slot table and the column stores.
 * <p>
 * Deletes only tombstone the slot. Once {@link BiscuitConfiguration#tombstoneCleanupThreshold()}
 * tombstones have accumulated, every column store is purged in one batch and the slots
 * are returned to the free list. The threshold is checked after each single delete and
 * once after a whole {@link #delete(Collection) batch delete}.
 * <p>
 * A purge that fails part way leaves the bitmaps in an unknown state. The index is then
 * <em>poisoned</em>: every later read or write throws {@link InconsistentStateException}
 * until {@link #rebuild(Iterable)} replaces all state.
 * <p>
 * Not thread-safe; the host serializes writes.
 */
public final class MaintenanceManager {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceManager.class);

    private final SlotTable slotTable;
    private final List<PositionalBitmapStore> stores;
    private final BiscuitConfiguration configuration;

    private long insertCount;
    private long updateCount;
    private long deleteCount;
    private InconsistentStateException poisoned;

    public MaintenanceManager(SlotTable slotTable, Map<String, PositionalBitmapStore> stores,
            BiscuitConfiguration configuration) {
        if (slotTable == null) {
            throw new IllegalArgumentException("slotTable required");
        }
        if (stores == null || stores.isEmpty()) {
            throw new IllegalArgumentException("at least one column store required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.slotTable = slotTable;
        this.stores = List.copyOf(stores.values());
        this.configuration = configuration;
    }

    /**
     * Bulk-load {@code records} into an empty index. Slots are assigned densely in
     * iteration order and the CRUD counters are left untouched.
     *
     * @return number of records loaded
     * @throws IllegalStateException if the index already holds slots
     */
    public int build(Iterable<IndexRecord> records) {
        requireHealthy();
        if (records == null) {
            throw new IllegalArgumentException("records required");
        }
        if (slotTable.totalSlots() > 0) {
            throw new IllegalStateException("build requires an empty index; use rebuild");
        }
        var loaded = 0;
        for (var record : records) {
            if (record == null) {
                throw new IllegalArgumentException("record " + loaded + " is null");
            }
            add(record.locator(), record.values());
            loaded++;
        }
        if (configuration.optimizeAfterBuild()) {
            stores.forEach(PositionalBitmapStore::runOptimize);
        }
        logger.info("Built index over {} records in {} columns", loaded, stores.size());
        return loaded;
    }

    /**
     * Discard every slot, bitmap, counter and the poisoned state, then {@link #build(Iterable)}.
     */
    public int rebuild(Iterable<IndexRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records required");
        }
        slotTable.clear();
        stores.forEach(PositionalBitmapStore::clear);
        insertCount = 0;
        updateCount = 0;
        deleteCount = 0;
        if (poisoned != null) {
            logger.info("Rebuilding poisoned index");
            poisoned = null;
        }
        return build(records);
    }

    public RecordHandle insert(RecordLocator locator, List<String> values) {
        requireHealthy();
        var handle = add(locator, values);
        insertCount++;
        return handle;
    }

    /**
     * Replace a record: insert the new values, then delete {@code handle}. The new record
     * lands in a different slot; use the returned handle from now on. If the insert
     * fails the old record stays live.
     *
     * @throws UnknownRecordHandleException if the handle is not live
     */
    public RecordHandle update(RecordHandle handle, RecordLocator locator, List<String> values) {
        requireHealthy();
        requireLive(handle, "update");
        requireValues(values);
        if (locator == null) {
            throw new IllegalArgumentException("locator required");
        }
        var replacement = add(locator, values);
        remove(handle);
        updateCount++;
        return replacement;
    }

    /**
     * {@link #update(RecordHandle, RecordLocator, List)} keeping the record's locator.
     */
    public RecordHandle update(RecordHandle handle, List<String> values) {
        requireHealthy();
        requireLive(handle, "update");
        return update(handle, RecordLocator.fromLong(slotTable.locatorAt(handle.slot())), values);
    }

    /**
     * @throws UnknownRecordHandleException if the handle is unknown, already deleted
     *         or stale; nothing is changed
     */
    public void delete(RecordHandle handle) {
        requireHealthy();
        requireLive(handle, "delete");
        remove(handle);
        deleteCount++;
    }

    /**
     * Delete every record in {@code handles}, then purge once if the tombstone
     * threshold has been reached.
     * <p>
     * All handles are checked before any slot is tombstoned, so a rejected batch
     * changes nothing.
     *
     * @throws UnknownRecordHandleException if any handle is not live, is stale, or
     *         appears more than once
     */
    public void delete(Collection<RecordHandle> handles) {
        requireHealthy();
        if (handles == null) {
            throw new IllegalArgumentException("handles required");
        }
        var batch = new RoaringBitmap();
        for (var handle : handles) {
            requireLive(handle, "batch delete");
            if (!batch.checkedAdd(handle.slot())) {
                logger.warn("Rejected batch delete of {}: listed twice", handle);
                throw new UnknownRecordHandleException("slot " + handle.slot() + " listed twice in one batch");
            }
        }
        for (var handle : handles) {
            slotTable.tombstone(handle);
        }
        deleteCount += batch.getCardinality();
        purgeIfDue();
    }

    /**
     * Purge all tombstones now, regardless of the threshold.
     *
     * @return number of slots reclaimed
     */
    public int cleanup() {
        requireHealthy();
        return purge();
    }

    /**
     * @throws InconsistentStateException if the index is poisoned
     */
    public void requireHealthy() {
        if (poisoned != null) {
            throw new InconsistentStateException("index is poisoned; rebuild required", poisoned);
        }
    }

    public boolean isPoisoned() {
        return poisoned != null;
    }

    public long insertCount() {
        return insertCount;
    }

    public long updateCount() {
        return updateCount;
    }

    public long deleteCount() {
        return deleteCount;
    }

    private RecordHandle add(RecordLocator locator, List<String> values) {
        if (locator == null) {
            throw new IllegalArgumentException("locator required");
        }
        requireValues(values);
        var handle = slotTable.allocate(locator);
        try {
            for (var i = 0; i < stores.size(); i++) {
                stores.get(i).insert(handle.slot(), values.get(i));
            }
        } catch (OutOfMemoryError e) {
            rollback(handle, values, e);
            logger.warn("Insert of {} rolled back after running out of memory", locator);
            throw new ResourceExhaustedException("out of memory indexing slot " + handle.slot(), e);
        }
        return handle;
    }

    private void rollback(RecordHandle handle, List<String> values, OutOfMemoryError cause) {
        try {
            for (var i = 0; i < stores.size(); i++) {
                stores.get(i).remove(handle.slot(), values.get(i));
            }
            slotTable.release(handle);
        } catch (RuntimeException | OutOfMemoryError e) {
            e.addSuppressed(cause);
            throw poison("rollback of slot " + handle.slot() + " failed", e);
        }
    }

    private void remove(RecordHandle handle) {
        slotTable.tombstone(handle);
        purgeIfDue();
    }

    private void purgeIfDue() {
        if (slotTable.tombstoneCount() >= configuration.tombstoneCleanupThreshold()) {
            purge();
        }
    }

    private void requireLive(RecordHandle handle, String operation) {
        try {
            slotTable.requireLive(handle);
        } catch (UnknownRecordHandleException e) {
            logger.warn("Rejected {} of {}: {}", operation, handle, e.getMessage());
            throw e;
        }
    }

    private int purge() {
        var dead = slotTable.tombstones().clone();
        if (dead.isEmpty()) {
            return 0;
        }
        var started = System.nanoTime();
        var visited = 0L;
        try {
            for (var store : stores) {
                visited += store.purgeTombstones(dead);
            }
            slotTable.reclaim(dead);
        } catch (RuntimeException | OutOfMemoryError e) {
            throw poison("tombstone purge of " + dead.getCardinality() + " slots failed", e);
        }
        var reclaimed = dead.getCardinality();
        logger.info("Purged {} tombstones across {} bitmap entries in {} us",
                reclaimed, visited, (System.nanoTime() - started) / 1_000);
        return reclaimed;
    }

    private InconsistentStateException poison(String message, Throwable cause) {
        var failure = new InconsistentStateException(message, cause);
        poisoned = failure;
        logger.error("Index poisoned: {}", message, cause);
        return failure;
    }

    private void requireValues(List<String> values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        if (values.size() != stores.size()) {
            throw new IllegalArgumentException("expected " + stores.size() + " column values, got " + values.size());
        }
    }
}
