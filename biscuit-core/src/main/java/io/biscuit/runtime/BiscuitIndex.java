package io.biscuit.runtime;

import io.biscuit.core.BiscuitConfiguration;
import io.biscuit.index.PositionalBitmapStore;
import io.biscuit.kernel.IndexRecord;
import io.biscuit.kernel.LikePredicate;
import io.biscuit.kernel.RecordHandle;
import io.biscuit.kernel.RecordLocator;
import io.biscuit.kernel.SlotTable;
import io.biscuit.query.QueryPlanner;
import org.roaringbitmap.RoaringBitmap;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Exact LIKE / ILIKE index over one or more string columns.
 * <p>
 * Each record is identified by a host {@link RecordLocator} and indexed under a dense
 * slot. Queries are conjunctions of {@link LikePredicate}s and return locators with no
 * false positives and no false negatives.
 * <pre>
 * var index = BiscuitIndex.create(List.of("name", "email"), BiscuitConfiguration.defaults());
 * var handle = index.insert(RecordLocator.of(7, 3), List.of("alice", "alice@example.com"));
 * var cursor = index.query(List.of(LikePredicate.ilike("email", "%@EXAMPLE.%")), QueryOptions.ordered());
 * </pre>
 * <p>
 * Not thread-safe: the host serializes writes with respect to each other and to reads.
 */
public final class BiscuitIndex {

    private final List<String> columns;
    private final Map<String, PositionalBitmapStore> stores;
    private final SlotTable slotTable;
    private final MaintenanceManager maintenance;
    private final QueryPlanner planner;
    private final ResultMaterializer materializer;

    BiscuitIndex(List<String> columns, BiscuitConfiguration configuration,
            Function<String, PositionalBitmapStore> storeFactory) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("at least one column required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        var seen = new HashSet<String>();
        var byName = new LinkedHashMap<String, PositionalBitmapStore>();
        for (var column : columns) {
            if (column == null || column.isBlank()) {
                throw new IllegalArgumentException("column name required");
            }
            if (!seen.add(column)) {
                throw new IllegalArgumentException("duplicate column: " + column);
            }
            byName.put(column, storeFactory.apply(column));
        }
        this.columns = List.copyOf(columns);
        this.stores = Collections.unmodifiableMap(byName);
        this.slotTable = new SlotTable();
        this.maintenance = new MaintenanceManager(slotTable, stores, configuration);
        this.planner = new QueryPlanner(stores);
        this.materializer = new ResultMaterializer(slotTable, configuration);
    }

    public static BiscuitIndex create(List<String> columns, BiscuitConfiguration configuration) {
        return new BiscuitIndex(columns, configuration, PositionalBitmapStore::new);
    }

    public static BiscuitIndex create(List<String> columns) {
        return create(columns, BiscuitConfiguration.defaults());
    }

    public List<String> columns() {
        return columns;
    }

    /**
     * Bulk-load an empty index.
     *
     * @return number of records loaded
     * @throws IllegalStateException if records were already indexed
     */
    public int build(Iterable<IndexRecord> records) {
        return maintenance.build(records);
    }

    /**
     * Drop all state, including a poisoned flag, and load {@code records}.
     */
    public int rebuild(Iterable<IndexRecord> records) {
        return maintenance.rebuild(records);
    }

    /**
     * @param values one value per column, in column order; null values are not indexed
     */
    public RecordHandle insert(RecordLocator locator, List<String> values) {
        return maintenance.insert(locator, values);
    }

    public RecordHandle update(RecordHandle handle, RecordLocator locator, List<String> values) {
        return maintenance.update(handle, locator, values);
    }

    public RecordHandle update(RecordHandle handle, List<String> values) {
        return maintenance.update(handle, values);
    }

    public void delete(RecordHandle handle) {
        maintenance.delete(handle);
    }

    /**
     * Delete a batch of records; tombstones are purged at most once, after the whole batch.
     *
     * @throws io.biscuit.core.UnknownRecordHandleException if any handle is not live;
     *         nothing is deleted
     */
    public void delete(Collection<RecordHandle> handles) {
        maintenance.delete(handles);
    }

    /**
     * Force a tombstone purge.
     *
     * @return slots reclaimed
     */
    public int cleanup() {
        return maintenance.cleanup();
    }

    /**
     * Locators of live records matching every predicate. An empty list matches all.
     *
     * @throws io.biscuit.core.InvalidPatternException if any pattern is malformed
     * @throws io.biscuit.core.InconsistentStateException if the index is poisoned
     */
    public LocatorCursor query(List<LikePredicate> predicates, QueryOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options required");
        }
        return materializer.materialize(candidates(predicates), options);
    }

    /**
     * Number of matching live records; no locator is resolved.
     */
    public long count(List<LikePredicate> predicates) {
        return candidates(predicates).getLongCardinality();
    }

    /**
     * Matching live slots as a bitmap owned by the caller.
     */
    public RoaringBitmap candidates(List<LikePredicate> predicates) {
        maintenance.requireHealthy();
        var plan = planner.plan(predicates);
        return planner.execute(plan, slotTable.liveSlots());
    }

    public IndexStats stats() {
        var maxLength = 0;
        for (var store : stores.values()) {
            maxLength = Math.max(maxLength, store.maxLength());
        }
        return new IndexStats(
                slotTable.liveCount(),
                slotTable.tombstoneCount(),
                slotTable.freeSlotCount(),
                maintenance.insertCount(),
                maintenance.updateCount(),
                maintenance.deleteCount(),
                maxLength,
                slotTable.totalSlots(),
                columns.size());
    }

    /**
     * Approximate heap footprint of all bitmaps and the slot table.
     */
    public long estimateMemoryBytes() {
        var bytes = slotTable.estimateMemoryBytes();
        for (var store : stores.values()) {
            bytes += store.estimateMemoryBytes();
        }
        return bytes;
    }

    public boolean isPoisoned() {
        return maintenance.isPoisoned();
    }
}
