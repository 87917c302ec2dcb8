package io.biscuit.runtime;

/**
 * Point-in-time diagnostics of a {@link BiscuitIndex}.
 *
 * @param liveCount      records visible to queries
 * @param tombstoneCount deleted records not yet purged from the bitmaps
 * @param freeSlotCount  purged slots waiting for reuse
 * @param insertCount    inserts since the index was built
 * @param updateCount    updates since the index was built
 * @param deleteCount    deletes since the index was built
 * @param maxValueLength longest indexed value in bytes, across all columns
 * @param totalSlots     slot ids handed out so far
 * @param columnCount    indexed columns
 */
public record IndexStats(
        long liveCount,
        long tombstoneCount,
        long freeSlotCount,
        long insertCount,
        long updateCount,
        long deleteCount,
        int maxValueLength,
        int totalSlots,
        int columnCount) {

    /**
     * Multi-line report for operators.
     */
    public String describe() {
        return "Biscuit Index Statistics\n"
                + "========================\n"
                + "Columns: " + columnCount + "\n"
                + "Active records: " + liveCount + "\n"
                + "Total slots: " + totalSlots + "\n"
                + "Free slots: " + freeSlotCount + "\n"
                + "Tombstones: " + tombstoneCount + "\n"
                + "Max length: " + maxValueLength + "\n"
                + "CRUD statistics:\n"
                + "  Inserts: " + insertCount + "\n"
                + "  Updates: " + updateCount + "\n"
                + "  Deletes: " + deleteCount + "\n";
    }
}
