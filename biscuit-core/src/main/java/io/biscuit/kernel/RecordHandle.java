package io.biscuit.kernel;

/**
 * Caller-held reference to one indexed record: its slot plus the generation
 * stamped on the slot when the record was inserted.
 */
public record RecordHandle(int slot, long generation) {
    public RecordHandle {
        if (slot < 0) {
            throw new IllegalArgumentException("slot negative: " + slot);
        }
    }
}
