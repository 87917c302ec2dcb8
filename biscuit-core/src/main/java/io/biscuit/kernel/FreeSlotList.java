package io.biscuit.kernel;

import java.util.Arrays;

/**
 * Stack of purged slot ids awaiting reuse.
 * <p>
 * Writers are serialized by the host, so this is a plain growable int stack.
 */
final class FreeSlotList {

    private static final int INITIAL_CAPACITY = 64;

    private int[] slots = new int[INITIAL_CAPACITY];
    private int size;

    /**
     * Push a slot onto the stack.
     *
     * @param slot the slot to push
     */
    void push(int slot) {
        if (size == slots.length) {
            slots = Arrays.copyOf(slots, slots.length * 2);
        }
        slots[size++] = slot;
    }

    /**
     * Pop the most recently freed slot.
     *
     * @return the slot, or -1 if empty
     */
    int pop() {
        if (size == 0) {
            return -1;
        }
        return slots[--size];
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    void clear() {
        slots = new int[INITIAL_CAPACITY];
        size = 0;
    }

    long estimateMemoryBytes() {
        return 16L + 4L * slots.length;
    }
}
