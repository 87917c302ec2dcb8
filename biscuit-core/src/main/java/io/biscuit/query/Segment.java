package io.biscuit.query;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * One piece of a compiled LIKE pattern: a run of literal bytes or a run of wildcards.
 */
public sealed interface Segment permits Segment.Literal, Segment.Gap {

    /**
     * Literal bytes that must appear contiguously.
     */
    record Literal(byte[] bytes) implements Segment {
        public Literal {
            if (bytes == null || bytes.length == 0) {
                throw new IllegalArgumentException("literal bytes required");
            }
            bytes = bytes.clone();
        }

        public int length() {
            return bytes.length;
        }

        public int byteAt(int index) {
            return bytes[index] & 0xFF;
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Literal other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Literal['" + new String(bytes, StandardCharsets.UTF_8) + "']";
        }
    }

    /**
     * A run of wildcards spanning between {@code min} and {@code max} bytes.
     * {@code max} is {@link #UNBOUNDED} when the run contains a {@code %}.
     */
    record Gap(int min, int max) implements Segment {
        public static final int UNBOUNDED = Integer.MAX_VALUE;

        public Gap {
            if (min < 0) {
                throw new IllegalArgumentException("gap min negative: " + min);
            }
            if (max != UNBOUNDED && max != min) {
                throw new IllegalArgumentException("bounded gap must have max == min: " + min + ".." + max);
            }
        }

        public static Gap exact(int width) {
            return new Gap(width, width);
        }

        public static Gap atLeast(int min) {
            return new Gap(min, UNBOUNDED);
        }

        public boolean unbounded() {
            return max == UNBOUNDED;
        }

        @Override
        public String toString() {
            return unbounded() ? "Gap[" + min + "..]" : "Gap[" + min + "]";
        }
    }
}
