package io.biscuit.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable result of compiling a LIKE pattern.
 * <p>
 * Besides the ordered {@link Segment}s and the anchoring flags, the pattern is
 * lowered into <em>windows</em>: maximal runs of literals and exact gaps. A window
 * is a fixed-width byte template whose exact-gap positions are holes
 * ({@link #HOLE}). Consecutive windows are separated by unbounded gaps, each with
 * a minimum width equal to its underscore count.
 * <p>
 * Literal bytes are already case-folded when the pattern is case-insensitive.
 */
public final class CompiledPattern {

    /** Template value for a position matched by {@code _}. */
    public static final int HOLE = -1;

    private final String source;
    private final List<Segment> segments;
    private final boolean anchoredStart;
    private final boolean anchoredEnd;
    private final boolean caseSensitive;

    private final List<Window> windows;
    private final boolean fixedStart;
    private final boolean fixedEnd;
    private final int leadingMin;
    private final int trailingMin;
    private final PatternShape shape;
    private final int concreteChars;
    private final int underscoreCount;
    private final int literalCount;
    private final boolean unboundedGap;

    /**
     * A fixed-width template placed {@code gapBefore} or more bytes after the previous window.
     */
    public record Window(int[] template, int gapBefore) {
        public Window {
            template = template.clone();
        }

        public int width() {
            return template.length;
        }

        public int symbolAt(int index) {
            return template[index];
        }

        @Override
        public int[] template() {
            return template.clone();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Window other
                    && gapBefore == other.gapBefore
                    && Arrays.equals(template, other.template);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(template) + gapBefore;
        }

        @Override
        public String toString() {
            return "Window{width=" + template.length + ", gapBefore=" + gapBefore + "}";
        }
    }

    public CompiledPattern(String source, List<Segment> segments, boolean anchoredStart,
            boolean anchoredEnd, boolean caseSensitive) {
        if (source == null) {
            throw new IllegalArgumentException("source required");
        }
        if (segments == null) {
            throw new IllegalArgumentException("segments required");
        }
        this.source = source;
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        this.anchoredStart = anchoredStart;
        this.anchoredEnd = anchoredEnd;
        this.caseSensitive = caseSensitive;

        var concrete = 0;
        var underscores = 0;
        var literals = 0;
        var unbounded = false;
        for (var segment : this.segments) {
            if (segment instanceof Segment.Literal literal) {
                concrete += literal.length();
                literals++;
            } else if (segment instanceof Segment.Gap gap) {
                underscores += gap.min();
                unbounded |= gap.unbounded();
            }
        }
        this.concreteChars = concrete;
        this.underscoreCount = underscores;
        this.literalCount = literals;
        this.unboundedGap = unbounded;

        // Lower segments into windows.
        var lowered = new ArrayList<Window>();
        var current = (List<Integer>) null;
        var currentGapBefore = 0;
        var pendingGap = 0;
        var leading = 0;
        var startsFloating = false;
        var endsFloating = false;
        for (var segment : this.segments) {
            if (segment instanceof Segment.Literal literal) {
                if (current == null) {
                    current = new ArrayList<>();
                    currentGapBefore = pendingGap;
                }
                for (var i = 0; i < literal.length(); i++) {
                    current.add(literal.byteAt(i));
                }
                endsFloating = false;
            } else if (segment instanceof Segment.Gap gap) {
                if (gap.unbounded()) {
                    if (current != null) {
                        lowered.add(new Window(toTemplate(current), currentGapBefore));
                        current = null;
                    } else if (lowered.isEmpty()) {
                        startsFloating = true;
                        leading = gap.min();
                    }
                    pendingGap = gap.min();
                    endsFloating = true;
                } else {
                    if (current == null) {
                        current = new ArrayList<>();
                        currentGapBefore = pendingGap;
                    }
                    for (var i = 0; i < gap.min(); i++) {
                        current.add(HOLE);
                    }
                    endsFloating = false;
                }
            }
        }
        if (current != null) {
            lowered.add(new Window(toTemplate(current), currentGapBefore));
        }
        this.windows = literals == 0 ? List.of() : Collections.unmodifiableList(lowered);
        this.fixedStart = !startsFloating;
        this.fixedEnd = !endsFloating;
        this.leadingMin = startsFloating ? leading : 0;
        this.trailingMin = endsFloating ? pendingGap : 0;
        this.shape = classify();
    }

    public String source() {
        return source;
    }

    public List<Segment> segments() {
        return segments;
    }

    /**
     * True when the pattern does not begin with {@code %}.
     */
    public boolean anchoredStart() {
        return anchoredStart;
    }

    /**
     * True when the pattern does not end with {@code %}.
     */
    public boolean anchoredEnd() {
        return anchoredEnd;
    }

    public boolean caseSensitive() {
        return caseSensitive;
    }

    public PatternShape shape() {
        return shape;
    }

    /**
     * Windows in pattern order; empty for {@link PatternShape#PURE_GAP}.
     */
    public List<Window> windows() {
        return windows;
    }

    /**
     * True when the first window is pinned at offset 0 (no unbounded gap precedes it).
     */
    public boolean fixedStart() {
        return fixedStart;
    }

    /**
     * True when the last window is pinned to the end of the value.
     */
    public boolean fixedEnd() {
        return fixedEnd;
    }

    /**
     * Minimum width of the unbounded gap before the first window, 0 if the start is fixed.
     */
    public int leadingMin() {
        return leadingMin;
    }

    /**
     * Minimum width of the unbounded gap after the last window, 0 if the end is fixed.
     */
    public int trailingMin() {
        return trailingMin;
    }

    /**
     * Total number of literal bytes.
     */
    public int concreteChars() {
        return concreteChars;
    }

    /**
     * Total number of {@code _} wildcards.
     */
    public int underscoreCount() {
        return underscoreCount;
    }

    /**
     * Number of literal segments.
     */
    public int literalCount() {
        return literalCount;
    }

    public boolean hasUnboundedGap() {
        return unboundedGap;
    }

    /**
     * Shortest value length this pattern can match.
     */
    public int minLength() {
        return concreteChars + underscoreCount;
    }

    @Override
    public String toString() {
        return "CompiledPattern{'" + source + "', shape=" + shape + ", segments=" + segments
                + ", anchoredStart=" + anchoredStart + ", anchoredEnd=" + anchoredEnd
                + ", caseSensitive=" + caseSensitive + "}";
    }

    private PatternShape classify() {
        if (literalCount == 0) {
            return PatternShape.PURE_GAP;
        }
        if (windows.size() > 1) {
            return PatternShape.COMPLEX;
        }
        if (fixedStart && fixedEnd) {
            return PatternShape.EXACT;
        }
        if (fixedStart) {
            return PatternShape.PREFIX;
        }
        if (fixedEnd) {
            return PatternShape.SUFFIX;
        }
        return PatternShape.SUBSTRING;
    }

    private static int[] toTemplate(List<Integer> symbols) {
        var template = new int[symbols.size()];
        for (var i = 0; i < template.length; i++) {
            template[i] = symbols.get(i);
        }
        return template;
    }
}
