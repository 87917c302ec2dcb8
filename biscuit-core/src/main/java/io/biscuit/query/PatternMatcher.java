package io.biscuit.query;

import io.biscuit.index.PositionalBitmapStore;
import org.roaringbitmap.RoaringBitmap;

import java.util.Map;
import java.util.TreeMap;

/**
 * Evaluates a {@link CompiledPattern} against one column's {@link PositionalBitmapStore}.
 * <p>
 * The result is exact: a slot is returned iff its value matches the pattern. Tombstones
 * are not filtered here; callers restrict the result to live slots, typically by passing
 * them as {@code within}.
 *
 * <h2>Multi-window patterns</h2>
 * Windows separated by {@code %} are placed left to right using a <em>frontier</em>: a map
 * from the earliest offset at which the next window may start to the slots that reach
 * that offset. For each window the offsets are scanned upward and each slot is advanced
 * at the first offset where the window matches. The leftmost placement of a window leaves
 * the most room for every later one, so keeping only that placement never loses a match,
 * and the work stays {@code O(windows * maxLength)} bitmap operations. A window pinned to
 * the end is matched through the backward bitmaps and checked against the frontier with
 * a length bound. An empty frontier stops the evaluation.
 */
public final class PatternMatcher {

    private PatternMatcher() {
    }

    /**
     * Evaluate {@code pattern} over every slot of {@code store}.
     *
     * @return a new bitmap owned by the caller
     */
    public static RoaringBitmap evaluate(CompiledPattern pattern, PositionalBitmapStore store) {
        return evaluate(pattern, store, null);
    }

    /**
     * Evaluate {@code pattern} restricted to {@code within}.
     *
     * @param within candidate slots to consider, or null for all
     * @return a new bitmap owned by the caller, a subset of {@code within} when given
     */
    public static RoaringBitmap evaluate(CompiledPattern pattern, PositionalBitmapStore store,
            RoaringBitmap within) {
        if (within != null && within.isEmpty()) {
            return new RoaringBitmap();
        }
        return switch (pattern.shape()) {
            case PURE_GAP -> pureGap(pattern, store, within);
            case EXACT -> exact(pattern, store, within);
            case PREFIX -> prefix(pattern, store, within);
            case SUFFIX -> suffix(pattern, store, within);
            case SUBSTRING, COMPLEX -> windowed(pattern, store, within);
        };
    }

    /**
     * {@code NOT LIKE}: everything in {@code universe} the candidates do not cover.
     */
    public static RoaringBitmap negate(RoaringBitmap candidates, RoaringBitmap universe) {
        return RoaringBitmap.andNot(universe, candidates);
    }

    private static RoaringBitmap pureGap(CompiledPattern pattern, PositionalBitmapStore store,
            RoaringBitmap within) {
        var min = pattern.underscoreCount();
        var lengths = pattern.hasUnboundedGap() ? store.lengthAtLeast(min) : store.lengthEquals(min);
        return restrict(lengths, within);
    }

    private static RoaringBitmap exact(CompiledPattern pattern, PositionalBitmapStore store,
            RoaringBitmap within) {
        var window = pattern.windows().get(0);
        var candidates = restrict(store.lengthEquals(window.width()), within);
        if (candidates.isEmpty()) {
            return candidates;
        }
        return matchAt(window, 0, store, pattern.caseSensitive(), candidates);
    }

    private static RoaringBitmap prefix(CompiledPattern pattern, PositionalBitmapStore store,
            RoaringBitmap within) {
        var window = pattern.windows().get(0);
        var candidates = restrict(store.lengthAtLeast(window.width() + pattern.trailingMin()), within);
        if (candidates.isEmpty()) {
            return candidates;
        }
        return matchAt(window, 0, store, pattern.caseSensitive(), candidates);
    }

    private static RoaringBitmap suffix(CompiledPattern pattern, PositionalBitmapStore store,
            RoaringBitmap within) {
        var window = pattern.windows().get(0);
        var candidates = restrict(store.lengthAtLeast(window.width() + pattern.leadingMin()), within);
        if (candidates.isEmpty()) {
            return candidates;
        }
        return matchAtEnd(window, store, pattern.caseSensitive(), candidates);
    }

    private static RoaringBitmap windowed(CompiledPattern pattern, PositionalBitmapStore store,
            RoaringBitmap within) {
        var windows = pattern.windows();
        var count = windows.size();
        var caseSensitive = pattern.caseSensitive();

        var minTotal = pattern.leadingMin() + pattern.trailingMin();
        for (var i = 0; i < count; i++) {
            minTotal += windows.get(i).width() + (i == 0 ? 0 : windows.get(i).gapBefore());
        }
        var candidates = restrict(store.lengthAtLeast(minTotal), within);
        if (candidates.isEmpty()) {
            return candidates;
        }

        var frontier = new TreeMap<Integer, RoaringBitmap>();
        var next = 0;
        if (pattern.fixedStart()) {
            var first = windows.get(0);
            var placed = matchAt(first, 0, store, caseSensitive, candidates);
            if (placed.isEmpty()) {
                return placed;
            }
            frontier.put(first.width() + gapAfter(pattern, 0), placed);
            next = 1;
        } else {
            frontier.put(pattern.leadingMin(), candidates);
        }

        var lastFloating = pattern.fixedEnd() ? count - 2 : count - 1;
        for (var i = next; i <= lastFloating; i++) {
            frontier = advance(frontier, windows.get(i), gapAfter(pattern, i), store, caseSensitive);
            if (frontier.isEmpty()) {
                return new RoaringBitmap();
            }
        }

        var result = new RoaringBitmap();
        if (pattern.fixedEnd()) {
            var last = windows.get(count - 1);
            var reachable = new RoaringBitmap();
            for (var reached : frontier.values()) {
                reachable.or(reached);
            }
            var endMatch = matchAtEnd(last, store, caseSensitive, reachable);
            if (endMatch.isEmpty()) {
                return endMatch;
            }
            for (var entry : frontier.entrySet()) {
                var fits = store.lengthAtLeast(entry.getKey() + last.width());
                if (fits == null) {
                    continue;
                }
                var placed = RoaringBitmap.and(entry.getValue(), endMatch);
                placed.and(fits);
                result.or(placed);
            }
        } else {
            for (var entry : frontier.entrySet()) {
                var fits = store.lengthAtLeast(entry.getKey());
                if (fits != null) {
                    result.or(RoaringBitmap.and(entry.getValue(), fits));
                }
            }
        }
        return result;
    }

    /**
     * Place {@code window} at the leftmost matching offset for every frontier slot.
     *
     * @return the next frontier, keyed by the earliest start of the following window
     */
    private static TreeMap<Integer, RoaringBitmap> advance(TreeMap<Integer, RoaringBitmap> frontier,
            CompiledPattern.Window window, int gapAfter, PositionalBitmapStore store, boolean caseSensitive) {
        var advanced = new TreeMap<Integer, RoaringBitmap>();
        var maxOffset = store.maxLength() - window.width();
        var pending = new TreeMap<>(frontier);
        var active = new RoaringBitmap();
        int offset = pending.firstKey();
        while (offset <= maxOffset) {
            Map.Entry<Integer, RoaringBitmap> head;
            while ((head = pending.firstEntry()) != null && head.getKey() <= offset) {
                active.or(head.getValue());
                pending.pollFirstEntry();
            }
            if (active.isEmpty()) {
                if (pending.isEmpty()) {
                    break;
                }
                offset = pending.firstKey();
                continue;
            }
            var placed = matchAt(window, offset, store, caseSensitive, active);
            if (!placed.isEmpty()) {
                active.andNot(placed);
                advanced.merge(offset + window.width() + gapAfter, placed, (a, b) -> {
                    a.or(b);
                    return a;
                });
            }
            offset++;
        }
        return advanced;
    }

    /**
     * Slots of {@code within} where {@code window} matches starting at forward {@code offset}.
     */
    static RoaringBitmap matchAt(CompiledPattern.Window window, int offset, PositionalBitmapStore store,
            boolean caseSensitive, RoaringBitmap within) {
        var fits = store.lengthAtLeast(offset + window.width());
        if (fits == null) {
            return new RoaringBitmap();
        }
        var result = RoaringBitmap.and(within, fits);
        for (var i = 0; i < window.width() && !result.isEmpty(); i++) {
            var symbol = window.symbolAt(i);
            if (symbol == CompiledPattern.HOLE) {
                continue;
            }
            var bitmap = store.forward(symbol, offset + i, caseSensitive);
            if (bitmap == null) {
                return new RoaringBitmap();
            }
            result.and(bitmap);
        }
        return result;
    }

    /**
     * Slots of {@code within} where {@code window} matches flush against the end of the value.
     */
    static RoaringBitmap matchAtEnd(CompiledPattern.Window window, PositionalBitmapStore store,
            boolean caseSensitive, RoaringBitmap within) {
        var width = window.width();
        var fits = store.lengthAtLeast(width);
        if (fits == null) {
            return new RoaringBitmap();
        }
        var result = RoaringBitmap.and(within, fits);
        for (var i = 0; i < width && !result.isEmpty(); i++) {
            var symbol = window.symbolAt(i);
            if (symbol == CompiledPattern.HOLE) {
                continue;
            }
            var bitmap = store.backward(symbol, i - width, caseSensitive);
            if (bitmap == null) {
                return new RoaringBitmap();
            }
            result.and(bitmap);
        }
        return result;
    }

    private static int gapAfter(CompiledPattern pattern, int windowIndex) {
        var windows = pattern.windows();
        return windowIndex + 1 < windows.size()
                ? windows.get(windowIndex + 1).gapBefore()
                : pattern.trailingMin();
    }

    private static RoaringBitmap restrict(RoaringBitmap bitmap, RoaringBitmap within) {
        if (bitmap == null) {
            return new RoaringBitmap();
        }
        return within == null ? bitmap.clone() : RoaringBitmap.and(bitmap, within);
    }
}
