package io.biscuit.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PositionalBitmapStoreTest {

    private PositionalBitmapStore store;

    @BeforeEach
    void setUp() {
        store = new PositionalBitmapStore("title");
    }

    @Test
    void insert_shouldPopulateForwardAndBackwardPositions() {
        // Given
        store.insert(4, "abc");

        // Then
        assertThat(store.forward('a', 0, true).contains(4)).isTrue();
        assertThat(store.forward('c', 2, true).contains(4)).isTrue();
        assertThat(store.backward('c', -1, true).contains(4)).isTrue();
        assertThat(store.backward('a', -3, true).contains(4)).isTrue();
        assertThat(store.forward('a', 1, true)).isNull();
    }

    @Test
    void insert_shouldPopulateFoldedFamilies() {
        store.insert(1, "AbC");

        assertThat(store.forward('a', 0, false).contains(1)).isTrue();
        assertThat(store.backward('c', -1, false).contains(1)).isTrue();
        assertThat(store.forward('a', 0, true)).isNull();
        assertThat(store.forward('A', 0, true).contains(1)).isTrue();
    }

    @Test
    void insert_shouldIndexUtf8Bytes() {
        store.insert(0, "é");

        assertThat(store.lengthEquals(2).contains(0)).isTrue();
        assertThat(store.forward(0xC3, 0, true).contains(0)).isTrue();
        assertThat(store.backward(0xA9, -1, true).contains(0)).isTrue();
        assertThat(store.maxLength()).isEqualTo(2);
    }

    @Test
    void nullValue_shouldNotBeIndexed() {
        store.insert(0, null);
        store.insert(1, "");

        assertThat(store.nonNull().toArray()).containsExactly(1);
        assertThat(store.lengthEquals(0).toArray()).containsExactly(1);
    }

    @Test
    void lengthFamilies_shouldBeDisjointAndMonotone() {
        // Given
        var random = new Random(3);
        for (var slot = 0; slot < 500; slot++) {
            var length = random.nextInt(20);
            store.insert(slot, "x".repeat(length));
        }

        // Then
        for (var n = 0; n <= store.maxLength(); n++) {
            for (var m = n + 1; m <= store.maxLength(); m++) {
                var eqN = store.lengthEquals(n);
                var eqM = store.lengthEquals(m);
                if (eqN != null && eqM != null) {
                    assertThat(RoaringBitmap.intersects(eqN, eqM)).isFalse();
                }
            }
            var geK = store.lengthAtLeast(n);
            var geNext = store.lengthAtLeast(n + 1);
            if (geNext != null) {
                assertThat(RoaringBitmap.andNot(geNext, geK).isEmpty()).isTrue();
            }
        }
        assertThat(store.lengthAtLeast(store.maxLength() + 1)).isNull();
    }

    @Test
    void remove_shouldUndoInsertAndTrimMaxLength() {
        store.insert(0, "short");
        store.insert(1, "much longer");

        store.remove(1, "much longer");

        assertThat(store.maxLength()).isEqualTo(5);
        assertThat(store.forward('m', 0, true)).isNull();
        assertThat(store.nonNull().toArray()).containsExactly(0);
    }

    @Test
    void purgeTombstones_shouldClearDeadSlotsFromEveryFamily() {
        // Given
        store.insert(0, "keep");
        store.insert(1, "drop me");
        store.insert(2, "Drop");
        var entriesBefore = store.entryCount();

        // When
        var visited = store.purgeTombstones(RoaringBitmap.bitmapOf(1, 2));

        // Then
        assertThat(visited).isEqualTo(entriesBefore);
        assertThat(store.nonNull().toArray()).containsExactly(0);
        assertThat(store.forward('d', 0, false)).isNull();
        assertThat(store.backward('p', -1, true).toArray()).containsExactly(0);
        assertThat(store.maxLength()).isEqualTo(4);
        assertThat(store.entryCount()).isLessThan(entriesBefore);
    }

    @Test
    void runOptimize_shouldKeepContents() {
        for (var slot = 0; slot < 1000; slot++) {
            store.insert(slot, "same");
        }
        var before = store.forward('s', 0, true).clone();

        store.runOptimize();

        assertThat(store.forward('s', 0, true)).isEqualTo(before);
        assertThat(store.estimateMemoryBytes()).isPositive();
    }

    @Test
    void clear_shouldDropEverything() {
        store.insert(0, "abc");

        store.clear();

        assertThat(store.entryCount()).isZero();
        assertThat(store.maxLength()).isZero();
        assertThat(store.nonNull().isEmpty()).isTrue();
    }

    @Test
    void backward_shouldRejectNonNegativePosition() {
        assertThatThrownBy(() -> store.backward('a', 0, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_shouldRequireColumn() {
        assertThatThrownBy(() -> new PositionalBitmapStore(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fold_shouldOnlyLowerAsciiLetters() {
        assertThat(AsciiCaseFolding.fold('Q')).isEqualTo('q');
        assertThat(AsciiCaseFolding.fold('@')).isEqualTo('@');
        assertThat(AsciiCaseFolding.fold(0xC3)).isEqualTo(0xC3);
    }
}
