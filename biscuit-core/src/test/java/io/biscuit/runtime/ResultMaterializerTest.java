package io.biscuit.runtime;

import io.biscuit.core.BiscuitConfiguration;
import io.biscuit.kernel.RecordLocator;
import io.biscuit.kernel.SlotTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultMaterializerTest {

    @Nested
    @DisplayName("radix sort")
    class RadixSort {

        @Test
        void shouldMatchComparisonSortOverFullRange() {
            var random = new Random(11);
            var locators = new long[20_000];
            for (var i = 0; i < locators.length; i++) {
                var block = random.nextLong() & 0xFFFF_FFFFL;
                var offset = random.nextInt(1 << 16);
                locators[i] = RecordLocator.of(block, offset).value();
            }
            var expected = locators.clone();
            Arrays.sort(expected);

            LocatorRadixSort.sort(locators, locators.length);

            assertThat(locators).containsExactly(expected);
        }

        @Test
        void shouldOrderOffsetsWithinOneBlock() {
            long[] locators = {
                    RecordLocator.of(5, 300).value(),
                    RecordLocator.of(5, 2).value(),
                    RecordLocator.of(4, 65535).value(),
                    RecordLocator.of(5, 256).value()};

            LocatorRadixSort.sort(locators, locators.length);

            assertThat(locators).containsExactly(
                    RecordLocator.of(4, 65535).value(),
                    RecordLocator.of(5, 2).value(),
                    RecordLocator.of(5, 256).value(),
                    RecordLocator.of(5, 300).value());
        }

        @Test
        void shouldTolerateTinyInputs() {
            var empty = new long[0];
            var single = new long[] {42};

            LocatorRadixSort.sort(empty, 0);
            LocatorRadixSort.sort(single, 1);

            assertThat(single).containsExactly(42);
        }

        @Test
        void shouldSwitchToRadixOnlyAboveThreshold() {
            var materializer = new ResultMaterializer(new SlotTable(), BiscuitConfiguration.defaults());

            assertThat(materializer.usesRadixSort(4_999)).isFalse();
            assertThat(materializer.usesRadixSort(5_000)).isFalse();
            assertThat(materializer.usesRadixSort(5_001)).isTrue();
        }
    }

    @Nested
    @DisplayName("materialize")
    class Materialize {

        @Test
        void ordered_radixAndComparisonPathsShouldAgree() {
            var table = shuffledTable(12_000, 5);
            var candidates = table.liveSlots().clone();
            var radix = new ResultMaterializer(table, BiscuitConfiguration.builder()
                    .radixSortThreshold(100).build());
            var comparison = new ResultMaterializer(table, BiscuitConfiguration.builder()
                    .radixSortThreshold(1_000_000).build());

            var viaRadix = radix.materialize(candidates, QueryOptions.ordered()).toList();
            var viaComparison = comparison.materialize(candidates, QueryOptions.ordered()).toList();

            assertThat(viaRadix).hasSize(12_000).isSorted().isEqualTo(viaComparison);
        }

        @Test
        void ordered_parallelCollectionShouldMatchSequential() {
            var table = shuffledTable(25_000, 9);
            var candidates = table.liveSlots().clone();
            var parallel = new ResultMaterializer(table, BiscuitConfiguration.builder()
                    .parallelCollectionThreshold(1_000).maxCollectionWorkers(8).build());
            var sequential = new ResultMaterializer(table, BiscuitConfiguration.builder()
                    .parallelCollectionEnabled(false).build());

            assertThat(parallel.collect(candidates)).containsExactly(sequential.collect(candidates));
        }

        @Test
        void ordered_limitShouldApplyAfterSorting() {
            var table = shuffledTable(50, 3);
            var materializer = new ResultMaterializer(table, BiscuitConfiguration.defaults());

            var all = materializer.materialize(table.liveSlots().clone(), QueryOptions.ordered()).toList();
            var firstFive = materializer.materialize(table.liveSlots().clone(),
                    QueryOptions.ordered().withLimit(5)).toList();

            assertThat(firstFive).isEqualTo(all.subList(0, 5));
        }

        @Test
        void unordered_limitShouldStopEarly() {
            var table = shuffledTable(50, 3);
            var materializer = new ResultMaterializer(table, BiscuitConfiguration.defaults());

            var cursor = materializer.materialize(table.liveSlots().clone(), QueryOptions.unordered().withLimit(3));

            assertThat(cursor.toList()).hasSize(3);
            assertThat(cursor.returned()).isEqualTo(3);
            assertThat(cursor.hasNext()).isFalse();
        }

        @Test
        void zeroLimit_shouldReturnNothing() {
            var table = shuffledTable(10, 1);
            var materializer = new ResultMaterializer(table, BiscuitConfiguration.defaults());

            assertThat(materializer.materialize(table.liveSlots().clone(),
                    QueryOptions.unordered().withLimit(0)).hasNext()).isFalse();
            assertThat(materializer.materialize(table.liveSlots().clone(),
                    QueryOptions.ordered().withLimit(0)).hasNext()).isFalse();
        }

        @Test
        void lazyCursor_shouldSkipSlotsRecycledAfterQuery() {
            // Given
            var table = new SlotTable();
            var first = table.allocate(RecordLocator.of(1, 0));
            var second = table.allocate(RecordLocator.of(2, 0));
            var materializer = new ResultMaterializer(table, BiscuitConfiguration.defaults());
            var cursor = materializer.materialize(RoaringBitmap.bitmapOf(first.slot(), second.slot()),
                    QueryOptions.unordered());

            // When
            table.tombstone(first);
            table.reclaim(RoaringBitmap.bitmapOf(first.slot()));
            table.allocate(RecordLocator.of(99, 0));

            // Then
            assertThat(cursor.toList()).containsExactly(RecordLocator.of(2, 0));
        }

        @Test
        void exhaustedCursor_shouldThrow() {
            var cursor = LocatorCursor.sorted(new long[0], 0);

            assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    void options_shouldRejectNegativeLimit() {
        assertThatThrownBy(() -> QueryOptions.ordered().withLimit(-2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(QueryOptions.unordered().hasLimit()).isFalse();
    }

    private static SlotTable shuffledTable(int size, long seed) {
        var random = new Random(seed);
        var table = new SlotTable();
        for (var i = 0; i < size; i++) {
            table.allocate(RecordLocator.of(random.nextInt(1 << 20), random.nextInt(1 << 16)));
        }
        return table;
    }
}
