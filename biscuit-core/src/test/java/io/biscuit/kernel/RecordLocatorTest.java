package io.biscuit.kernel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordLocatorTest {

    @Test
    void shouldPackBlockAndOffset() {
        var locator = RecordLocator.of(0xFFFF_FFFFL, 0xFFFF);

        assertThat(locator.blockNumber()).isEqualTo(0xFFFF_FFFFL);
        assertThat(locator.offset()).isEqualTo(0xFFFF);
        assertThat(RecordLocator.fromLong(locator.value())).isEqualTo(locator);
    }

    @Test
    void shouldOrderByBlockThenOffset() {
        var a = RecordLocator.of(1, 65535);
        var b = RecordLocator.of(2, 0);

        assertThat(a).isLessThan(b);
        assertThat(RecordLocator.of(2, 1)).isGreaterThan(b);
    }

    @Test
    void shouldRejectOutOfRangeParts() {
        assertThatThrownBy(() -> RecordLocator.of(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecordLocator.of(1L << 32, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecordLocator.of(0, 1 << 16)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecordLocator.fromLong(-1L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldPrintAndParseBlockOffsetForm() {
        var locator = RecordLocator.of(4_000_000_000L, 17);

        assertThat(locator).hasToString("(4000000000,17)");
        assertThat(RecordLocator.parse(locator.toString())).isEqualTo(locator);
        assertThat(RecordLocator.parse(" ( 3 , 9 ) ")).isEqualTo(RecordLocator.of(3, 9));
    }

    @Test
    void parse_shouldRejectMalformedText() {
        assertThatThrownBy(() -> RecordLocator.parse("3,9")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RecordLocator.parse("(x,9)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> RecordLocator.parse("(1,70000)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("offset");
    }

    @Test
    void predicateFactories_shouldSetOperator() {
        assertThat(LikePredicate.notIlike("c", "%x").operator().negated()).isTrue();
        assertThat(LikePredicate.notIlike("c", "%x").operator().caseSensitive()).isFalse();
        assertThat(LikePredicate.like("c", "x").toString()).isEqualTo("c LIKE 'x'");
        assertThat(LikePredicate.notLike("c", "x").toString()).isEqualTo("c NOT LIKE 'x'");
    }

    @Test
    void indexRecord_shouldAllowNullValues() {
        var record = IndexRecord.of(RecordLocator.of(0, 1), "a", null);

        assertThat(record.values()).containsExactly("a", null);
    }
}
