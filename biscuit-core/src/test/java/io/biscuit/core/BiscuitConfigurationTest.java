package io.biscuit.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BiscuitConfigurationTest {

    @Test
    void shouldCreateConfigurationWithDefaults() {
        var config = BiscuitConfiguration.defaults();

        assertThat(config.tombstoneCleanupThreshold()).isEqualTo(1000);
        assertThat(config.radixSortThreshold()).isEqualTo(5000);
        assertThat(config.parallelCollectionEnabled()).isTrue();
        assertThat(config.parallelCollectionThreshold()).isEqualTo(10_000);
        assertThat(config.maxCollectionWorkers()).isEqualTo(4);
        assertThat(config.optimizeAfterBuild()).isTrue();
    }

    @Test
    void shouldCreateConfigurationWithCustomValues() {
        var config = BiscuitConfiguration.builder()
                .tombstoneCleanupThreshold(10)
                .radixSortThreshold(64)
                .parallelCollectionEnabled(false)
                .parallelCollectionThreshold(128)
                .maxCollectionWorkers(2)
                .optimizeAfterBuild(false)
                .build();

        assertThat(config.tombstoneCleanupThreshold()).isEqualTo(10);
        assertThat(config.radixSortThreshold()).isEqualTo(64);
        assertThat(config.parallelCollectionEnabled()).isFalse();
        assertThat(config.parallelCollectionThreshold()).isEqualTo(128);
        assertThat(config.maxCollectionWorkers()).isEqualTo(2);
        assertThat(config.optimizeAfterBuild()).isFalse();
        assertThat(config.toString()).contains("tombstoneCleanupThreshold=10");
    }

    @Test
    void shouldRejectNonPositiveThresholds() {
        assertThatThrownBy(() -> BiscuitConfiguration.builder().tombstoneCleanupThreshold(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tombstoneCleanupThreshold");
        assertThatThrownBy(() -> BiscuitConfiguration.builder().maxCollectionWorkers(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exceptionsShouldShareRoot() {
        assertThat(new InvalidPatternException("a\\", 1, "unterminated escape"))
                .isInstanceOf(BiscuitException.class)
                .hasMessage("unterminated escape at position 1 in pattern 'a\\'");
        assertThat(new UnknownRecordHandleException("gone")).isInstanceOf(BiscuitException.class);
        assertThat(new InconsistentStateException("bad")).isInstanceOf(RuntimeException.class);
    }
}
