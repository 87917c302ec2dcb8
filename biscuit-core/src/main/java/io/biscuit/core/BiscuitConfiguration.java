package io.biscuit.core;

/**
 * Immutable configuration for a Biscuit index.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * BiscuitConfiguration config = BiscuitConfiguration.builder()
 *     .tombstoneCleanupThreshold(500)
 *     .radixSortThreshold(10_000)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.biscuit.runtime.BiscuitIndex
 */
public final class BiscuitConfiguration {

    private static final BiscuitConfiguration DEFAULTS = builder().build();

    // Maintenance
    private final int tombstoneCleanupThreshold;

    // Result ordering
    private final int radixSortThreshold;

    // Locator collection fan-out
    private final boolean parallelCollectionEnabled;
    private final int parallelCollectionThreshold;
    private final int maxCollectionWorkers;

    // Bulk build
    private final boolean optimizeAfterBuild;

    private BiscuitConfiguration(Builder builder) {
        this.tombstoneCleanupThreshold = builder.tombstoneCleanupThreshold;
        this.radixSortThreshold = builder.radixSortThreshold;
        this.parallelCollectionEnabled = builder.parallelCollectionEnabled;
        this.parallelCollectionThreshold = builder.parallelCollectionThreshold;
        this.maxCollectionWorkers = builder.maxCollectionWorkers;
        this.optimizeAfterBuild = builder.optimizeAfterBuild;
    }

    /**
     * Create a new builder for BiscuitConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The default configuration.
     */
    public static BiscuitConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the number of tombstones that triggers a batch purge.
     *
     * @return cleanup threshold (default: 1000)
     */
    public int tombstoneCleanupThreshold() {
        return tombstoneCleanupThreshold;
    }

    /**
     * Get the result size above which locators are radix-sorted instead of
     * comparison-sorted.
     *
     * @return radix sort threshold (default: 5000)
     */
    public int radixSortThreshold() {
        return radixSortThreshold;
    }

    /**
     * Check if ordered locator collection may fan out across workers.
     *
     * @return true if parallel collection is enabled
     */
    public boolean parallelCollectionEnabled() {
        return parallelCollectionEnabled;
    }

    /**
     * Get the result size from which ordered collection fans out.
     *
     * @return parallel collection threshold (default: 10000)
     */
    public int parallelCollectionThreshold() {
        return parallelCollectionThreshold;
    }

    public int maxCollectionWorkers() {
        return maxCollectionWorkers;
    }

    /**
     * Check if bitmaps are run-length optimised after a bulk build.
     */
    public boolean optimizeAfterBuild() {
        return optimizeAfterBuild;
    }

    @Override
    public String toString() {
        return "BiscuitConfiguration{tombstoneCleanupThreshold=" + tombstoneCleanupThreshold
                + ", radixSortThreshold=" + radixSortThreshold
                + ", parallelCollectionEnabled=" + parallelCollectionEnabled
                + ", parallelCollectionThreshold=" + parallelCollectionThreshold
                + ", maxCollectionWorkers=" + maxCollectionWorkers
                + ", optimizeAfterBuild=" + optimizeAfterBuild + "}";
    }

    /**
     * Builder for BiscuitConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private int tombstoneCleanupThreshold = 1000;
        private int radixSortThreshold = 5000;
        private boolean parallelCollectionEnabled = true;
        private int parallelCollectionThreshold = 10_000;
        private int maxCollectionWorkers = 4;
        private boolean optimizeAfterBuild = true;

        private Builder() {
        }

        /**
         * Set the tombstone count that triggers a batch purge.
         *
         * @param tombstoneCleanupThreshold the threshold (must be positive)
         * @return this builder for method chaining
         */
        public Builder tombstoneCleanupThreshold(int tombstoneCleanupThreshold) {
            this.tombstoneCleanupThreshold = tombstoneCleanupThreshold;
            return this;
        }

        /**
         * Set the result size above which radix sort is used.
         *
         * @param radixSortThreshold the threshold in number of locators
         * @return this builder for method chaining
         */
        public Builder radixSortThreshold(int radixSortThreshold) {
            this.radixSortThreshold = radixSortThreshold;
            return this;
        }

        /**
         * Enable or disable parallel locator collection.
         *
         * @param parallelCollectionEnabled true to enable
         * @return this builder for method chaining
         */
        public Builder parallelCollectionEnabled(boolean parallelCollectionEnabled) {
            this.parallelCollectionEnabled = parallelCollectionEnabled;
            return this;
        }

        /**
         * Set the result size from which ordered collection fans out.
         *
         * @param parallelCollectionThreshold the threshold in number of locators
         * @return this builder for method chaining
         */
        public Builder parallelCollectionThreshold(int parallelCollectionThreshold) {
            this.parallelCollectionThreshold = parallelCollectionThreshold;
            return this;
        }

        public Builder maxCollectionWorkers(int maxCollectionWorkers) {
            this.maxCollectionWorkers = maxCollectionWorkers;
            return this;
        }

        /**
         * Enable or disable run-length optimisation after bulk build.
         *
         * @param optimizeAfterBuild true to optimise (default: true)
         * @return this builder for method chaining
         */
        public Builder optimizeAfterBuild(boolean optimizeAfterBuild) {
            this.optimizeAfterBuild = optimizeAfterBuild;
            return this;
        }

        /**
         * Build the immutable BiscuitConfiguration.
         *
         * @return a new BiscuitConfiguration instance
         * @throws IllegalArgumentException if a threshold is not positive
         */
        public BiscuitConfiguration build() {
            requirePositive(tombstoneCleanupThreshold, "tombstoneCleanupThreshold");
            requirePositive(radixSortThreshold, "radixSortThreshold");
            requirePositive(parallelCollectionThreshold, "parallelCollectionThreshold");
            requirePositive(maxCollectionWorkers, "maxCollectionWorkers");
            return new BiscuitConfiguration(this);
        }

        private static void requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
        }
    }
}
