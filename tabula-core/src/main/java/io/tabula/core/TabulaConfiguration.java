package io.tabula.core;

/**
 * Immutable configuration shared by a table and every table derived from it.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * TabulaConfiguration config = TabulaConfiguration.builder()
 *     .duplicateLabelPolicy(DuplicateLabelPolicy.FIRST)
 *     .enableParallelApply(true)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class TabulaConfiguration {

    private static final TabulaConfiguration DEFAULTS = builder().build();

    // Label resolution
    private final DuplicateLabelPolicy duplicateLabelPolicy;

    // Join and concat column labels
    private final ColumnCollisionPolicy columnCollisionPolicy;

    // Group apply
    private final boolean enableParallelApply;
    private final int parallelApplyThreshold;

    private TabulaConfiguration(Builder builder) {
        this.duplicateLabelPolicy = builder.duplicateLabelPolicy;
        this.columnCollisionPolicy = builder.columnCollisionPolicy;
        this.enableParallelApply = builder.enableParallelApply;
        this.parallelApplyThreshold = builder.parallelApplyThreshold;
    }

    /**
     * Create a new builder for TabulaConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration used when none is given explicitly.
     */
    public static TabulaConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the policy for labels that occur at several positions.
     *
     * @return the duplicate label policy (default: ALL)
     */
    public DuplicateLabelPolicy duplicateLabelPolicy() {
        return duplicateLabelPolicy;
    }

    /**
     * Get the policy for column labels present on both sides of a join or concat.
     *
     * @return the column collision policy (default: KEEP)
     */
    public ColumnCollisionPolicy columnCollisionPolicy() {
        return columnCollisionPolicy;
    }

    /**
     * Check if per-group apply may run on a parallel stream.
     *
     * @return true if parallel apply is enabled (default: false)
     */
    public boolean enableParallelApply() {
        return enableParallelApply;
    }

    /**
     * Get the minimum number of groups for parallel apply.
     *
     * @return parallel apply threshold
     */
    public int parallelApplyThreshold() {
        return parallelApplyThreshold;
    }

    public Builder toBuilder() {
        return builder()
                .duplicateLabelPolicy(duplicateLabelPolicy)
                .columnCollisionPolicy(columnCollisionPolicy)
                .enableParallelApply(enableParallelApply)
                .parallelApplyThreshold(parallelApplyThreshold);
    }

    @Override
    public String toString() {
        return "TabulaConfiguration{duplicateLabelPolicy=" + duplicateLabelPolicy
                + ", columnCollisionPolicy=" + columnCollisionPolicy
                + ", enableParallelApply=" + enableParallelApply
                + ", parallelApplyThreshold=" + parallelApplyThreshold + "}";
    }

    /**
     * Builder for TabulaConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private DuplicateLabelPolicy duplicateLabelPolicy = DuplicateLabelPolicy.ALL;
        private ColumnCollisionPolicy columnCollisionPolicy = ColumnCollisionPolicy.KEEP;
        private boolean enableParallelApply = false;
        private int parallelApplyThreshold = 64;

        private Builder() {
        }

        /**
         * Set the policy for labels that occur at several positions.
         *
         * @param duplicateLabelPolicy the policy
         * @return this builder for method chaining
         */
        public Builder duplicateLabelPolicy(DuplicateLabelPolicy duplicateLabelPolicy) {
            if (duplicateLabelPolicy == null) {
                throw new IllegalArgumentException("duplicateLabelPolicy required");
            }
            this.duplicateLabelPolicy = duplicateLabelPolicy;
            return this;
        }

        /**
         * Set the policy for colliding column labels.
         *
         * @param columnCollisionPolicy the policy
         * @return this builder for method chaining
         */
        public Builder columnCollisionPolicy(ColumnCollisionPolicy columnCollisionPolicy) {
            if (columnCollisionPolicy == null) {
                throw new IllegalArgumentException("columnCollisionPolicy required");
            }
            this.columnCollisionPolicy = columnCollisionPolicy;
            return this;
        }

        /**
         * Enable or disable parallel per-group apply.
         * Results are always ordered by group key regardless of this setting.
         *
         * @param enableParallelApply true to enable parallel apply
         * @return this builder for method chaining
         */
        public Builder enableParallelApply(boolean enableParallelApply) {
            this.enableParallelApply = enableParallelApply;
            return this;
        }

        /**
         * Set the number of groups from which apply goes parallel.
         *
         * @param parallelApplyThreshold the threshold in number of groups
         * @return this builder for method chaining
         */
        public Builder parallelApplyThreshold(int parallelApplyThreshold) {
            if (parallelApplyThreshold <= 0) {
                throw new IllegalArgumentException("parallelApplyThreshold must be positive");
            }
            this.parallelApplyThreshold = parallelApplyThreshold;
            return this;
        }

        /**
         * Build the immutable TabulaConfiguration.
         *
         * @return a new TabulaConfiguration instance
         */
        public TabulaConfiguration build() {
            return new TabulaConfiguration(this);
        }
    }
}
