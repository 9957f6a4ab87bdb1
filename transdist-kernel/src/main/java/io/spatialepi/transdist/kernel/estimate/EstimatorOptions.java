package io.spatialepi.transdist.kernel.estimate;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.spatialepi.transdist.api.DomainException;
import io.spatialepi.transdist.kernel.gentime.DiscretizedGenerationTime;
import io.spatialepi.transdist.kernel.gentime.ExplicitGenerationTime;
import io.spatialepi.transdist.kernel.gentime.GenerationTime;
import io.spatialepi.transdist.kernel.gentime.GenerationTimeFamily;
import io.spatialepi.transdist.kernel.weights.TimeOrdering;

import java.util.Objects;

/**
 * Immutable settings shared by the kernel, bootstrap and temporal estimators.
 *
 * <h2>Defaults</h2>
 *
 * <table>
 *   <caption>Option defaults</caption>
 *   <tr><th>Option</th><th>Default</th></tr>
 *   <tr><td>t1 / t2</td><td>unbounded</td></tr>
 *   <tr><td>maxSep</td><td>{@link Integer#MAX_VALUE}, capped by the data</td></tr>
 *   <tr><td>maxDist</td><td>{@code +∞}</td></tr>
 *   <tr><td>nTranstreeReps</td><td>{@value #DEFAULT_TRANSTREE_REPS}</td></tr>
 *   <tr><td>timeOrdering</td><td>{@link TimeOrdering#STRICT}</td></tr>
 *   <tr><td>meanEqualsSd</td><td>false</td></tr>
 *   <tr><td>bootIter</td><td>{@value #DEFAULT_BOOT_ITER}</td></tr>
 *   <tr><td>ciLow / ciHigh</td><td>0.025 / 0.975</td></tr>
 *   <tr><td>minCases</td><td>{@value #DEFAULT_MIN_CASES}</td></tr>
 *   <tr><td>seed</td><td>{@value #DEFAULT_SEED}</td></tr>
 * </table>
 *
 * <p>The generation time has no default and must be set.
 *
 * <pre>{@code
 * EstimatorOptions options = EstimatorOptions.builder()
 *     .genTime(GenerationTimeFamily.GAMMA, 5.0, 2.0)
 *     .maxDist(50_000)
 *     .nTranstreeReps(50)
 *     .build();
 * }</pre>
 */
public final class EstimatorOptions {

    public static final int DEFAULT_TRANSTREE_REPS = 10;
    public static final int DEFAULT_BOOT_ITER = 100;
    public static final double DEFAULT_CI_LOW = 0.025;
    public static final double DEFAULT_CI_HIGH = 0.975;
    public static final int DEFAULT_MIN_CASES = 2;
    public static final long DEFAULT_SEED = 1L;

    private final GenerationTime genTime;
    private final int t1;
    private final int t2;
    private final int maxSep;
    private final double maxDist;
    private final int nTranstreeReps;
    private final TimeOrdering timeOrdering;
    private final boolean meanEqualsSd;
    private final int bootIter;
    private final double ciLow;
    private final double ciHigh;
    private final int minCases;
    private final long seed;

    private EstimatorOptions(Builder builder) {
        this.genTime = builder.genTime;
        this.t1 = builder.t1;
        this.t2 = builder.t2;
        this.maxSep = builder.maxSep;
        this.maxDist = builder.maxDist;
        this.nTranstreeReps = builder.nTranstreeReps;
        this.timeOrdering = builder.timeOrdering;
        this.meanEqualsSd = builder.meanEqualsSd;
        this.bootIter = builder.bootIter;
        this.ciLow = builder.ciLow;
        this.ciHigh = builder.ciHigh;
        this.minCases = builder.minCases;
        this.seed = builder.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// A builder pre-filled with these options.
    public Builder toBuilder() {
        Builder b = new Builder();
        b.genTime = genTime;
        b.t1 = t1;
        b.t2 = t2;
        b.maxSep = maxSep;
        b.maxDist = maxDist;
        b.nTranstreeReps = nTranstreeReps;
        b.timeOrdering = timeOrdering;
        b.meanEqualsSd = meanEqualsSd;
        b.bootIter = bootIter;
        b.ciLow = ciLow;
        b.ciHigh = ciHigh;
        b.minCases = minCases;
        b.seed = seed;
        return b;
    }

    public GenerationTime genTime() {
        return genTime;
    }

    /// First onset time included; {@link Integer#MIN_VALUE} when unbounded.
    public int t1() {
        return t1;
    }

    /// Last onset time included; {@link Integer#MAX_VALUE} when unbounded.
    public int t2() {
        return t2;
    }

    public int maxSep() {
        return maxSep;
    }

    public double maxDist() {
        return maxDist;
    }

    public int nTranstreeReps() {
        return nTranstreeReps;
    }

    public TimeOrdering timeOrdering() {
        return timeOrdering;
    }

    public boolean meanEqualsSd() {
        return meanEqualsSd;
    }

    public int bootIter() {
        return bootIter;
    }

    public double ciLow() {
        return ciLow;
    }

    public double ciHigh() {
        return ciHigh;
    }

    public int minCases() {
        return minCases;
    }

    public long seed() {
        return seed;
    }

    @Override
    public String toString() {
        return "EstimatorOptions{" +
               "genTime=" + genTime +
               ", t1=" + (t1 == Integer.MIN_VALUE ? "-inf" : t1) +
               ", t2=" + (t2 == Integer.MAX_VALUE ? "+inf" : t2) +
               ", maxSep=" + maxSep +
               ", maxDist=" + maxDist +
               ", nTranstreeReps=" + nTranstreeReps +
               ", timeOrdering=" + timeOrdering +
               ", meanEqualsSd=" + meanEqualsSd +
               ", bootIter=" + bootIter +
               ", ci=[" + ciLow + ", " + ciHigh + "]" +
               ", minCases=" + minCases +
               ", seed=" + seed +
               '}';
    }

    /**
     * Builder for {@link EstimatorOptions}. Setters reject invalid values with
     * a {@link DomainException}.
     */
    public static final class Builder {
        private GenerationTime genTime;
        private int t1 = Integer.MIN_VALUE;
        private int t2 = Integer.MAX_VALUE;
        private int maxSep = Integer.MAX_VALUE;
        private double maxDist = Double.POSITIVE_INFINITY;
        private int nTranstreeReps = DEFAULT_TRANSTREE_REPS;
        private TimeOrdering timeOrdering = TimeOrdering.STRICT;
        private boolean meanEqualsSd = false;
        private int bootIter = DEFAULT_BOOT_ITER;
        private double ciLow = DEFAULT_CI_LOW;
        private double ciHigh = DEFAULT_CI_HIGH;
        private int minCases = DEFAULT_MIN_CASES;
        private long seed = DEFAULT_SEED;

        private Builder() {}

        public Builder genTime(GenerationTime genTime) {
            this.genTime = Objects.requireNonNull(genTime, "genTime");
            return this;
        }

        /**
         * Uses a discretized normal generation time.
         */
        public Builder genTime(double mean, double sd) {
            return genTime(GenerationTimeFamily.NORMAL, mean, sd);
        }

        public Builder genTime(GenerationTimeFamily family, double mean, double sd) {
            return genTime(DiscretizedGenerationTime.of(family, mean, sd));
        }

        /**
         * Uses an explicit mass vector over lags {@code 0..k}.
         */
        public Builder genTimeVector(double... pmf) {
            return genTime(ExplicitGenerationTime.of(pmf));
        }

        public Builder t1(int t1) {
            this.t1 = t1;
            return this;
        }

        public Builder t2(int t2) {
            this.t2 = t2;
            return this;
        }

        public Builder maxSep(int maxSep) {
            if (maxSep < 1) {
                throw new DomainException("maxSep must be at least 1, got: " + maxSep);
            }
            this.maxSep = maxSep;
            return this;
        }

        /**
         * Sets the spatial cutoff; pairs farther apart are left out of the sum.
         */
        public Builder maxDist(double maxDist) {
            if (Double.isNaN(maxDist) || maxDist < 0) {
                throw new DomainException("maxDist must be non-negative, got: " + maxDist);
            }
            this.maxDist = maxDist;
            return this;
        }

        public Builder nTranstreeReps(int nTranstreeReps) {
            if (nTranstreeReps < 1) {
                throw new DomainException("nTranstreeReps must be at least 1, got: " + nTranstreeReps);
            }
            this.nTranstreeReps = nTranstreeReps;
            return this;
        }

        public Builder timeOrdering(TimeOrdering timeOrdering) {
            this.timeOrdering = Objects.requireNonNull(timeOrdering, "timeOrdering");
            return this;
        }

        public Builder meanEqualsSd(boolean meanEqualsSd) {
            this.meanEqualsSd = meanEqualsSd;
            return this;
        }

        public Builder bootIter(int bootIter) {
            if (bootIter < 1) {
                throw new DomainException("bootIter must be at least 1, got: " + bootIter);
            }
            this.bootIter = bootIter;
            return this;
        }

        public Builder ciLow(double ciLow) {
            this.ciLow = ciLow;
            return this;
        }

        public Builder ciHigh(double ciHigh) {
            this.ciHigh = ciHigh;
            return this;
        }

        public Builder minCases(int minCases) {
            if (minCases < 1) {
                throw new DomainException("minCases must be at least 1, got: " + minCases);
            }
            this.minCases = minCases;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Validates cross-field constraints and builds the options.
         *
         * @throws DomainException if the generation time is missing, the
         *     window is empty, or the quantiles are out of order
         */
        public EstimatorOptions build() {
            if (genTime == null) {
                throw new DomainException("A generation time is required");
            }
            if (t1 > t2) {
                throw new DomainException("t1 must not exceed t2, got: [" + t1 + ", " + t2 + "]");
            }
            if (!(ciLow >= 0 && ciLow <= ciHigh && ciHigh <= 1)) {
                throw new DomainException("Quantiles must satisfy 0 <= ciLow <= ciHigh <= 1, got: ["
                    + ciLow + ", " + ciHigh + "]");
            }
            return new EstimatorOptions(this);
        }
    }
}
