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

import io.spatialepi.transdist.api.CaseTable;
import io.spatialepi.transdist.api.InsufficientDataException;
import io.spatialepi.transdist.api.KernelEstimate;
import io.spatialepi.transdist.api.ShapeMismatchException;
import io.spatialepi.transdist.kernel.concurrent.TrialExecutor;
import io.spatialepi.transdist.kernel.theta.ThetaSampler;
import io.spatialepi.transdist.kernel.theta.ThetaTensor;
import io.spatialepi.transdist.kernel.theta.ThetaWeightAggregator;
import io.spatialepi.transdist.kernel.weights.PairwiseInfectorExpander;
import io.spatialepi.transdist.kernel.weights.PairwiseInfectorMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Estimates the mean and standard deviation of the transmission kernel from
 * case locations and onset times alone.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>{@code
 * cases ─ filter [t1, t2] ─> window
 *   window ─> Wallinga-Teunis ─> pairwise infectors ─> theta tensor (nReps forests)
 *   window pairs + theta tensor ─> weighted mean
 * }</pre>
 *
 * <h2>Weighted mean</h2>
 *
 * <p>With {@code S(a, b)} the summed distance of the {@code n(a, b)} usable
 * pairs at time indices {@code a <= b}, and {@code w} the theta tensor:
 *
 * <pre>{@code
 * mu = [ sum_{a<=b} 2 * S(a, b) / sum_theta w(a, b, theta) * sqrt(2 * pi * theta) ] / sum_{a<=b} n(a, b)
 * }</pre>
 *
 * <p>A pair is usable when its distance is at most {@code maxDist} and its time
 * slice is defined in the tensor. The derivation assumes the kernel's mean
 * equals its standard deviation; the bounded variants are {@code √2} times
 * larger.
 *
 * <p>The estimator holds no mutable state; one instance may serve concurrent
 * callers, and the same table and seed always give a bit-identical result.
 */
public final class KernelEstimator {

    private static final Logger logger = LogManager.getLogger(KernelEstimator.class);

    private static final double TWO_PI = 2.0 * Math.PI;

    private final EstimatorOptions options;
    private final ThetaWeightAggregator aggregator;

    /**
     * Creates an estimator that runs every repetition on the calling thread.
     */
    public KernelEstimator(EstimatorOptions options) {
        this(options, TrialExecutor.sequential());
    }

    /**
     * @param options the estimation settings
     * @param executor runs the transmission-tree repetitions
     */
    public KernelEstimator(EstimatorOptions options, TrialExecutor executor) {
        this.options = Objects.requireNonNull(options, "options");
        this.aggregator = new ThetaWeightAggregator(executor);
    }

    public EstimatorOptions options() {
        return options;
    }

    /**
     * Restricts a table to the configured {@code [t1, t2]} window.
     */
    public CaseTable window(CaseTable cases) {
        return cases.filter(options.t1(), options.t2());
    }

    /**
     * Estimates the kernel using the configured seed.
     */
    public KernelEstimate estimate(CaseTable cases) {
        return estimate(cases, options.seed());
    }

    /**
     * Estimates the kernel, seeding the transmission-tree draws with {@code seed}.
     *
     * @param cases the case table; filtered to the configured window first
     * @param seed the base seed of the theta aggregation
     * @return the estimate
     * @throws InsufficientDataException if the window has fewer than 2 unique
     *     onset times or no usable case pair
     */
    public KernelEstimate estimate(CaseTable cases, long seed) {
        CaseTable window = window(cases);
        requireTimes(window);
        return combine(window, thetaWeightsOf(window, seed));
    }

    /**
     * Estimates the kernel against a precomputed theta tensor.
     *
     * @param cases the case table; filtered to the configured window first
     * @param seed the base seed, used only when {@code thetaWeights} is null
     * @param thetaWeights a tensor over the window's unique onset times, or
     *     {@code null} to sample one
     * @throws ShapeMismatchException if the tensor times differ from the window's
     */
    public KernelEstimate estimate(CaseTable cases, long seed, ThetaTensor thetaWeights) {
        if (thetaWeights == null) {
            return estimate(cases, seed);
        }
        CaseTable window = window(cases);
        requireTimes(window);
        int[] uniqueTimes = window.uniqueTimes();
        if (!thetaWeights.matches(uniqueTimes)) {
            throw new ShapeMismatchException("theta tensor", uniqueTimes, thetaWeights.times());
        }
        return combine(window, thetaWeights);
    }

    /**
     * Returns the theta tensor this estimator would use for a table and seed.
     *
     * @throws InsufficientDataException if the window has fewer than 2 unique onset times
     */
    public ThetaTensor thetaWeights(CaseTable cases, long seed) {
        CaseTable window = window(cases);
        requireTimes(window);
        return thetaWeightsOf(window, seed);
    }

    private ThetaTensor thetaWeightsOf(CaseTable window, long seed) {
        long start = System.nanoTime();
        PairwiseInfectorMatrix matrix = PairwiseInfectorExpander.expand(window, options.genTime(), options.timeOrdering());
        int maxSep = ThetaSampler.effectiveMaxSep(options.maxSep(), window, options.timeOrdering());
        ThetaTensor tensor = aggregator.aggregate(matrix, window, maxSep, options.nTranstreeReps(), seed);
        logger.debug("Theta weights for {} cases ({} unique times, maxSep {}) in {} ms",
            window.size(), window.uniqueTimeCount(), maxSep, (System.nanoTime() - start) / 1_000_000);
        return tensor;
    }

    private static void requireTimes(CaseTable window) {
        if (window.uniqueTimeCount() < 2) {
            throw new InsufficientDataException("Need at least 2 unique onset times", window.uniqueTimeCount(), 0L);
        }
    }

    private KernelEstimate combine(CaseTable window, ThetaTensor tensor) {
        int n = window.size();
        int u = window.uniqueTimeCount();
        double maxDist = options.maxDist();

        double[] distSums = new double[tensor.sliceCount()];
        long[] pairCounts = new long[tensor.sliceCount()];
        for (int i = 0; i < n; i++) {
            int ti = window.timeIndex(i);
            for (int j = i + 1; j < n; j++) {
                int tj = window.timeIndex(j);
                int a = Math.min(ti, tj);
                int b = Math.max(ti, tj);
                if (!tensor.isDefined(a, b)) {
                    continue;
                }
                double d = window.get(i).distanceTo(window.get(j));
                if (d > maxDist) {
                    continue;
                }
                int slice = tensor.sliceIndex(a, b);
                distSums[slice] += d;
                pairCounts[slice]++;
            }
        }

        int longest = tensor.longestTheta();
        double[] spread = new double[longest];
        for (int k = 0; k < longest; k++) {
            spread[k] = Math.sqrt(TWO_PI * (k + 1));
        }

        double weighted = 0.0;
        long totalPairs = 0L;
        for (int a = 0; a < u; a++) {
            for (int b = a; b < u; b++) {
                int slice = tensor.sliceIndex(a, b);
                long count = pairCounts[slice];
                if (count == 0) {
                    continue;
                }
                weighted += 2.0 * distSums[slice] / tensor.weightedSum(a, b, spread);
                totalPairs += count;
            }
        }

        if (totalPairs == 0) {
            throw new InsufficientDataException("No case pairs within maxDist and maxSep", u, 0L);
        }
        double mu = weighted / totalPairs;
        if (!Double.isFinite(mu)) {
            throw new InsufficientDataException("Kernel mean is not finite", u, totalPairs);
        }

        int[] times = window.uniqueTimes();
        KernelEstimate estimate = KernelEstimate.fromMean(mu, times[0], times[u - 1], totalPairs);
        logger.debug("Kernel estimate over [{}, {}] from {} pairs: mu={}", times[0], times[u - 1], totalPairs, mu);
        return estimate;
    }

    @Override
    public String toString() {
        return "KernelEstimator{" + options + '}';
    }
}
