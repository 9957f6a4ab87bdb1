package io.spatialepi.transdist.kernel.bootstrap;

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

import io.spatialepi.transdist.api.BootstrapResult;
import io.spatialepi.transdist.api.CaseTable;
import io.spatialepi.transdist.api.Interval;
import io.spatialepi.transdist.api.KernelEstimate;
import io.spatialepi.transdist.api.TransdistException;
import io.spatialepi.transdist.kernel.concurrent.RandomStreams;
import io.spatialepi.transdist.kernel.concurrent.TrialExecutor;
import io.spatialepi.transdist.kernel.estimate.EstimatorOptions;
import io.spatialepi.transdist.kernel.estimate.KernelEstimator;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Bootstrap confidence intervals around a kernel estimate.
 *
 * <h2>Iterations</h2>
 *
 * <p>Iteration {@code k} draws its own random source from
 * {@code trialSeeds(substream(seed, BOOTSTRAP_STREAM), bootIter)[k]}; these
 * seeds are unrelated to the theta repetition seeds of the same base seed.
 * It resamples the windowed case table with replacement to the same size and
 * reruns the full kernel estimate on the resample, theta tensor included. Iterations are independent and run on
 * the injected executor.
 *
 * <h2>Failures</h2>
 *
 * <p>An iteration that fails fails the whole call; no partial interval is
 * returned.
 *
 * <h2>Quantiles</h2>
 *
 * <p>Bounds are empirical quantiles of the iteration estimates using the
 * type-7 estimator (linear interpolation between order statistics). Which
 * estimate variant is collected follows {@link EstimatorOptions#meanEqualsSd()}.
 */
public final class BootstrapEstimator {

    private static final Logger logger = LogManager.getLogger(BootstrapEstimator.class);

    /// Sub-stream tag of the resampling iterations ("bootstrp" in ASCII).
    static final long BOOTSTRAP_STREAM = 0x626f6f7473747270L;

    private final KernelEstimator kernelEstimator;
    private final TrialExecutor executor;

    public BootstrapEstimator(KernelEstimator kernelEstimator) {
        this(kernelEstimator, TrialExecutor.sequential());
    }

    /**
     * @param kernelEstimator the estimator rerun on each resample
     * @param executor runs the bootstrap iterations
     */
    public BootstrapEstimator(KernelEstimator kernelEstimator, TrialExecutor executor) {
        this.kernelEstimator = Objects.requireNonNull(kernelEstimator, "kernelEstimator");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public BootstrapResult estimate(CaseTable cases) {
        return estimate(cases, kernelEstimator.options().seed());
    }

    /**
     * Computes the point estimate and its bootstrap intervals.
     *
     * <p>The point estimate equals {@code kernelEstimator.estimate(cases, seed)}.
     *
     * @param cases the case table
     * @param seed base seed for the point estimate and the iterations
     * @return the intervals and per-iteration samples
     * @throws TransdistException if the point estimate or any iteration fails
     */
    public BootstrapResult estimate(CaseTable cases, long seed) {
        return estimateAround(kernelEstimator.estimate(cases, seed), cases, seed);
    }

    /**
     * Computes bootstrap intervals around an already computed point estimate
     * of the same table.
     *
     * @param point the kernel estimate of {@code cases}
     * @param cases the case table
     * @param seed base seed for the iterations
     * @return the intervals and per-iteration samples
     */
    public BootstrapResult estimateAround(KernelEstimate point, CaseTable cases, long seed) {
        EstimatorOptions options = kernelEstimator.options();
        boolean meanEqualsSd = options.meanEqualsSd();
        int iterations = options.bootIter();

        long start = System.nanoTime();
        CaseTable window = kernelEstimator.window(cases);
        long[] seeds = iterationSeeds(seed, iterations);

        List<KernelEstimate> estimates = executor.map(iterations, k -> {
            UniformRandomProvider rng = RandomStreams.create(seeds[k]);
            CaseTable resample = window.resample(rng);
            try {
                return kernelEstimator.estimate(resample, rng.nextLong());
            } catch (TransdistException e) {
                logger.warn("Bootstrap iteration {} of {} failed: {}", k, iterations, e.getMessage());
                throw e;
            }
        });

        double[] muSamples = new double[iterations];
        double[] sigmaSamples = new double[iterations];
        for (int k = 0; k < iterations; k++) {
            muSamples[k] = estimates.get(k).reportedMean(meanEqualsSd);
            sigmaSamples[k] = estimates.get(k).reportedSd(meanEqualsSd);
        }

        Interval mu = interval(point.reportedMean(meanEqualsSd), muSamples, options);
        Interval sigma = interval(point.reportedSd(meanEqualsSd), sigmaSamples, options);
        BootstrapResult result = new BootstrapResult(mu, sigma, options.ciLow(), options.ciHigh(),
            muSamples, sigmaSamples);

        logger.info("Bootstrap of {} cases, {} iterations in {} ms: mu={} [{}, {}]",
            window.size(), iterations, (System.nanoTime() - start) / 1_000_000,
            mu.estimate(), mu.low(), mu.high());
        return result;
    }

    static long[] iterationSeeds(long seed, int iterations) {
        return RandomStreams.trialSeeds(RandomStreams.substream(seed, BOOTSTRAP_STREAM), iterations);
    }

    private static Interval interval(double estimate, double[] samples, EstimatorOptions options) {
        return new Interval(estimate, quantile(samples, options.ciLow()), quantile(samples, options.ciHigh()));
    }

    /**
     * Type-7 empirical quantile; {@code p = 0} is the sample minimum.
     */
    static double quantile(double[] samples, double p) {
        if (p <= 0.0) {
            double min = Double.POSITIVE_INFINITY;
            for (double s : samples) {
                min = Math.min(min, s);
            }
            return min;
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(samples, Math.min(100.0, p * 100.0));
    }
}
