package io.spatialepi.transdist.kernel.temporal;

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
import io.spatialepi.transdist.api.InsufficientDataException;
import io.spatialepi.transdist.api.KernelEstimate;
import io.spatialepi.transdist.api.TemporalEntry;
import io.spatialepi.transdist.api.TemporalSeries;
import io.spatialepi.transdist.kernel.bootstrap.BootstrapEstimator;
import io.spatialepi.transdist.kernel.concurrent.TrialExecutor;
import io.spatialepi.transdist.kernel.estimate.EstimatorOptions;
import io.spatialepi.transdist.kernel.estimate.KernelEstimator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Kernel estimates over cumulative windows, one per unique onset time.
 *
 * <pre>{@code
 * window times: t_0 < t_1 < ... < t_m
 *   entry k = estimate({case : t <= t_k})     or absent
 * }</pre>
 *
 * <p>An entry is absent when its window holds fewer than
 * {@link EstimatorOptions#minCases()} cases, or when the estimate reports
 * insufficient data. Absent entries never stop the series; any other failure
 * does. Every window is estimated with the configured seed, so the last entry
 * equals the estimate of the whole window.
 */
public final class TemporalEstimator {

    private static final Logger logger = LogManager.getLogger(TemporalEstimator.class);

    private final KernelEstimator kernelEstimator;
    private final TrialExecutor executor;

    public TemporalEstimator(KernelEstimator kernelEstimator) {
        this(kernelEstimator, TrialExecutor.sequential());
    }

    /**
     * @param kernelEstimator the estimator run on each cumulative window
     * @param executor runs the windows, and the bootstrap iterations of the
     *     bootstrap variant
     */
    public TemporalEstimator(KernelEstimator kernelEstimator, TrialExecutor executor) {
        this.kernelEstimator = Objects.requireNonNull(kernelEstimator, "kernelEstimator");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Point estimates for each cumulative window.
     */
    public TemporalSeries estimate(CaseTable cases) {
        return run(cases, null);
    }

    /**
     * Point estimates with bootstrap intervals for each cumulative window.
     */
    public TemporalSeries estimateWithBootstrap(CaseTable cases) {
        return run(cases, new BootstrapEstimator(kernelEstimator, executor));
    }

    private TemporalSeries run(CaseTable cases, BootstrapEstimator bootstrap) {
        EstimatorOptions options = kernelEstimator.options();
        CaseTable window = kernelEstimator.window(cases);
        int[] times = window.uniqueTimes();
        long seed = options.seed();

        long start = System.nanoTime();
        List<TemporalEntry> entries = executor.map(times.length, k -> {
            int tau = times[k];
            CaseTable subset = window.upTo(tau);
            if (subset.size() < options.minCases()) {
                return TemporalEntry.absent(tau, subset.size());
            }
            try {
                KernelEstimate point = kernelEstimator.estimate(subset, seed);
                if (bootstrap == null) {
                    return TemporalEntry.of(tau, subset.size(), point);
                }
                BootstrapResult intervals = bootstrap.estimateAround(point, subset, seed);
                return TemporalEntry.of(tau, subset.size(), point, intervals);
            } catch (InsufficientDataException e) {
                logger.debug("No estimate at t={}: {}", tau, e.getMessage());
                return TemporalEntry.absent(tau, subset.size());
            }
        });

        TemporalSeries series = new TemporalSeries(entries);
        logger.info("Temporal series over {} time steps ({} present{}) in {} ms",
            series.size(), series.presentCount(), bootstrap == null ? "" : ", bootstrapped",
            (System.nanoTime() - start) / 1_000_000);
        return series;
    }
}
