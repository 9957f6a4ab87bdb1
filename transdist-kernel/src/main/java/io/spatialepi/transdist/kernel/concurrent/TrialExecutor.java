package io.spatialepi.transdist.kernel.concurrent;

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

import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.IntFunction;

/**
 * Runs independent, indexed trials and gathers their results.
 *
 * <h2>Determinism</h2>
 *
 * <p>{@link #map} returns results in trial order. {@link #reduce} combines
 * results along a fixed binary split of the index range,
 * {@code [lo, hi) -> [lo, mid) + [mid, hi)} with {@code mid = (lo + hi) >>> 1},
 * always as {@code combiner(left, right)}. Sequential and parallel executors
 * therefore produce bit-identical floating point reductions.
 *
 * <h2>Failures</h2>
 *
 * <p>A runtime exception thrown by any trial propagates out of the call; no
 * partial result is returned.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (TrialExecutor executor = TrialExecutor.parallel(8)) {
 *     KernelEstimator estimator = new KernelEstimator(options, executor);
 *     KernelEstimate estimate = estimator.estimate(cases);
 * }
 * }</pre>
 */
public interface TrialExecutor extends AutoCloseable {

    /**
     * Runs trials {@code 0 .. count-1} and returns their results in trial order.
     *
     * @param count the number of trials; may be zero
     * @param trial computes the result of one trial
     * @param <T> the result type
     * @return the results, index-aligned with the trials
     */
    <T> List<T> map(int count, IntFunction<T> trial);

    /**
     * Runs trials {@code 0 .. count-1} and folds their results along the fixed
     * split tree.
     *
     * <p>The combiner may mutate and return its left argument; each partial
     * result is owned by exactly one branch of the tree.
     *
     * @param count the number of trials; must be positive
     * @param trial computes the result of one trial
     * @param combiner merges the left and right partial results
     * @param <T> the result type
     * @return the combined result
     */
    <T> T reduce(int count, IntFunction<T> trial, BinaryOperator<T> combiner);

    /**
     * Returns the maximum number of trials run at the same time.
     */
    int parallelism();

    /**
     * Releases worker threads owned by this executor.
     */
    @Override
    void close();

    /**
     * Returns an executor that runs every trial on the calling thread.
     */
    static TrialExecutor sequential() {
        return SequentialTrialExecutor.INSTANCE;
    }

    /**
     * Returns a pool-backed executor using half the available processors.
     */
    static TrialExecutor parallel() {
        return new ForkJoinTrialExecutor(defaultParallelism());
    }

    /**
     * Returns a pool-backed executor with the given number of workers.
     *
     * @param parallelism the number of worker threads; must be positive
     */
    static TrialExecutor parallel(int parallelism) {
        return new ForkJoinTrialExecutor(parallelism);
    }

    /**
     * Returns half of the available processors, at least 1.
     */
    static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }
}
