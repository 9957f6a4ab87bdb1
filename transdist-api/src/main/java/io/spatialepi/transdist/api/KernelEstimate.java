package io.spatialepi.transdist.api;

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

import com.google.gson.annotations.SerializedName;

/**
 * Point estimate of the transmission kernel's mean and standard deviation.
 *
 * <p>The estimator derives {@code mu} under the assumption that the kernel's
 * mean and standard deviation are equal, so {@code sigma == mu}. When that
 * assumption does not hold, {@code muBound} and {@code sigmaBound}
 * ({@code √2} times the unbounded values) bound the true parameters.
 *
 * @param mu estimated kernel mean
 * @param sigma estimated kernel standard deviation
 * @param muBound upper bound of the kernel mean
 * @param sigmaBound upper bound of the kernel standard deviation
 * @param t1 first onset time step included in the estimate
 * @param tEnd last onset time step included in the estimate
 * @param pairCount number of case pairs contributing to the weighted sum
 */
public record KernelEstimate(
    @SerializedName("mu") double mu,
    @SerializedName("sigma") double sigma,
    @SerializedName("mu_bound") double muBound,
    @SerializedName("sigma_bound") double sigmaBound,
    @SerializedName("t1") int t1,
    @SerializedName("t_end") int tEnd,
    @SerializedName("pair_count") long pairCount
) {

    private static final double SQRT2 = Math.sqrt(2.0);

    /**
     * Creates an estimate from the unbounded mean, filling in the equal
     * standard deviation and both bounds.
     */
    public static KernelEstimate fromMean(double mu, int t1, int tEnd, long pairCount) {
        return new KernelEstimate(mu, mu, SQRT2 * mu, SQRT2 * mu, t1, tEnd, pairCount);
    }

    /**
     * Returns the mean to report.
     *
     * @param meanEqualsSd true to report the unbounded value, false for the bound
     */
    public double reportedMean(boolean meanEqualsSd) {
        return meanEqualsSd ? mu : muBound;
    }

    /**
     * Returns the standard deviation to report.
     *
     * @param meanEqualsSd true to report the unbounded value, false for the bound
     */
    public double reportedSd(boolean meanEqualsSd) {
        return meanEqualsSd ? sigma : sigmaBound;
    }
}
