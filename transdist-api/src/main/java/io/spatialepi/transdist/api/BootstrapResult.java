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

import java.util.Arrays;
import java.util.Objects;

/**
 * Bootstrap confidence intervals for the kernel mean and standard deviation.
 *
 * <p>The point estimates inside {@link #mu()} and {@link #sigma()} come from
 * the full case table; the bounds are empirical quantiles of the per-iteration
 * estimates, which are kept in iteration order.
 */
public final class BootstrapResult {

    @SerializedName("mu")
    private final Interval mu;

    @SerializedName("sigma")
    private final Interval sigma;

    @SerializedName("iterations")
    private final int iterations;

    @SerializedName("ci_low_quantile")
    private final double ciLow;

    @SerializedName("ci_high_quantile")
    private final double ciHigh;

    @SerializedName("mu_samples")
    private final double[] muSamples;

    @SerializedName("sigma_samples")
    private final double[] sigmaSamples;

    public BootstrapResult(Interval mu, Interval sigma, double ciLow, double ciHigh,
                           double[] muSamples, double[] sigmaSamples) {
        if (muSamples.length != sigmaSamples.length) {
            throw new DomainException("Sample arrays differ in length: "
                + muSamples.length + " vs " + sigmaSamples.length);
        }
        this.mu = Objects.requireNonNull(mu, "mu");
        this.sigma = Objects.requireNonNull(sigma, "sigma");
        this.iterations = muSamples.length;
        this.ciLow = ciLow;
        this.ciHigh = ciHigh;
        this.muSamples = muSamples.clone();
        this.sigmaSamples = sigmaSamples.clone();
    }

    public Interval mu() {
        return mu;
    }

    public Interval sigma() {
        return sigma;
    }

    public int iterations() {
        return iterations;
    }

    public double ciLow() {
        return ciLow;
    }

    public double ciHigh() {
        return ciHigh;
    }

    public double[] muSamples() {
        return muSamples.clone();
    }

    public double[] sigmaSamples() {
        return sigmaSamples.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BootstrapResult)) return false;
        BootstrapResult that = (BootstrapResult) o;
        return Double.compare(that.ciLow, ciLow) == 0 &&
               Double.compare(that.ciHigh, ciHigh) == 0 &&
               mu.equals(that.mu) &&
               sigma.equals(that.sigma) &&
               Arrays.equals(muSamples, that.muSamples) &&
               Arrays.equals(sigmaSamples, that.sigmaSamples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(mu, sigma, ciLow, ciHigh);
        result = 31 * result + Arrays.hashCode(muSamples);
        return 31 * result + Arrays.hashCode(sigmaSamples);
    }

    @Override
    public String toString() {
        return "BootstrapResult[mu=" + mu + ", sigma=" + sigma +
               ", iterations=" + iterations + ", quantiles=(" + ciLow + ", " + ciHigh + ")]";
    }
}
