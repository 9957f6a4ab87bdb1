package io.spatialepi.transdist.kernel.gentime;

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

import java.util.Arrays;

/// A caller-supplied generation-time mass vector, aligned to lags `0..k`.
///
/// The vector is normalized on construction; lags beyond `k` have
/// probability 0.
public final class ExplicitGenerationTime implements GenerationTime {

    private final double[] pmf;
    private final double mean;

    private ExplicitGenerationTime(double[] pmf) {
        this.pmf = pmf;
        double m = 0.0;
        for (int lag = 0; lag < pmf.length; lag++) {
            m += lag * pmf[lag];
        }
        this.mean = m;
    }

    /// Creates a generation time from a mass vector.
    ///
    /// @param weights relative weights for lags `0..weights.length-1`
    /// @return the normalized generation time
    /// @throws DomainException if the vector is empty, has a negative or
    ///     non-finite entry, or does not sum to a positive finite value
    public static ExplicitGenerationTime of(double... weights) {
        if (weights == null || weights.length == 0) {
            throw new DomainException("Generation time vector must not be empty");
        }
        double total = 0.0;
        for (int lag = 0; lag < weights.length; lag++) {
            double w = weights[lag];
            if (!Double.isFinite(w) || w < 0) {
                throw new DomainException("Generation time weight at lag " + lag + " is invalid: " + w);
            }
            total += w;
        }
        if (!(total > 0) || !Double.isFinite(total)) {
            throw new DomainException("Generation time vector must sum to a positive finite value, got: " + total);
        }
        double[] normalized = new double[weights.length];
        for (int lag = 0; lag < weights.length; lag++) {
            normalized[lag] = weights[lag] / total;
        }
        return new ExplicitGenerationTime(normalized);
    }

    @Override
    public double probability(int lag) {
        return lag < 0 || lag >= pmf.length ? 0.0 : pmf[lag];
    }

    @Override
    public double mean() {
        return mean;
    }

    /// Largest lag with an entry in the vector.
    public int maxLag() {
        return pmf.length - 1;
    }

    public double[] toArray() {
        return pmf.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExplicitGenerationTime)) return false;
        return Arrays.equals(pmf, ((ExplicitGenerationTime) o).pmf);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(pmf);
    }

    @Override
    public String toString() {
        return "ExplicitGenerationTime" + Arrays.toString(pmf);
    }
}
