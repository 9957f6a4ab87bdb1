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
import org.apache.commons.math3.distribution.RealDistribution;

import java.util.Objects;

/**
 * A continuous generation-time distribution discretized to whole time steps.
 *
 * <h2>Discretization</h2>
 *
 * <pre>{@code
 * p(lag) = [F(lag + 0.5) - F(lag - 0.5)] / [1 - F(-0.5)]     lag >= 0
 * }</pre>
 *
 * <p>where {@code F} is the family's CDF. Mass below {@code -0.5} is dropped
 * and the rest renormalized, so the lags {@code 0, 1, 2, ...} sum to 1.
 * Any lag can be queried; there is no fixed support length.
 */
public final class DiscretizedGenerationTime implements GenerationTime {

    private final GenerationTimeFamily family;
    private final double mean;
    private final double sd;
    private final RealDistribution distribution;
    private final double retainedMass;

    private DiscretizedGenerationTime(GenerationTimeFamily family, double mean, double sd) {
        this.family = family;
        this.mean = mean;
        this.sd = sd;
        this.distribution = family.distribution(mean, sd);
        this.retainedMass = 1.0 - distribution.cumulativeProbability(-0.5);
        if (!(retainedMass > 0)) {
            throw new DomainException("Generation time " + this + " has no mass at non-negative lags");
        }
    }

    /**
     * Discretizes a family with the given moments.
     *
     * @param family the parametric family
     * @param mean the mean generation time in steps; must be positive
     * @param sd the standard deviation in steps; must be positive
     * @return the discretized generation time
     * @throws DomainException if a parameter is not positive and finite
     */
    public static DiscretizedGenerationTime of(GenerationTimeFamily family, double mean, double sd) {
        Objects.requireNonNull(family, "family");
        if (!(mean > 0) || !Double.isFinite(mean)) {
            throw new DomainException("Generation time mean must be positive and finite, got: " + mean);
        }
        if (!(sd > 0) || !Double.isFinite(sd)) {
            throw new DomainException("Generation time sd must be positive and finite, got: " + sd);
        }
        return new DiscretizedGenerationTime(family, mean, sd);
    }

    @Override
    public double probability(int lag) {
        if (lag < 0) {
            return 0.0;
        }
        double mass = distribution.cumulativeProbability(lag + 0.5)
            - distribution.cumulativeProbability(lag - 0.5);
        return Math.max(0.0, mass) / retainedMass;
    }

    @Override
    public double mean() {
        return mean;
    }

    public double sd() {
        return sd;
    }

    public GenerationTimeFamily family() {
        return family;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscretizedGenerationTime)) return false;
        DiscretizedGenerationTime that = (DiscretizedGenerationTime) o;
        return family == that.family &&
               Double.compare(that.mean, mean) == 0 &&
               Double.compare(that.sd, sd) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, mean, sd);
    }

    @Override
    public String toString() {
        return "DiscretizedGenerationTime[family=" + family + ", mean=" + mean + ", sd=" + sd + "]";
    }
}
