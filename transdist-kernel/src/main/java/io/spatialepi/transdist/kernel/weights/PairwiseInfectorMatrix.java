package io.spatialepi.transdist.kernel.weights;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.GuideTableDiscreteSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.Arrays;

/**
 * Probability that case {@code i} infected case {@code j}, over individual cases.
 *
 * <h2>Storage</h2>
 *
 * <p>Stored column-wise: for each destination case, the ascending indices of
 * its candidate infectors and their probabilities. Only cases with positive
 * probability are stored, so a column with no candidates marks a case with
 * no admissible infector.
 *
 * <h2>Sampling</h2>
 *
 * <p>Each non-empty column owns a guide-table sampler built once. A draw
 * rebinds that sampler's shared table to the caller's random source, so one
 * matrix serves any number of concurrent trials without shared random state.
 *
 * <p>Instances are immutable.
 */
public final class PairwiseInfectorMatrix {

    // Only used to build the guide tables; every draw rebinds to the trial's provider.
    private static final UniformRandomProvider TABLE_BUILD_SOURCE = RandomSource.SPLIT_MIX_64.create(0L);

    private final int[][] sources;
    private final double[][] probabilities;
    private final SharedStateDiscreteSampler[] samplers;
    private final TimeOrdering ordering;

    PairwiseInfectorMatrix(int[][] sources, double[][] probabilities, TimeOrdering ordering) {
        this.sources = sources;
        this.probabilities = probabilities;
        this.ordering = ordering;
        this.samplers = new SharedStateDiscreteSampler[sources.length];
        for (int j = 0; j < sources.length; j++) {
            if (sources[j].length > 0) {
                samplers[j] = GuideTableDiscreteSampler.of(TABLE_BUILD_SOURCE, probabilities[j]);
            }
        }
    }

    /**
     * Returns the number of cases.
     */
    public int size() {
        return sources.length;
    }

    public TimeOrdering ordering() {
        return ordering;
    }

    /**
     * Returns the probability that case {@code i} infected case {@code j}.
     */
    public double probability(int i, int j) {
        int pos = Arrays.binarySearch(sources[j], i);
        return pos < 0 ? 0.0 : probabilities[j][pos];
    }

    /**
     * Returns the total inbound probability of case {@code j}: 1 when any
     * infector is admissible, otherwise 0.
     */
    public double inboundSum(int j) {
        double sum = 0.0;
        for (double p : probabilities[j]) {
            sum += p;
        }
        return sum;
    }

    public boolean hasInfector(int j) {
        return sources[j].length > 0;
    }

    /**
     * Returns the candidate infectors of case {@code j}, ascending.
     */
    public int[] candidates(int j) {
        return sources[j].clone();
    }

    /**
     * Draws one infector for case {@code j}.
     *
     * @param j the infectee
     * @param rng the trial's random source
     * @return the infector index, or -1 when case {@code j} has no admissible infector
     */
    public int sampleInfector(int j, UniformRandomProvider rng) {
        SharedStateDiscreteSampler sampler = samplers[j];
        if (sampler == null) {
            return -1;
        }
        return sources[j][sampler.withUniformRandomProvider(rng).sample()];
    }

    /**
     * Expands to a dense {@code N x N} array, {@code [i][j]}.
     */
    public double[][] toArray() {
        int n = sources.length;
        double[][] dense = new double[n][n];
        for (int j = 0; j < n; j++) {
            for (int k = 0; k < sources[j].length; k++) {
                dense[sources[j][k]][j] = probabilities[j][k];
            }
        }
        return dense;
    }

    @Override
    public String toString() {
        long stored = Arrays.stream(sources).mapToLong(s -> s.length).sum();
        return "PairwiseInfectorMatrix[cases=" + sources.length + ", links=" + stored + "]";
    }
}
