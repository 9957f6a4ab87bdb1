package io.spatialepi.transdist.kernel.theta;

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
import io.spatialepi.transdist.api.DomainException;
import io.spatialepi.transdist.kernel.concurrent.RandomStreams;
import io.spatialepi.transdist.kernel.concurrent.TrialExecutor;
import io.spatialepi.transdist.kernel.weights.PairwiseInfectorMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Averages the theta tensors of many independently sampled forests.
 *
 * <h2>Flow</h2>
 *
 * <pre>{@code
 * seeds = trialSeeds(seed, nReps)
 *   rep 0: forest(seeds[0]) -> tensor ┐
 *   rep 1: forest(seeds[1]) -> tensor ├─ fixed-tree sum ─> per-slice mean
 *   ...                               │
 *   rep n: forest(seeds[n]) -> tensor ┘
 * }</pre>
 *
 * <p>The pairwise matrix is shared read-only across repetitions; each
 * repetition owns its random source. A slice's average is taken over the
 * repetitions in which it was defined, so every defined slice of the result
 * sums to 1.
 */
public final class ThetaWeightAggregator {

    private static final Logger logger = LogManager.getLogger(ThetaWeightAggregator.class);

    private final TrialExecutor executor;

    public ThetaWeightAggregator(TrialExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Samples {@code nReps} forests and averages their tensors.
     *
     * @param matrix pairwise infector probabilities for {@code cases}
     * @param cases the case table
     * @param maxSep the largest theta counted (already capped by the caller)
     * @param nReps the number of forests; must be positive
     * @param seed the base seed of this aggregation
     * @return the averaged tensor
     */
    public ThetaTensor aggregate(PairwiseInfectorMatrix matrix, CaseTable cases, int maxSep, int nReps, long seed) {
        if (nReps < 1) {
            throw new DomainException("nReps must be at least 1, got: " + nReps);
        }
        ThetaSampler sampler = new ThetaSampler(maxSep);
        long[] seeds = RandomStreams.trialSeeds(seed, nReps);

        long start = System.nanoTime();
        ThetaAccumulator total = executor.reduce(nReps,
            rep -> ThetaAccumulator.of(sampler.sample(matrix, cases, RandomStreams.create(seeds[rep]))),
            ThetaAccumulator::merge);
        ThetaTensor tensor = total.toTensor();

        if (logger.isDebugEnabled()) {
            logger.debug("Aggregated {} forests over {} cases in {} ms: {}",
                nReps, cases.size(), (System.nanoTime() - start) / 1_000_000, tensor);
        }
        return tensor;
    }
}
