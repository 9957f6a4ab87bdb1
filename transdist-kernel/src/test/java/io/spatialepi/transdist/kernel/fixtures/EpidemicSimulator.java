package io.spatialepi.transdist.kernel.fixtures;

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

import io.spatialepi.transdist.api.Case;
import io.spatialepi.transdist.api.CaseTable;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.DiscreteSampler;
import org.apache.commons.rng.sampling.distribution.GaussianSampler;
import org.apache.commons.rng.sampling.distribution.PoissonSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratNormalizedGaussianSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.ArrayList;
import java.util.List;

/// Branching-process epidemic for tests.
///
/// One seed case at the origin at time 0. Every case in generation `g` has
/// Poisson(`r`) offspring in generation `g + 1`, each displaced by an
/// independent N(0, `sd`) step on both axes. Onset time equals generation, so
/// the matching generation time is the explicit vector `[0, 1]` and the
/// estimator should recover `sd`.
public final class EpidemicSimulator {

    private final double r;
    private final double sd;
    private final int generations;

    public EpidemicSimulator(double r, double sd, int generations) {
        this.r = r;
        this.sd = sd;
        this.generations = generations;
    }

    /// Runs outbreaks from `seed` until one reaches the last generation with a
    /// case count in `[minCases, maxCases]`. Every generation `0..generations`
    /// is then present as an onset time.
    public CaseTable simulate(long seed, int minCases, int maxCases) {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        DiscreteSampler offspring = PoissonSampler.of(rng, r);
        ContinuousSampler step = GaussianSampler.of(ZigguratNormalizedGaussianSampler.of(rng), 0.0, sd);
        for (int attempt = 0; attempt < 10_000; attempt++) {
            List<Case> cases = outbreak(offspring, step, maxCases);
            if (cases != null && cases.size() >= minCases) {
                return CaseTable.of(cases);
            }
        }
        throw new IllegalStateException("No outbreak of " + minCases + ".." + maxCases + " cases from seed " + seed);
    }

    private List<Case> outbreak(DiscreteSampler offspring, ContinuousSampler step, int maxCases) {
        List<Case> all = new ArrayList<>();
        List<Case> current = List.of(new Case(0.0, 0.0, 0));
        all.addAll(current);
        for (int g = 1; g <= generations; g++) {
            List<Case> next = new ArrayList<>();
            for (Case parent : current) {
                int children = offspring.sample();
                for (int c = 0; c < children; c++) {
                    next.add(new Case(parent.x() + step.sample(), parent.y() + step.sample(), g));
                }
            }
            all.addAll(next);
            if (next.isEmpty() || all.size() > maxCases) {
                return null;
            }
            current = next;
        }
        return all;
    }
}
