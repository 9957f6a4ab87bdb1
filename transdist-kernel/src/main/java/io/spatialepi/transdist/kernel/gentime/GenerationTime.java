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

/// Probability mass function of the generation time over non-negative integer
/// lags, in time steps.
///
/// Implementations are immutable and safe to query from any thread.
public interface GenerationTime {

    /// Returns the probability of a generation time of exactly `lag` steps;
    /// 0 for negative lags and lags outside the support.
    double probability(int lag);

    /// Returns the mean generation time in steps.
    double mean();

    /// A discretized normal generation time.
    static GenerationTime normal(double mean, double sd) {
        return DiscretizedGenerationTime.of(GenerationTimeFamily.NORMAL, mean, sd);
    }

    /// A discretized gamma generation time.
    static GenerationTime gamma(double mean, double sd) {
        return DiscretizedGenerationTime.of(GenerationTimeFamily.GAMMA, mean, sd);
    }

    /// An explicit mass vector over lags `0..pmf.length-1`.
    static GenerationTime explicit(double... pmf) {
        return ExplicitGenerationTime.of(pmf);
    }
}
