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

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;

/**
 * Parametric families a generation time can be discretized from.
 *
 * <p>Both are parameterized by mean and standard deviation. The gamma family
 * uses the method of moments: shape {@code k = mean²/sd²}, scale
 * {@code θ = sd²/mean}.
 */
public enum GenerationTimeFamily {

    NORMAL {
        @Override
        RealDistribution distribution(double mean, double sd) {
            return new NormalDistribution(null, mean, sd);
        }
    },

    GAMMA {
        @Override
        RealDistribution distribution(double mean, double sd) {
            double variance = sd * sd;
            return new GammaDistribution(null, mean * mean / variance, variance / mean);
        }
    };

    /**
     * Builds the continuous distribution; no sampling state is attached.
     */
    abstract RealDistribution distribution(double mean, double sd);
}
