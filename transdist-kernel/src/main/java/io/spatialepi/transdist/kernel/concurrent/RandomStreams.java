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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Seeded random sources for independent trials.
 *
 * <p>Every trial (one sampled transmission tree, one bootstrap resample, one
 * temporal step) gets its own provider. The per-trial seeds are all drawn from
 * one base provider before any trial runs, so results do not depend on the
 * order in which workers pick trials up:
 *
 * <pre>{@code
 * long[] seeds = RandomStreams.trialSeeds(baseSeed, nReps);
 * // trial i, on any thread:
 * UniformRandomProvider rng = RandomStreams.create(seeds[i]);
 * }</pre>
 *
 * <p>XO_SHI_RO_256_PP is used throughout: 256-bit state, period 2^256 - 1.
 */
public final class RandomStreams {

    private static final RandomSource SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private RandomStreams() {
        // Utility class
    }

    /**
     * Creates a provider for one trial.
     *
     * @param seed the trial seed
     * @return a provider owned by the caller; not safe to share between threads
     */
    public static RestorableUniformRandomProvider create(long seed) {
        return SOURCE.create(seed);
    }

    /**
     * Derives the base seed of a tagged sub-stream of a run seed. Stages that
     * share the run seed but use different tags draw unrelated trial seeds.
     *
     * @param baseSeed the seed of the whole run
     * @param streamTag a constant naming the stage
     * @return the sub-stream's base seed
     */
    public static long substream(long baseSeed, long streamTag) {
        return SOURCE.create(new long[]{baseSeed, streamTag}).nextLong();
    }

    /**
     * Derives {@code count} trial seeds from one base seed.
     *
     * @param baseSeed the seed of the whole run
     * @param count the number of trials
     * @return the per-trial seeds, in trial order
     */
    public static long[] trialSeeds(long baseSeed, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got: " + count);
        }
        RestorableUniformRandomProvider base = create(baseSeed);
        long[] seeds = new long[count];
        for (int i = 0; i < count; i++) {
            seeds[i] = base.nextLong();
        }
        return seeds;
    }
}
