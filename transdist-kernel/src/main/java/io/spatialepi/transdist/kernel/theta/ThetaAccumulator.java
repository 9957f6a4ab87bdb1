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

/// Running per-slice sums of theta tensors, for averaging sampled forests.
///
/// Each slice is averaged over the draws in which it was defined. Not thread
/// safe: one accumulator belongs to one branch of a reduction, and is spent
/// once {@link #toTensor()} has been called.
final class ThetaAccumulator {

    private final int[] times;
    private final int maxSep;
    private final ThetaSlices sums;
    private final int[] draws;

    private ThetaAccumulator(int[] times, int maxSep) {
        this.times = times;
        this.maxSep = maxSep;
        this.sums = new ThetaSlices(times.length);
        this.draws = new int[sums.size()];
    }

    static ThetaAccumulator of(ThetaTensor tensor) {
        ThetaAccumulator acc = new ThetaAccumulator(tensor.times(), tensor.maxSep());
        acc.add(tensor);
        return acc;
    }

    void add(ThetaTensor tensor) {
        ThetaSlices slices = tensor.slices();
        for (int s = 0; s < draws.length; s++) {
            if (slices.has(s)) {
                draws[s]++;
                sums.addRun(s, slices.first(s), slices.run(s));
            }
        }
    }

    /// Adds the other accumulator's sums into this one and returns this.
    ThetaAccumulator merge(ThetaAccumulator other) {
        for (int s = 0; s < draws.length; s++) {
            if (other.draws[s] > 0) {
                draws[s] += other.draws[s];
                sums.addRun(s, other.sums.first(s), other.sums.run(s));
            }
        }
        return this;
    }

    ThetaTensor toTensor() {
        for (int s = 0; s < draws.length; s++) {
            if (draws[s] > 0) {
                sums.divide(s, draws[s]);
            }
        }
        return new ThetaTensor(times, maxSep, sums);
    }
}
