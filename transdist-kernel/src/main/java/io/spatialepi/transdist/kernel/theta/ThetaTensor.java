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

import java.util.Arrays;

/**
 * Probability that two cases at given onset times are separated by exactly
 * {@code theta} transmission generations, {@code theta} in {@code 1..maxSep}.
 *
 * <p>The first two dimensions index {@link #times()}. Slices are symmetric,
 * {@code (a, b) == (b, a)}. A slice is defined when at least one case pair at
 * those times was linked within {@code maxSep}; a defined slice sums to 1
 * across theta, an undefined slice is all zero.
 *
 * <p>Only the thetas between a slice's smallest and largest observed value
 * are stored, so size tracks the sampled forests rather than {@code U² · maxSep}.
 *
 * <p>Instances are immutable.
 */
public final class ThetaTensor {

    private final int[] times;
    private final int maxSep;
    private final ThetaSlices slices;

    ThetaTensor(int[] times, int maxSep, ThetaSlices slices) {
        this.times = times;
        this.maxSep = maxSep;
        this.slices = slices;
    }

    ThetaSlices slices() {
        return slices;
    }

    /**
     * Returns the ascending onset times indexing the first two dimensions.
     */
    public int[] times() {
        return times.clone();
    }

    public int timeCount() {
        return times.length;
    }

    /**
     * Returns the largest theta the tensor may hold.
     */
    public int maxSep() {
        return maxSep;
    }

    /**
     * Returns the largest theta with non-zero mass in any slice, 0 when no
     * slice is defined.
     */
    public int longestTheta() {
        int longest = 0;
        for (int s = 0; s < slices.size(); s++) {
            longest = Math.max(longest, slices.last(s));
        }
        return longest;
    }

    /**
     * Returns the number of distinct slices, {@code U * (U + 1) / 2}.
     */
    public int sliceCount() {
        return slices.size();
    }

    /**
     * Returns the position of slice {@code (a, b)} among the distinct slices;
     * {@code (a, b)} and {@code (b, a)} share a position.
     */
    public int sliceIndex(int a, int b) {
        return slices.index(a, b);
    }

    public boolean matches(int[] uniqueTimes) {
        return Arrays.equals(times, uniqueTimes);
    }

    public boolean isDefined(int a, int b) {
        return slices.has(slices.index(a, b));
    }

    /**
     * Returns the probability that cases at time indices {@code a} and
     * {@code b} are {@code theta} generations apart.
     */
    public double get(int a, int b, int theta) {
        return slices.get(slices.index(a, b), theta);
    }

    /**
     * Returns the full slice for time indices {@code (a, b)}; element {@code k}
     * holds {@code theta = k + 1}.
     */
    public double[] slice(int a, int b) {
        int s = slices.index(a, b);
        double[] full = new double[maxSep];
        if (slices.has(s)) {
            double[] run = slices.run(s);
            System.arraycopy(run, 0, full, slices.first(s) - 1, run.length);
        }
        return full;
    }

    public double sliceSum(int a, int b) {
        return slices.sum(slices.index(a, b));
    }

    /**
     * Returns {@code sum_theta w(theta) * f(theta)} for one slice, with
     * {@code perTheta[k]} holding {@code f(k + 1)}; {@code perTheta} must cover
     * {@link #longestTheta()}.
     */
    public double weightedSum(int a, int b, double[] perTheta) {
        int s = slices.index(a, b);
        if (!slices.has(s)) {
            return 0.0;
        }
        double[] run = slices.run(s);
        int offset = slices.first(s) - 1;
        double sum = 0.0;
        for (int k = 0; k < run.length; k++) {
            sum += run[k] * perTheta[offset + k];
        }
        return sum;
    }

    /**
     * Counts defined slices over ordered time pairs, so an off-diagonal slice
     * counts twice.
     */
    public int definedSliceCount() {
        int count = 0;
        for (int a = 0; a < times.length; a++) {
            for (int b = a; b < times.length; b++) {
                if (isDefined(a, b)) {
                    count += a == b ? 1 : 2;
                }
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ThetaTensor)) return false;
        ThetaTensor that = (ThetaTensor) o;
        return maxSep == that.maxSep &&
               Arrays.equals(times, that.times) &&
               slices.equals(that.slices);
    }

    @Override
    public int hashCode() {
        int result = 31 * Arrays.hashCode(times) + maxSep;
        return 31 * result + slices.hashCode();
    }

    @Override
    public String toString() {
        return "ThetaTensor[times=" + times.length + ", maxSep=" + maxSep +
               ", longestTheta=" + longestTheta() + ", definedSlices=" + definedSliceCount() + "]";
    }
}
