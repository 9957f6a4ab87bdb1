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

import io.spatialepi.transdist.api.DomainException;

import java.util.Arrays;

/// Theta mass per time slice, over the upper triangle `a <= b` of time index
/// pairs.
///
/// Each slice is a dense run from its smallest to its largest observed theta,
/// so storage follows the thetas that actually occur rather than `maxSep`.
/// Both ends of a run are non-zero. An undefined slice has no run.
///
/// ```
/// index(a, b) = a * U - a * (a - 1) / 2 + (b - a)      for a <= b
/// ```
///
/// Not thread safe; a tensor only reads its slices once built.
final class ThetaSlices {

    private static final int MAX_SLICES = Integer.MAX_VALUE - 8;

    private final int timeCount;
    private final double[][] runs;
    private final int[] firsts;

    ThetaSlices(int timeCount) {
        int count = sliceCount(timeCount);
        this.timeCount = timeCount;
        this.runs = new double[count][];
        this.firsts = new int[count];
    }

    /// Number of slices for `timeCount` unique times.
    ///
    /// @throws DomainException if the triangle does not fit in an array
    static int sliceCount(int timeCount) {
        long count = Math.multiplyExact((long) timeCount, (long) timeCount + 1) / 2;
        if (count > MAX_SLICES) {
            throw new DomainException("Too many unique onset times for a theta tensor: " + timeCount);
        }
        return (int) count;
    }

    int index(int a, int b) {
        long lo = Math.min(a, b);
        long hi = Math.max(a, b);
        long row = Math.multiplyExact(lo, timeCount) - lo * (lo - 1) / 2;
        return Math.toIntExact(row + hi - lo);
    }

    int size() {
        return runs.length;
    }

    boolean has(int slice) {
        return runs[slice] != null;
    }

    int first(int slice) {
        return firsts[slice];
    }

    /// Largest theta of the slice, 0 when undefined.
    int last(int slice) {
        double[] run = runs[slice];
        return run == null ? 0 : firsts[slice] + run.length - 1;
    }

    /// The live run; callers must not modify it.
    double[] run(int slice) {
        return runs[slice];
    }

    double get(int slice, int theta) {
        double[] run = runs[slice];
        if (run == null) {
            return 0.0;
        }
        int k = theta - firsts[slice];
        return k < 0 || k >= run.length ? 0.0 : run[k];
    }

    void add(int slice, int theta, double mass) {
        cover(slice, theta, theta);
        runs[slice][theta - firsts[slice]] += mass;
    }

    /// Adds a run starting at theta `from` into the slice.
    void addRun(int slice, int from, double[] values) {
        cover(slice, from, from + values.length - 1);
        double[] run = runs[slice];
        int offset = from - firsts[slice];
        for (int k = 0; k < values.length; k++) {
            run[offset + k] += values[k];
        }
    }

    double sum(int slice) {
        double[] run = runs[slice];
        double total = 0.0;
        if (run != null) {
            for (double v : run) {
                total += v;
            }
        }
        return total;
    }

    void divide(int slice, double divisor) {
        double[] run = runs[slice];
        for (int k = 0; k < run.length; k++) {
            run[k] /= divisor;
        }
    }

    int definedCount() {
        int count = 0;
        for (double[] run : runs) {
            if (run != null) {
                count++;
            }
        }
        return count;
    }

    private void cover(int slice, int lo, int hi) {
        double[] run = runs[slice];
        if (run == null) {
            runs[slice] = new double[hi - lo + 1];
            firsts[slice] = lo;
            return;
        }
        int curLo = firsts[slice];
        int curHi = curLo + run.length - 1;
        if (lo >= curLo && hi <= curHi) {
            return;
        }
        int newLo = Math.min(lo, curLo);
        int newHi = Math.max(hi, curHi);
        double[] grown = new double[newHi - newLo + 1];
        System.arraycopy(run, 0, grown, curLo - newLo, run.length);
        runs[slice] = grown;
        firsts[slice] = newLo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ThetaSlices)) return false;
        ThetaSlices that = (ThetaSlices) o;
        return timeCount == that.timeCount &&
               Arrays.equals(firsts, that.firsts) &&
               Arrays.deepEquals(runs, that.runs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(firsts) + Arrays.deepHashCode(runs);
    }
}
