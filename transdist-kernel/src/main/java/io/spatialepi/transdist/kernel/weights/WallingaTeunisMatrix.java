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

import io.spatialepi.transdist.api.DomainException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Relative infector likelihoods between unique onset times.
 *
 * <p>Row {@code a}, column {@code b} is the likelihood that a case at
 * {@code times()[a]} infected a case at {@code times()[b]}. Each column sums
 * to 1, or to 0 when no earlier time can supply an infector (the first step,
 * or lags the generation time gives no mass).
 *
 * <p>Instances are immutable.
 */
public final class WallingaTeunisMatrix {

    private final int[] times;
    private final double[] weights;
    private final TimeOrdering ordering;

    WallingaTeunisMatrix(int[] times, double[] weights, TimeOrdering ordering) {
        this.times = times;
        this.weights = weights;
        this.ordering = ordering;
    }

    /**
     * Wraps a caller-computed matrix.
     *
     * <p>Columns are renormalized to sum to 1; all-zero columns stay zero.
     *
     * @param times the ascending unique onset times indexing rows and columns
     * @param weights the square weight matrix, {@code weights[a][b]}
     * @param ordering the lag rule the weights were computed under
     * @return the matrix
     * @throws DomainException if the times are not strictly ascending, the
     *     matrix is not square over the times, or an entry is negative or
     *     not finite
     */
    public static WallingaTeunisMatrix of(int[] times, double[][] weights, TimeOrdering ordering) {
        Objects.requireNonNull(ordering, "ordering");
        for (int i = 1; i < times.length; i++) {
            if (times[i] <= times[i - 1]) {
                throw new DomainException("Matrix times must be strictly ascending: " + Arrays.toString(times));
            }
        }
        int u = times.length;
        if (weights.length != u) {
            throw new DomainException("Expected " + u + " rows, got " + weights.length);
        }
        double[] flat = new double[cellCount(u)];
        for (int a = 0; a < u; a++) {
            if (weights[a].length != u) {
                throw new DomainException("Row " + a + " has " + weights[a].length + " columns, expected " + u);
            }
            for (int b = 0; b < u; b++) {
                double w = weights[a][b];
                if (!Double.isFinite(w) || w < 0) {
                    throw new DomainException("Weight (" + a + ", " + b + ") is invalid: " + w);
                }
                flat[a * u + b] = w;
            }
        }
        normalizeColumns(flat, u);
        return new WallingaTeunisMatrix(times.clone(), flat, ordering);
    }

    static int cellCount(int timeCount) {
        long cells = (long) timeCount * timeCount;
        if (cells > Integer.MAX_VALUE - 8) {
            throw new DomainException("Too many unique onset times for a weight matrix: " + timeCount);
        }
        return (int) cells;
    }

    static void normalizeColumns(double[] flat, int u) {
        for (int b = 0; b < u; b++) {
            double sum = 0.0;
            for (int a = 0; a < u; a++) {
                sum += flat[a * u + b];
            }
            if (sum > 0) {
                for (int a = 0; a < u; a++) {
                    flat[a * u + b] /= sum;
                }
            }
        }
    }

    public int size() {
        return times.length;
    }

    public int[] times() {
        return times.clone();
    }

    public int time(int index) {
        return times[index];
    }

    public TimeOrdering ordering() {
        return ordering;
    }

    /**
     * Returns the weight of source time index {@code a} for destination time index {@code b}.
     */
    public double weight(int a, int b) {
        return weights[a * times.length + b];
    }

    public double columnSum(int b) {
        double sum = 0.0;
        for (int a = 0; a < times.length; a++) {
            sum += weight(a, b);
        }
        return sum;
    }

    /**
     * True when some source time has positive weight for destination {@code b}.
     */
    public boolean hasInfector(int b) {
        for (int a = 0; a < times.length; a++) {
            if (weight(a, b) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether this matrix is indexed by exactly the given times.
     */
    public boolean matches(int[] uniqueTimes) {
        return Arrays.equals(times, uniqueTimes);
    }

    public double[][] toArray() {
        int u = times.length;
        double[][] copy = new double[u][u];
        for (int a = 0; a < u; a++) {
            System.arraycopy(weights, a * u, copy[a], 0, u);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "WallingaTeunisMatrix[times=" + Arrays.toString(times) + ", ordering=" + ordering + "]";
    }
}
