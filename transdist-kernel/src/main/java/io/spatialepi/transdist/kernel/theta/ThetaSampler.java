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
import io.spatialepi.transdist.kernel.weights.PairwiseInfectorMatrix;
import io.spatialepi.transdist.kernel.weights.TimeOrdering;
import org.apache.commons.rng.UniformRandomProvider;

/**
 * Samples one transmission forest and tallies generation separations.
 *
 * <h2>Tree draw</h2>
 *
 * <p>Every case draws one infector from its column of the pairwise matrix.
 * Cases without an admissible infector become roots. Under
 * {@link TimeOrdering#STRICT} infectors precede infectees, so the parent
 * pointers form a forest.
 *
 * <h2>Separation</h2>
 *
 * <p>theta for a case pair is the number of transmission links on the tree
 * path between them, through their most recent common ancestor:
 *
 * <pre>{@code
 *            r
 *           / \
 *          p   q          theta(x, y) = 2 + 1 = 3
 *         / \   \         theta(p, x) = 1
 *        x   s   y        theta(x, s) = 2
 * }</pre>
 *
 * <p>Parent walks stop after {@code maxSep} steps. A pair whose path is longer,
 * or whose cases lie in different trees, is not linked and adds nothing.
 *
 * <h2>Output</h2>
 *
 * <p>Linked pairs are counted into their {@code (time_i, time_j, theta)} cell;
 * each non-empty time slice is then normalized to sum to 1. A slice only
 * stores the theta range its pairs produced.
 */
public final class ThetaSampler {

    private final int maxSep;

    /**
     * @param maxSep the largest theta counted; must be positive
     */
    public ThetaSampler(int maxSep) {
        if (maxSep < 1) {
            throw new DomainException("maxSep must be at least 1, got: " + maxSep);
        }
        this.maxSep = maxSep;
    }

    /**
     * Caps a requested {@code maxSep} at the longest path the case table can
     * produce: {@code 2 * (U - 1)} under strict ordering, {@code 2 * (N - 1)}
     * otherwise. Never less than 1.
     */
    public static int effectiveMaxSep(int requested, CaseTable cases, TimeOrdering ordering) {
        long span = ordering == TimeOrdering.STRICT ? cases.uniqueTimeCount() - 1L : cases.size() - 1L;
        long longest = Math.max(1L, 2L * span);
        return (int) Math.min(requested, longest);
    }

    public int maxSep() {
        return maxSep;
    }

    /**
     * Draws one infector per case.
     *
     * @return parent pointers, {@code -1} for roots
     */
    public int[] sampleInfectors(PairwiseInfectorMatrix matrix, UniformRandomProvider rng) {
        int n = matrix.size();
        int[] parents = new int[n];
        for (int j = 0; j < n; j++) {
            parents[j] = matrix.sampleInfector(j, rng);
        }
        return parents;
    }

    /**
     * Samples a forest and returns its normalized theta tensor.
     *
     * @param matrix pairwise infector probabilities for {@code cases}
     * @param cases the case table the matrix was expanded from
     * @param rng the trial's random source
     * @return the tensor for this one forest
     */
    public ThetaTensor sample(PairwiseInfectorMatrix matrix, CaseTable cases, UniformRandomProvider rng) {
        if (matrix.size() != cases.size()) {
            throw new DomainException("Matrix covers " + matrix.size() + " cases, table has " + cases.size());
        }
        return tally(sampleInfectors(matrix, rng), cases);
    }

    /**
     * Computes the normalized theta tensor of a given forest.
     *
     * @param parents parent pointers, {@code -1} for roots
     * @param cases the case table the pointers index into
     * @return the tensor
     */
    public ThetaTensor tally(int[] parents, CaseTable cases) {
        int n = cases.size();
        ThetaSlices counts = new ThetaSlices(cases.uniqueTimeCount());
        // a walk longer than n steps is going round a cycle
        int walkLimit = Math.min(maxSep, n);

        // markedBy[a] == i + 1 when a is on i's ancestor path, at distance markDist[a]
        int[] markedBy = new int[n];
        int[] markDist = new int[n];

        for (int i = 0; i < n; i++) {
            int stamp = i + 1;
            int node = i;
            for (int depth = 0; node >= 0 && depth <= walkLimit; depth++) {
                if (markedBy[node] == stamp) {
                    break;
                }
                markedBy[node] = stamp;
                markDist[node] = depth;
                node = parents[node];
            }

            int ti = cases.timeIndex(i);
            for (int j = i + 1; j < n; j++) {
                int walk = j;
                for (int depth = 0; walk >= 0 && depth <= walkLimit; depth++) {
                    if (markedBy[walk] == stamp) {
                        long theta = (long) markDist[walk] + depth;
                        if (theta >= 1 && theta <= maxSep) {
                            counts.add(counts.index(ti, cases.timeIndex(j)), (int) theta, 1.0);
                        }
                        break;
                    }
                    walk = parents[walk];
                }
            }
        }

        for (int s = 0; s < counts.size(); s++) {
            if (counts.has(s)) {
                counts.divide(s, counts.sum(s));
            }
        }
        return new ThetaTensor(cases.uniqueTimes(), maxSep, counts);
    }

    @Override
    public String toString() {
        return "ThetaSampler[maxSep=" + maxSep + "]";
    }
}
