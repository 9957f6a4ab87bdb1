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

import io.spatialepi.transdist.api.CaseTable;
import io.spatialepi.transdist.api.ShapeMismatchException;
import io.spatialepi.transdist.kernel.gentime.GenerationTime;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Expands a time-indexed Wallinga-Teunis matrix into per-case infector
 * probabilities.
 *
 * <h2>Shares among cases at one source time</h2>
 *
 * <p>Every candidate case {@code i} of destination {@code j} receives its
 * time bucket's weight, and the column is normalized over all candidates:
 *
 * <pre>{@code
 * P[i][j] = W[time(i)][time(j)] / sum_k W[time(k)][time(j)]     (k != j)
 * }</pre>
 *
 * <p>Cases sharing a source time get equal shares, so a source time holding
 * more cases carries proportionally more of the column. Each destination's
 * inbound probabilities sum to 1 whenever any candidate exists.
 */
public final class PairwiseInfectorExpander {

    private static final Logger logger = LogManager.getLogger(PairwiseInfectorExpander.class);

    private PairwiseInfectorExpander() {
    }

    /**
     * Builds the time matrix for a table and expands it.
     *
     * @param cases the case table
     * @param generationTime the generation time
     * @param ordering the lag rule
     * @return the case-indexed matrix
     */
    public static PairwiseInfectorMatrix expand(CaseTable cases, GenerationTime generationTime, TimeOrdering ordering) {
        WallingaTeunisMatrix matrix = new WallingaTeunisMatrixBuilder(generationTime, ordering).build(cases);
        return expand(cases, matrix);
    }

    /**
     * Expands a prebuilt or caller-supplied time matrix.
     *
     * @param cases the case table
     * @param matrix a matrix indexed by exactly the table's unique onset times
     * @return the case-indexed matrix, using the time matrix's ordering
     * @throws ShapeMismatchException if the matrix times differ from the table's
     */
    public static PairwiseInfectorMatrix expand(CaseTable cases, WallingaTeunisMatrix matrix) {
        int[] uniqueTimes = cases.uniqueTimes();
        if (!matrix.matches(uniqueTimes)) {
            throw new ShapeMismatchException("Wallinga-Teunis matrix", uniqueTimes, matrix.times());
        }

        int n = cases.size();
        int u = uniqueTimes.length;
        int[][] buckets = bucketByTime(cases, u);

        int[][] sources = new int[n][];
        double[][] probabilities = new double[n][];
        double[] weightByCase = new double[n];

        for (int j = 0; j < n; j++) {
            int b = cases.timeIndex(j);
            int count = 0;
            double total = 0.0;
            for (int a = 0; a < u; a++) {
                double w = matrix.weight(a, b);
                if (w <= 0) {
                    continue;
                }
                for (int i : buckets[a]) {
                    if (i == j) {
                        continue;
                    }
                    weightByCase[i] = w;
                    total += w;
                    count++;
                }
            }
            int[] idx = new int[count];
            double[] p = new double[count];
            int k = 0;
            for (int i = 0; i < n && k < count; i++) {
                if (weightByCase[i] > 0) {
                    idx[k] = i;
                    p[k] = weightByCase[i] / total;
                    weightByCase[i] = 0.0;
                    k++;
                }
            }
            sources[j] = idx;
            probabilities[j] = p;
        }

        logger.debug("Expanded {} unique times into {} case columns", u, n);
        return new PairwiseInfectorMatrix(sources, probabilities, matrix.ordering());
    }

    private static int[][] bucketByTime(CaseTable cases, int u) {
        int[] counts = new int[u];
        for (int i = 0; i < cases.size(); i++) {
            counts[cases.timeIndex(i)]++;
        }
        int[][] buckets = new int[u][];
        for (int a = 0; a < u; a++) {
            buckets[a] = new int[counts[a]];
        }
        int[] fill = new int[u];
        for (int i = 0; i < cases.size(); i++) {
            int a = cases.timeIndex(i);
            buckets[a][fill[a]++] = i;
        }
        return buckets;
    }
}
