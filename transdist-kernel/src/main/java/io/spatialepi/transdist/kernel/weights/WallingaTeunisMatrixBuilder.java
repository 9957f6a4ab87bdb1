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
import io.spatialepi.transdist.kernel.gentime.GenerationTime;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/**
 * Builds the Wallinga-Teunis matrix over the unique onset times of a case list.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 * for each destination time b:
 *     for each source time a with ordering.admits(t_b - t_a):
 *         W[a][b] = g(t_b - t_a)
 *     W[.][b] /= sum_a W[a][b]        (left at 0 when the sum is 0)
 * }</pre>
 *
 * <p>Example with times {@code [1, 2, 2, 3, 3]} and
 * {@code g = [0, 2/3, 1/3]}:
 *
 * <pre>{@code
 *          b=1   b=2   b=3
 *   a=1    0     1     1/3
 *   a=2    0     0     2/3
 *   a=3    0     0     0
 * }</pre>
 */
public final class WallingaTeunisMatrixBuilder {

    private static final Logger logger = LogManager.getLogger(WallingaTeunisMatrixBuilder.class);

    private final GenerationTime generationTime;
    private final TimeOrdering ordering;

    public WallingaTeunisMatrixBuilder(GenerationTime generationTime) {
        this(generationTime, TimeOrdering.STRICT);
    }

    public WallingaTeunisMatrixBuilder(GenerationTime generationTime, TimeOrdering ordering) {
        this.generationTime = Objects.requireNonNull(generationTime, "generationTime");
        this.ordering = Objects.requireNonNull(ordering, "ordering");
    }

    /**
     * Builds the matrix for the onset times of a case table.
     */
    public WallingaTeunisMatrix build(CaseTable cases) {
        return buildFromUnique(cases.uniqueTimes());
    }

    /**
     * Builds the matrix for a list of onset times; duplicates are allowed.
     *
     * @param caseTimes onset time steps, in any order
     * @return the matrix indexed by the ascending unique times
     */
    public WallingaTeunisMatrix build(int[] caseTimes) {
        return buildFromUnique(Arrays.stream(caseTimes).distinct().sorted().toArray());
    }

    private WallingaTeunisMatrix buildFromUnique(int[] times) {
        int u = times.length;
        double[] weights = new double[WallingaTeunisMatrix.cellCount(u)];
        for (int b = 0; b < u; b++) {
            for (int a = 0; a < u; a++) {
                long lag = (long) times[b] - times[a];
                // lags past the int range have no generation-time mass
                if (lag <= Integer.MAX_VALUE && lag >= Integer.MIN_VALUE && ordering.admits((int) lag)) {
                    weights[a * u + b] = generationTime.probability((int) lag);
                }
            }
        }
        WallingaTeunisMatrix.normalizeColumns(weights, u);
        logger.debug("Built {}x{} Wallinga-Teunis matrix ({} ordering)", u, u, ordering);
        return new WallingaTeunisMatrix(times, weights, ordering);
    }

    public GenerationTime generationTime() {
        return generationTime;
    }

    public TimeOrdering ordering() {
        return ordering;
    }
}
