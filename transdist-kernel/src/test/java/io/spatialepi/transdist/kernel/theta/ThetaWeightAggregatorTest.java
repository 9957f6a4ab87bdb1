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
import io.spatialepi.transdist.kernel.concurrent.RandomStreams;
import io.spatialepi.transdist.kernel.concurrent.TrialExecutor;
import io.spatialepi.transdist.kernel.fixtures.EpidemicSimulator;
import io.spatialepi.transdist.kernel.gentime.GenerationTime;
import io.spatialepi.transdist.kernel.weights.PairwiseInfectorExpander;
import io.spatialepi.transdist.kernel.weights.PairwiseInfectorMatrix;
import io.spatialepi.transdist.kernel.weights.TimeOrdering;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ThetaWeightAggregatorTest {

    private static CaseTable cases;
    private static PairwiseInfectorMatrix matrix;
    private static int maxSep;

    @BeforeAll
    static void setUp() {
        cases = new EpidemicSimulator(1.5, 10.0, 7).simulate(21L, 40, 250);
        matrix = PairwiseInfectorExpander.expand(cases, GenerationTime.normal(1.2, 0.6), TimeOrdering.STRICT);
        maxSep = ThetaSampler.effectiveMaxSep(Integer.MAX_VALUE, cases, TimeOrdering.STRICT);
    }

    @Test
    void parallelAggregationIsBitIdenticalToSequential() {
        ThetaTensor sequential = new ThetaWeightAggregator(TrialExecutor.sequential())
            .aggregate(matrix, cases, maxSep, 13, 99L);
        try (TrialExecutor executor = TrialExecutor.parallel(4)) {
            ThetaTensor parallel = new ThetaWeightAggregator(executor).aggregate(matrix, cases, maxSep, 13, 99L);
            assertThat(parallel).isEqualTo(sequential);
        }
    }

    @Test
    void sameSeedSameTensor() {
        ThetaWeightAggregator aggregator = new ThetaWeightAggregator(TrialExecutor.sequential());
        assertThat(aggregator.aggregate(matrix, cases, maxSep, 5, 3L))
            .isEqualTo(aggregator.aggregate(matrix, cases, maxSep, 5, 3L));
    }

    @Test
    void averagedSlicesSumToOne() {
        ThetaTensor tensor = new ThetaWeightAggregator(TrialExecutor.sequential())
            .aggregate(matrix, cases, maxSep, 20, 7L);

        assertThat(tensor.matches(cases.uniqueTimes())).isTrue();
        for (int a = 0; a < tensor.timeCount(); a++) {
            for (int b = 0; b < tensor.timeCount(); b++) {
                if (tensor.isDefined(a, b)) {
                    assertThat(tensor.sliceSum(a, b)).isCloseTo(1.0, within(1e-9));
                } else {
                    assertThat(tensor.sliceSum(a, b)).isZero();
                }
            }
        }
    }

    @Test
    void singleRepEqualsOneSampledForest() {
        ThetaTensor aggregated = new ThetaWeightAggregator(TrialExecutor.sequential())
            .aggregate(matrix, cases, maxSep, 1, 5L);
        ThetaTensor direct = new ThetaSampler(maxSep)
            .sample(matrix, cases, RandomStreams.create(RandomStreams.trialSeeds(5L, 1)[0]));
        assertThat(aggregated).isEqualTo(direct);
    }

    @Test
    void repsMustBePositive() {
        ThetaWeightAggregator aggregator = new ThetaWeightAggregator(TrialExecutor.sequential());
        assertThatThrownBy(() -> aggregator.aggregate(matrix, cases, maxSep, 0, 1L))
            .isInstanceOf(DomainException.class);
    }
}
