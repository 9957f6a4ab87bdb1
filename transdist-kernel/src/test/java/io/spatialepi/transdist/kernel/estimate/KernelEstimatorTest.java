package io.spatialepi.transdist.kernel.estimate;

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
import io.spatialepi.transdist.api.InsufficientDataException;
import io.spatialepi.transdist.api.KernelEstimate;
import io.spatialepi.transdist.api.ShapeMismatchException;
import io.spatialepi.transdist.kernel.concurrent.TrialExecutor;
import io.spatialepi.transdist.kernel.fixtures.EpidemicSimulator;
import io.spatialepi.transdist.kernel.theta.ThetaTensor;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class KernelEstimatorTest {

    private static final double KERNEL_SD = 10.0;

    private static CaseTable cases;

    @BeforeAll
    static void setUp() {
        cases = new EpidemicSimulator(1.5, KERNEL_SD, 8).simulate(1234L, 60, 300);
    }

    private static EstimatorOptions.Builder options() {
        return EstimatorOptions.builder().genTimeVector(0, 1).nTranstreeReps(5);
    }

    @Test
    void identicalInputsGiveBitIdenticalEstimates() {
        KernelEstimator estimator = new KernelEstimator(options().seed(77L).build());

        KernelEstimate first = estimator.estimate(cases);
        KernelEstimate second = estimator.estimate(cases);

        assertThat(second).isEqualTo(first);
        assertThat(Double.doubleToLongBits(second.mu())).isEqualTo(Double.doubleToLongBits(first.mu()));
    }

    @Test
    void parallelRepetitionsMatchSequential() {
        EstimatorOptions opts = options().build();
        KernelEstimate sequential = new KernelEstimator(opts).estimate(cases, 5L);
        try (TrialExecutor executor = TrialExecutor.parallel(3)) {
            assertThat(new KernelEstimator(opts, executor).estimate(cases, 5L)).isEqualTo(sequential);
        }
    }

    @Test
    void estimateHasEqualMeanAndSdAndBounds() {
        KernelEstimate estimate = new KernelEstimator(options().build()).estimate(cases);
        int[] times = cases.uniqueTimes();

        assertThat(estimate.mu()).isPositive().isFinite();
        assertThat(estimate.sigma()).isEqualTo(estimate.mu());
        assertThat(estimate.muBound()).isCloseTo(Math.sqrt(2) * estimate.mu(), within(1e-9));
        assertThat(estimate.t1()).isEqualTo(times[0]);
        assertThat(estimate.tEnd()).isEqualTo(times[times.length - 1]);
        assertThat(estimate.pairCount()).isPositive();
    }

    @Test
    void precomputedTensorGivesSameEstimate() {
        KernelEstimator estimator = new KernelEstimator(options().build());
        ThetaTensor tensor = estimator.thetaWeights(cases, 42L);

        assertThat(estimator.estimate(cases, 0L, tensor)).isEqualTo(estimator.estimate(cases, 42L));
        assertThat(estimator.estimate(cases, 42L, null)).isEqualTo(estimator.estimate(cases, 42L));
    }

    @Test
    void precomputedTensorMustMatchWindowTimes() {
        KernelEstimator estimator = new KernelEstimator(options().build());
        ThetaTensor tensor = estimator.thetaWeights(cases.upTo(cases.uniqueTimes()[2]), 1L);

        assertThatThrownBy(() -> estimator.estimate(cases, 1L, tensor))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void windowBoundsAreApplied() {
        int[] times = cases.uniqueTimes();
        KernelEstimator estimator = new KernelEstimator(options().t1(times[1]).t2(times[4]).build());

        KernelEstimate estimate = estimator.estimate(cases);

        assertThat(estimate.t1()).isEqualTo(times[1]);
        assertThat(estimate.tEnd()).isEqualTo(times[4]);
        assertThat(estimator.window(cases).uniqueTimes()).containsExactly(times[1], times[2], times[3], times[4]);
    }

    @Test
    void maxDistDropsFarPairs() {
        KernelEstimate all = new KernelEstimator(options().build()).estimate(cases);
        KernelEstimate near = new KernelEstimator(options().maxDist(2 * KERNEL_SD).build()).estimate(cases);

        assertThat(near.pairCount()).isLessThan(all.pairCount());
        assertThat(near.mu()).isLessThan(all.mu());
    }

    @Test
    void singleOnsetTimeIsInsufficient() {
        CaseTable flat = CaseTable.of(new double[]{0, 1, 2}, new double[]{0, 1, 2}, new int[]{4, 4, 4});
        KernelEstimator estimator = new KernelEstimator(options().build());

        assertThatThrownBy(() -> estimator.estimate(flat))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("unique times: 1");
    }

    @Test
    void windowWithOneTimeIsInsufficient() {
        int t = cases.uniqueTimes()[3];
        KernelEstimator estimator = new KernelEstimator(options().t1(t).t2(t).build());
        assertThatThrownBy(() -> estimator.estimate(cases)).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void noPairWithinMaxDistIsInsufficient() {
        CaseTable spread = CaseTable.of(new double[]{0, 100, 200}, new double[3], new int[]{0, 1, 2});
        KernelEstimator estimator = new KernelEstimator(options().maxDist(1.0).build());
        assertThatThrownBy(() -> estimator.estimate(spread))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("usable pairs: 0");
    }

    @Test
    void unlinkedTimesAreInsufficient() {
        // lags of 5 steps are outside a [0, 1] generation time
        CaseTable gap = CaseTable.of(new double[]{0, 3}, new double[]{0, 4}, new int[]{0, 5});
        assertThatThrownBy(() -> new KernelEstimator(options().build()).estimate(gap))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void handCheckedTwoGenerationTable() {
        // one infector at t=0 and two infectees at t=1, all forests identical:
        // theta(0,1) = theta(0,2) = 1, theta(1,2) = 2
        CaseTable tiny = CaseTable.of(new double[]{0, 3, 0}, new double[]{0, 4, -5}, new int[]{0, 1, 1});
        KernelEstimate estimate = new KernelEstimator(options().build()).estimate(tiny);

        double crossSlice = 2 * (5.0 + 5.0) / Math.sqrt(2 * Math.PI);
        double sameSlice = 2 * Math.hypot(3, 9) / Math.sqrt(4 * Math.PI);
        assertThat(estimate.pairCount()).isEqualTo(3);
        assertThat(estimate.mu()).isCloseTo((crossSlice + sameSlice) / 3, within(1e-9));
    }

    @Test
    void moreTreeRepsReduceRunToRunSpread() {
        SummaryStatistics few = new SummaryStatistics();
        SummaryStatistics many = new SummaryStatistics();
        KernelEstimator oneRep = new KernelEstimator(options().nTranstreeReps(1).build());
        KernelEstimator thirtyReps = new KernelEstimator(options().nTranstreeReps(30).build());
        for (long seed = 1; seed <= 8; seed++) {
            few.addValue(oneRep.estimate(cases, seed).mu());
            many.addValue(thirtyReps.estimate(cases, seed).mu());
        }
        assertThat(many.getStandardDeviation()).isLessThan(few.getStandardDeviation());
    }

    @Test
    @Tag("accuracy")
    void convergesToSimulatedKernel() {
        EpidemicSimulator simulator = new EpidemicSimulator(1.5, KERNEL_SD, 10);
        KernelEstimator estimator = new KernelEstimator(EstimatorOptions.builder()
            .genTimeVector(0, 1)
            .nTranstreeReps(50)
            .build());

        SummaryStatistics estimates = new SummaryStatistics();
        for (long seed = 100; seed < 106; seed++) {
            CaseTable outbreak = simulator.simulate(seed, 100, 500);
            estimates.addValue(estimator.estimate(outbreak).mu());
        }
        assertThat(estimates.getMean()).isCloseTo(KERNEL_SD, within(0.2 * KERNEL_SD));
    }

    /// One case a day on a 20-wide grid with 3 units between neighbours.
    private static CaseTable dailySeries(int days) {
        double[] x = new double[days];
        double[] y = new double[days];
        int[] t = new int[days];
        for (int d = 0; d < days; d++) {
            x[d] = 3.0 * (d % 20);
            y[d] = 3.0 * (d / 20);
            t[d] = d;
        }
        return CaseTable.of(x, y, t);
    }

    @Test
    void longDailySeriesIsEstimated() {
        KernelEstimate estimate = new KernelEstimator(EstimatorOptions.builder().genTime(5.0, 2.0).build())
            .estimate(dailySeries(400));

        assertThat(estimate.mu()).isPositive();
        assertThat(Double.isFinite(estimate.mu())).isTrue();
    }

    @Test
    void thetaTensorCoversThousandsOfDays() {
        CaseTable daily = dailySeries(1100);
        KernelEstimator estimator = new KernelEstimator(
            EstimatorOptions.builder().genTime(5.0, 2.0).nTranstreeReps(2).build());

        ThetaTensor tensor = estimator.thetaWeights(daily, 3L);

        assertThat(tensor.timeCount()).isEqualTo(1100);
        assertThat(tensor.sliceCount()).isEqualTo(605_550);
        assertThat(tensor.maxSep()).isEqualTo(2 * 1099);
        assertThat(tensor.longestTheta()).isBetween(1, tensor.maxSep());
        assertThat(tensor.sliceSum(0, 1099)).isCloseTo(1.0, within(1e-9));

        KernelEstimate estimate = estimator.estimate(daily, 3L, tensor);
        assertThat(estimate.mu()).isPositive();
        assertThat(Double.isFinite(estimate.mu())).isTrue();
    }
}
