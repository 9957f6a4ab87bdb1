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
import io.spatialepi.transdist.kernel.gentime.GenerationTime;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class WallingaTeunisMatrixBuilderTest {

    private static final double EPS = 1e-12;

    @Test
    void threeTimeScenario() {
        GenerationTime g = GenerationTime.explicit(0, 2.0 / 3, 1.0 / 3, 0, 0);
        WallingaTeunisMatrix w = new WallingaTeunisMatrixBuilder(g).build(new int[]{1, 2, 2, 3, 3});

        assertThat(w.size()).isEqualTo(3);
        assertThat(w.times()).containsExactly(1, 2, 3);

        // time 1 has no earlier case
        assertThat(w.hasInfector(0)).isFalse();
        assertThat(w.columnSum(0)).isZero();

        // time 2 is infected only from time 1
        assertThat(w.weight(0, 1)).isCloseTo(1.0, within(EPS));
        assertThat(w.weight(1, 1)).isZero();
        assertThat(w.weight(2, 1)).isZero();

        // time 3 splits by lag: g(2) from time 1, g(1) from time 2
        assertThat(w.weight(0, 2)).isCloseTo(1.0 / 3, within(EPS));
        assertThat(w.weight(1, 2)).isCloseTo(2.0 / 3, within(EPS));
        assertThat(w.weight(2, 2)).isZero();
    }

    @ParameterizedTest
    @EnumSource(TimeOrdering.class)
    void columnsSumToZeroOrOne(TimeOrdering ordering) {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(11L);
        WallingaTeunisMatrixBuilder builder = new WallingaTeunisMatrixBuilder(GenerationTime.gamma(4.0, 2.0), ordering);
        for (int round = 0; round < 20; round++) {
            int[] times = new int[1 + rng.nextInt(40)];
            for (int i = 0; i < times.length; i++) {
                times[i] = rng.nextInt(30);
            }
            WallingaTeunisMatrix w = builder.build(times);
            for (int b = 0; b < w.size(); b++) {
                double sum = w.columnSum(b);
                assertThat(sum == 0.0 || Math.abs(sum - 1.0) < 1e-9)
                    .as("column %d sums to %f", b, sum).isTrue();
                for (int a = 0; a < w.size(); a++) {
                    assertThat(w.weight(a, b)).isGreaterThanOrEqualTo(0.0);
                }
            }
        }
    }

    @Test
    void strictOrderingNeverWeightsSameOrLaterTimes() {
        WallingaTeunisMatrix w = new WallingaTeunisMatrixBuilder(GenerationTime.normal(1.0, 1.0))
            .build(new int[]{0, 1, 2, 3});
        for (int a = 0; a < w.size(); a++) {
            for (int b = 0; b <= a; b++) {
                assertThat(w.weight(a, b)).isZero();
            }
        }
    }

    @Test
    void inclusiveOrderingWeightsSameTime() {
        WallingaTeunisMatrix w = new WallingaTeunisMatrixBuilder(GenerationTime.explicit(1, 1), TimeOrdering.INCLUSIVE)
            .build(new int[]{0, 1});
        assertThat(w.weight(0, 0)).isCloseTo(1.0, within(EPS));
        assertThat(w.weight(0, 1)).isCloseTo(0.5, within(EPS));
        assertThat(w.weight(1, 1)).isCloseTo(0.5, within(EPS));
    }

    @Test
    void lagsOutsideSupportLeaveColumnEmpty() {
        WallingaTeunisMatrix w = new WallingaTeunisMatrixBuilder(GenerationTime.explicit(0, 1))
            .build(new int[]{0, 5});
        assertThat(w.hasInfector(1)).isFalse();
        assertThat(w.columnSum(1)).isZero();
    }

    @Test
    void lagsBeyondIntRangeCarryNoWeight() {
        // the wrapped difference of these times is +-4, the lag with all the mass
        GenerationTime g = GenerationTime.explicit(0, 0, 0, 0, 1);
        for (TimeOrdering ordering : TimeOrdering.values()) {
            WallingaTeunisMatrix w = new WallingaTeunisMatrixBuilder(g, ordering)
                .build(new int[]{Integer.MIN_VALUE + 1, Integer.MAX_VALUE - 1});
            assertThat(w.hasInfector(0)).as("earliest time under %s", ordering).isFalse();
            assertThat(w.hasInfector(1)).as("latest time under %s", ordering).isFalse();
            assertThat(w.weight(1, 0)).isZero();
        }
    }

    @Test
    void suppliedMatrixIsValidatedAndNormalized() {
        WallingaTeunisMatrix w = WallingaTeunisMatrix.of(
            new int[]{1, 2}, new double[][]{{0, 3}, {0, 0}}, TimeOrdering.STRICT);
        assertThat(w.weight(0, 1)).isEqualTo(1.0);
        assertThat(w.toArray()[0][1]).isEqualTo(1.0);

        assertThatThrownBy(() -> WallingaTeunisMatrix.of(
            new int[]{2, 1}, new double[][]{{0, 1}, {0, 0}}, TimeOrdering.STRICT))
            .isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> WallingaTeunisMatrix.of(
            new int[]{1, 2}, new double[][]{{0, -1}, {0, 0}}, TimeOrdering.STRICT))
            .isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> WallingaTeunisMatrix.of(
            new int[]{1, 2}, new double[][]{{0, 1}}, TimeOrdering.STRICT))
            .isInstanceOf(DomainException.class);
    }
}
