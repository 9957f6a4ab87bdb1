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


import io.spatialepi.transdist.api.DomainException;
import io.spatialepi.transdist.kernel.gentime.GenerationTime;
import io.spatialepi.transdist.kernel.gentime.GenerationTimeFamily;
import io.spatialepi.transdist.kernel.weights.TimeOrdering;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EstimatorOptionsTest {

    @Test
    void defaultsApplyWhenOnlyGenerationTimeIsGiven() {
        EstimatorOptions options = EstimatorOptions.builder().genTime(5.0, 2.0).build();

        assertThat(options.genTime()).isEqualTo(GenerationTime.normal(5.0, 2.0));
        assertThat(options.t1()).isEqualTo(Integer.MIN_VALUE);
        assertThat(options.t2()).isEqualTo(Integer.MAX_VALUE);
        assertThat(options.maxSep()).isEqualTo(Integer.MAX_VALUE);
        assertThat(options.maxDist()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(options.nTranstreeReps()).isEqualTo(EstimatorOptions.DEFAULT_TRANSTREE_REPS);
        assertThat(options.timeOrdering()).isEqualTo(TimeOrdering.STRICT);
        assertThat(options.meanEqualsSd()).isFalse();
        assertThat(options.bootIter()).isEqualTo(EstimatorOptions.DEFAULT_BOOT_ITER);
        assertThat(options.ciLow()).isEqualTo(0.025);
        assertThat(options.ciHigh()).isEqualTo(0.975);
        assertThat(options.minCases()).isEqualTo(EstimatorOptions.DEFAULT_MIN_CASES);
        assertThat(options.seed()).isEqualTo(EstimatorOptions.DEFAULT_SEED);
    }

    @Test
    void generationTimeFormsAreInterchangeable() {
        assertThat(EstimatorOptions.builder().genTime(GenerationTimeFamily.GAMMA, 4.0, 1.0).build().genTime())
            .isEqualTo(GenerationTime.gamma(4.0, 1.0));
        assertThat(EstimatorOptions.builder().genTimeVector(0, 0.5, 0.5).build().genTime())
            .isEqualTo(GenerationTime.explicit(0, 0.5, 0.5));
    }

    @Test
    void generationTimeIsRequired() {
        assertThatThrownBy(() -> EstimatorOptions.builder().build())
            .isInstanceOf(DomainException.class)
            .hasMessageContaining("generation time");
    }

    @Test
    void invalidValuesAreRejected() {
        EstimatorOptions.Builder builder = EstimatorOptions.builder().genTime(5.0, 2.0);

        assertThatThrownBy(() -> builder.maxSep(0)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> builder.maxDist(-1.0)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> builder.maxDist(Double.NaN)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> builder.nTranstreeReps(0)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> builder.bootIter(0)).isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> builder.minCases(0)).isInstanceOf(DomainException.class);
    }

    @Test
    void windowAndQuantilesAreCheckedOnBuild() {
        assertThatThrownBy(() -> EstimatorOptions.builder().genTime(5.0, 2.0).t1(10).t2(3).build())
            .isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> EstimatorOptions.builder().genTime(5.0, 2.0).ciLow(0.9).ciHigh(0.1).build())
            .isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> EstimatorOptions.builder().genTime(5.0, 2.0).ciHigh(1.5).build())
            .isInstanceOf(DomainException.class);

        EstimatorOptions degenerate = EstimatorOptions.builder().genTime(5.0, 2.0).t1(4).t2(4).ciLow(0).ciHigh(0).build();
        assertThat(degenerate.t1()).isEqualTo(degenerate.t2());
        assertThat(degenerate.ciHigh()).isZero();
    }

    @Test
    void toBuilderCopiesEverySetting() {
        EstimatorOptions original = EstimatorOptions.builder()
            .genTimeVector(0, 1)
            .t1(2).t2(9)
            .maxSep(6)
            .maxDist(50.0)
            .nTranstreeReps(3)
            .timeOrdering(TimeOrdering.INCLUSIVE)
            .meanEqualsSd(true)
            .bootIter(7)
            .ciLow(0.1).ciHigh(0.9)
            .minCases(4)
            .seed(99L)
            .build();

        EstimatorOptions copy = original.toBuilder().build();
        assertThat(copy.toString()).isEqualTo(original.toString());

        EstimatorOptions reseeded = original.toBuilder().seed(100L).build();
        assertThat(reseeded.seed()).isEqualTo(100L);
        assertThat(reseeded.maxSep()).isEqualTo(6);
        assertThat(original.seed()).isEqualTo(99L);
    }
}
