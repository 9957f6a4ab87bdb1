package io.spatialepi.transdist.api.json;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.spatialepi.transdist.api.Case;
import io.spatialepi.transdist.api.KernelEstimate;
import io.spatialepi.transdist.api.TemporalEntry;
import io.spatialepi.transdist.api.TemporalSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TransdistGsonConfigTest {

    @Test
    void kernelEstimateUsesSnakeCaseNames() {
        String json = TransdistGsonConfig.compactGson().toJson(KernelEstimate.fromMean(2.0, 0, 5, 10L));
        JsonObject obj = JsonParser.parseString(json).getAsJsonObject();

        assertThat(obj.get("mu").getAsDouble()).isEqualTo(2.0);
        assertThat(obj.has("mu_bound")).isTrue();
        assertThat(obj.has("sigma_bound")).isTrue();
        assertThat(obj.get("t_end").getAsInt()).isEqualTo(5);
        assertThat(obj.get("pair_count").getAsLong()).isEqualTo(10L);
    }

    @Test
    void absentTemporalEntriesRenderAsNull() {
        TemporalSeries series = new TemporalSeries(List.of(
            TemporalEntry.absent(0, 1),
            TemporalEntry.of(1, 3, KernelEstimate.fromMean(1.5, 0, 1, 3L))));

        JsonObject obj = JsonParser.parseString(TransdistGsonConfig.gson().toJson(series)).getAsJsonObject();
        JsonArray entries = obj.getAsJsonArray("entries");

        assertThat(entries.size()).isEqualTo(2);
        assertThat(entries.get(0).getAsJsonObject().get("estimate").isJsonNull()).isTrue();
        assertThat(entries.get(1).getAsJsonObject().getAsJsonObject("estimate").get("mu").getAsDouble())
            .isEqualTo(1.5);
    }

    @Test
    void casesRoundTrip() {
        Case c = new Case(1.25, -3.5, 7);
        String json = TransdistGsonConfig.compactGson().toJson(c);
        assertThat(TransdistGsonConfig.gson().fromJson(json, Case.class)).isEqualTo(c);
    }

    @Test
    void nonFiniteValuesAreWritten() {
        String json = TransdistGsonConfig.compactGson().toJson(new double[]{Double.NaN, 1.0});
        assertThat(json).isEqualTo("[NaN,1.0]");
    }
}
