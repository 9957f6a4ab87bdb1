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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for rendering estimation results.
///
/// ## Usage
///
/// ```java
/// Gson gson = TransdistGsonConfig.gson();
///
/// KernelEstimate estimate = estimator.estimate(cases);
/// String json = gson.toJson(estimate);
/// // {"mu": 12.4, "sigma": 12.4, "mu_bound": 17.5, ...}
///
/// TemporalSeries series = temporal.estimate(cases);
/// String seriesJson = gson.toJson(series);
/// // absent steps render as "estimate": null
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable reports |
/// | Serialize nulls | Enabled | Absent temporal steps stay visible |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | Special floats | Allowed | NaN sample slots survive a round trip |
///
/// The [Gson] instances are thread-safe and shared.
public final class TransdistGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();

    private static final Gson COMPACT = builder().create();

    private TransdistGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns a single-line instance, suitable for NDJSON output.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new builder with the result-rendering defaults, for callers
    /// that need further customization.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
