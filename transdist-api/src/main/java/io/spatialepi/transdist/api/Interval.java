package io.spatialepi.transdist.api;

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

import com.google.gson.annotations.SerializedName;

/// A point estimate with its confidence bounds.
///
/// @param estimate the point estimate from the full data
/// @param low the lower confidence bound
/// @param high the upper confidence bound
public record Interval(
    @SerializedName("estimate") double estimate,
    @SerializedName("ci_low") double low,
    @SerializedName("ci_high") double high
) {

    /// True when {@code low - tolerance <= value <= high + tolerance}.
    public boolean contains(double value, double tolerance) {
        return value >= low - tolerance && value <= high + tolerance;
    }

    public double width() {
        return high - low;
    }
}
