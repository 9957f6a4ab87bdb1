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

/// One observed infection: a location and a binned onset time step.
///
/// @param x the x coordinate
/// @param y the y coordinate
/// @param t the onset time step
public record Case(
    @SerializedName("x") double x,
    @SerializedName("y") double y,
    @SerializedName("t") int t
) {

    public Case {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new DomainException("Case coordinates must be finite, got: (" + x + ", " + y + ")");
        }
    }

    /// Euclidean distance between this case and another.
    public double distanceTo(Case other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
