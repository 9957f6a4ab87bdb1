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

import java.util.Objects;
import java.util.Optional;

/// One step of a temporal series: the estimate over all cases with onset at
/// or before {@link #time()}.
///
/// An entry is absent when the cumulative subset was too small to estimate.
/// Absence is distinct from a zero estimate; absent slots serialize as `null`.
public final class TemporalEntry {

    @SerializedName("time")
    private final int time;

    @SerializedName("case_count")
    private final int caseCount;

    @SerializedName("estimate")
    private final KernelEstimate estimate;

    @SerializedName("bootstrap")
    private final BootstrapResult bootstrap;

    private TemporalEntry(int time, int caseCount, KernelEstimate estimate, BootstrapResult bootstrap) {
        this.time = time;
        this.caseCount = caseCount;
        this.estimate = estimate;
        this.bootstrap = bootstrap;
    }

    public static TemporalEntry of(int time, int caseCount, KernelEstimate estimate) {
        return new TemporalEntry(time, caseCount, Objects.requireNonNull(estimate, "estimate"), null);
    }

    public static TemporalEntry of(int time, int caseCount, KernelEstimate estimate, BootstrapResult bootstrap) {
        return new TemporalEntry(time, caseCount,
            Objects.requireNonNull(estimate, "estimate"),
            Objects.requireNonNull(bootstrap, "bootstrap"));
    }

    public static TemporalEntry absent(int time, int caseCount) {
        return new TemporalEntry(time, caseCount, null, null);
    }

    public int time() {
        return time;
    }

    public int caseCount() {
        return caseCount;
    }

    public boolean isPresent() {
        return estimate != null;
    }

    public Optional<KernelEstimate> estimate() {
        return Optional.ofNullable(estimate);
    }

    public Optional<BootstrapResult> bootstrap() {
        return Optional.ofNullable(bootstrap);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemporalEntry)) return false;
        TemporalEntry that = (TemporalEntry) o;
        return time == that.time && caseCount == that.caseCount &&
               Objects.equals(estimate, that.estimate) &&
               Objects.equals(bootstrap, that.bootstrap);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, caseCount, estimate, bootstrap);
    }

    @Override
    public String toString() {
        return "TemporalEntry[time=" + time + ", cases=" + caseCount +
               ", estimate=" + (estimate == null ? "absent" : estimate) + "]";
    }
}
