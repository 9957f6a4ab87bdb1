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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/// Kernel estimates over cumulative windows, one entry per unique onset time
/// in ascending order.
public final class TemporalSeries implements Iterable<TemporalEntry> {

    @SerializedName("entries")
    private final List<TemporalEntry> entries;

    public TemporalSeries(List<TemporalEntry> entries) {
        List<TemporalEntry> copy = new ArrayList<>(entries);
        for (int i = 1; i < copy.size(); i++) {
            if (copy.get(i).time() <= copy.get(i - 1).time()) {
                throw new DomainException("Temporal entries must be in strictly ascending time order, got "
                    + copy.get(i - 1).time() + " before " + copy.get(i).time());
            }
        }
        this.entries = Collections.unmodifiableList(copy);
    }

    public int size() {
        return entries.size();
    }

    public TemporalEntry get(int index) {
        return entries.get(index);
    }

    public List<TemporalEntry> entries() {
        return entries;
    }

    /// Returns the entry for an onset time, if that time is part of the series.
    public Optional<TemporalEntry> at(int time) {
        for (TemporalEntry entry : entries) {
            if (entry.time() == time) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public int[] times() {
        return entries.stream().mapToInt(TemporalEntry::time).toArray();
    }

    public long presentCount() {
        return entries.stream().filter(TemporalEntry::isPresent).count();
    }

    /// Reported kernel means by step; absent steps are `NaN`.
    public double[] reportedMeans(boolean meanEqualsSd) {
        return entries.stream()
            .mapToDouble(e -> e.estimate().map(k -> k.reportedMean(meanEqualsSd)).orElse(Double.NaN))
            .toArray();
    }

    @Override
    public Iterator<TemporalEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemporalSeries)) return false;
        return entries.equals(((TemporalSeries) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "TemporalSeries[steps=" + entries.size() + ", present=" + presentCount() + "]";
    }
}
