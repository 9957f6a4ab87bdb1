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

import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered table of observed cases.
 *
 * <h2>Indexing</h2>
 *
 * <p>Each case keeps the position it was given at construction; every
 * case-indexed matrix built from a table uses that position. The table also
 * carries its ascending set of unique onset times, and for every case the
 * index of its time within that set:
 *
 * <pre>{@code
 * cases:        (0,0,1) (1,0,2) (2,0,2) (0,3,3)
 * uniqueTimes:  [1, 2, 3]
 * timeIndex:    0       1       1       2
 * }</pre>
 *
 * <h2>Derived tables</h2>
 *
 * <p>{@link #filter(int, int)}, {@link #upTo(int)} and
 * {@link #resample(UniformRandomProvider)} return new tables; nothing is ever
 * modified in place.
 */
public final class CaseTable implements Iterable<Case> {

    private final Case[] cases;
    private final int[] uniqueTimes;
    private final int[] timeIndex;

    private CaseTable(Case[] cases) {
        this.cases = cases;
        this.uniqueTimes = Arrays.stream(cases).mapToInt(Case::t).distinct().sorted().toArray();
        this.timeIndex = new int[cases.length];
        for (int i = 0; i < cases.length; i++) {
            timeIndex[i] = Arrays.binarySearch(uniqueTimes, cases[i].t());
        }
    }

    /**
     * Creates a table from a list of cases, keeping their order.
     *
     * @param cases the cases
     * @return the table
     */
    public static CaseTable of(List<Case> cases) {
        Objects.requireNonNull(cases, "cases");
        return new CaseTable(cases.toArray(new Case[0]));
    }

    /**
     * Creates a table from parallel coordinate and time-step columns.
     *
     * @throws DomainException if the columns differ in length
     */
    public static CaseTable of(double[] x, double[] y, int[] t) {
        if (x.length != y.length || x.length != t.length) {
            throw new DomainException(String.format(
                "Column lengths differ: x=%d, y=%d, t=%d", x.length, y.length, t.length));
        }
        Case[] cases = new Case[x.length];
        for (int i = 0; i < x.length; i++) {
            cases[i] = new Case(x[i], y[i], t[i]);
        }
        return new CaseTable(cases);
    }

    /**
     * Creates a table from continuous onset times, binning each one to
     * {@code floor((t - origin) / step)}.
     *
     * @param x the x coordinates
     * @param y the y coordinates
     * @param t the continuous onset times
     * @param origin the time mapped to step 0
     * @param step the bin width, in the same units as the generation time
     * @return the binned table
     * @throws DomainException if the step is not positive, a time is not
     *     finite, or a binned step does not fit in an int
     */
    public static CaseTable binned(double[] x, double[] y, double[] t, double origin, double step) {
        if (!(step > 0) || !Double.isFinite(step)) {
            throw new DomainException("Bin step must be positive and finite, got: " + step);
        }
        if (!Double.isFinite(origin)) {
            throw new DomainException("Bin origin must be finite, got: " + origin);
        }
        int[] steps = new int[t.length];
        for (int i = 0; i < t.length; i++) {
            if (!Double.isFinite(t[i])) {
                throw new DomainException("Onset time at index " + i + " is not finite: " + t[i]);
            }
            double binned = Math.floor((t[i] - origin) / step);
            if (!(binned >= Integer.MIN_VALUE && binned <= Integer.MAX_VALUE)) {
                throw new DomainException("Onset time at index " + i + " bins outside the int step range: " + t[i]);
            }
            steps[i] = (int) binned;
        }
        return of(x, y, steps);
    }

    public int size() {
        return cases.length;
    }

    public boolean isEmpty() {
        return cases.length == 0;
    }

    public Case get(int index) {
        return cases[index];
    }

    public int time(int index) {
        return cases[index].t();
    }

    /**
     * Returns the index of a case's onset time within {@link #uniqueTimes()}.
     */
    public int timeIndex(int index) {
        return timeIndex[index];
    }

    /**
     * Returns the onset times of all cases, in table order.
     */
    public int[] times() {
        int[] times = new int[cases.length];
        for (int i = 0; i < cases.length; i++) {
            times[i] = cases[i].t();
        }
        return times;
    }

    /**
     * Returns the distinct onset times in ascending order.
     */
    public int[] uniqueTimes() {
        return uniqueTimes.clone();
    }

    public int uniqueTimeCount() {
        return uniqueTimes.length;
    }

    public List<Case> cases() {
        return Collections.unmodifiableList(Arrays.asList(cases));
    }

    /**
     * Returns the cases whose onset time lies in {@code [t1, t2]}, in table order.
     */
    public CaseTable filter(int t1, int t2) {
        List<Case> kept = new ArrayList<>(cases.length);
        for (Case c : cases) {
            if (c.t() >= t1 && c.t() <= t2) {
                kept.add(c);
            }
        }
        return kept.size() == cases.length ? this : of(kept);
    }

    /**
     * Returns the cumulative subset of cases with onset time at or before {@code tau}.
     */
    public CaseTable upTo(int tau) {
        return filter(Integer.MIN_VALUE, tau);
    }

    /**
     * Draws {@link #size()} cases uniformly with replacement.
     *
     * @param rng the random source for this draw
     * @return a new table of the same size
     */
    public CaseTable resample(UniformRandomProvider rng) {
        Case[] drawn = new Case[cases.length];
        for (int i = 0; i < drawn.length; i++) {
            drawn[i] = cases[rng.nextInt(cases.length)];
        }
        return new CaseTable(drawn);
    }

    @Override
    public Iterator<Case> iterator() {
        return cases().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseTable)) return false;
        return Arrays.equals(cases, ((CaseTable) o).cases);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cases);
    }

    @Override
    public String toString() {
        return "CaseTable[cases=" + cases.length + ", times=" + Arrays.toString(uniqueTimes) + "]";
    }
}
