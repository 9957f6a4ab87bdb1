package io.spatialepi.transdist.kernel.concurrent;

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

import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.IntFunction;

/// Runs every trial on the calling thread. This is the default executor.
final class SequentialTrialExecutor implements TrialExecutor {

    static final SequentialTrialExecutor INSTANCE = new SequentialTrialExecutor();

    private SequentialTrialExecutor() {
    }

    @Override
    public <T> List<T> map(int count, IntFunction<T> trial) {
        List<T> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            results.add(trial.apply(i));
        }
        return results;
    }

    @Override
    public <T> T reduce(int count, IntFunction<T> trial, BinaryOperator<T> combiner) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got: " + count);
        }
        return reduceRange(0, count, trial, combiner);
    }

    // Same split as ForkJoinTrialExecutor.ReduceTask
    private static <T> T reduceRange(int lo, int hi, IntFunction<T> trial, BinaryOperator<T> combiner) {
        if (hi - lo == 1) {
            return trial.apply(lo);
        }
        int mid = (lo + hi) >>> 1;
        T left = reduceRange(lo, mid, trial, combiner);
        T right = reduceRange(mid, hi, trial, combiner);
        return combiner.apply(left, right);
    }

    @Override
    public int parallelism() {
        return 1;
    }

    @Override
    public void close() {
        // nothing owned
    }

    @Override
    public String toString() {
        return "SequentialTrialExecutor";
    }
}
