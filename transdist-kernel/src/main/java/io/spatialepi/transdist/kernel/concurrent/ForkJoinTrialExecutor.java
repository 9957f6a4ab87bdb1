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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.RecursiveTask;
import java.util.function.BinaryOperator;
import java.util.function.IntFunction;

/**
 * Runs trials on a dedicated {@link ForkJoinPool}.
 *
 * <h2>Nesting</h2>
 *
 * <p>The pipeline nests trial families: a temporal step runs a bootstrap,
 * whose iterations each aggregate many sampled trees. When a call arrives from
 * a worker thread of this executor's own pool, the task is invoked in place so
 * the worker keeps stealing work instead of blocking on a second submission.
 *
 * <pre>{@code
 * temporal step (worker 3)
 *   └─ bootstrap iterations (forked in the same pool)
 *        └─ tree repetitions (forked in the same pool)
 * }</pre>
 */
final class ForkJoinTrialExecutor implements TrialExecutor {

    private static final Logger logger = LogManager.getLogger(ForkJoinTrialExecutor.class);

    private final ForkJoinPool pool;
    private final int parallelism;

    ForkJoinTrialExecutor(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        this.parallelism = parallelism;
        this.pool = new ForkJoinPool(parallelism);
        logger.debug("Created trial pool with {} workers", parallelism);
    }

    @Override
    public <T> List<T> map(int count, IntFunction<T> trial) {
        if (count == 0) {
            return new ArrayList<>();
        }
        Object[] results = new Object[count];
        run(new MapTask(0, count, trial, results));
        List<T> ordered = new ArrayList<>(count);
        for (Object result : results) {
            @SuppressWarnings("unchecked")
            T typed = (T) result;
            ordered.add(typed);
        }
        return ordered;
    }

    @Override
    public <T> T reduce(int count, IntFunction<T> trial, BinaryOperator<T> combiner) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got: " + count);
        }
        return run(new ReduceTask<>(0, count, trial, combiner));
    }

    private <R> R run(ForkJoinTask<R> task) {
        if (ForkJoinTask.inForkJoinPool() && ForkJoinTask.getPool() == pool) {
            return task.invoke();
        }
        return pool.invoke(task);
    }

    @Override
    public int parallelism() {
        return parallelism;
    }

    @Override
    public void close() {
        if (!pool.isShutdown()) {
            pool.shutdown();
            logger.debug("Shut down trial pool");
        }
    }

    @Override
    public String toString() {
        return "ForkJoinTrialExecutor[parallelism=" + parallelism + "]";
    }

    private static final class MapTask extends RecursiveAction {
        private final int lo;
        private final int hi;
        private final IntFunction<?> trial;
        private final Object[] results;

        MapTask(int lo, int hi, IntFunction<?> trial, Object[] results) {
            this.lo = lo;
            this.hi = hi;
            this.trial = trial;
            this.results = results;
        }

        @Override
        protected void compute() {
            if (hi - lo == 1) {
                results[lo] = trial.apply(lo);
                return;
            }
            int mid = (lo + hi) >>> 1;
            invokeAll(new MapTask(lo, mid, trial, results), new MapTask(mid, hi, trial, results));
        }
    }

    private static final class ReduceTask<T> extends RecursiveTask<T> {
        private final int lo;
        private final int hi;
        private final IntFunction<T> trial;
        private final BinaryOperator<T> combiner;

        ReduceTask(int lo, int hi, IntFunction<T> trial, BinaryOperator<T> combiner) {
            this.lo = lo;
            this.hi = hi;
            this.trial = trial;
            this.combiner = combiner;
        }

        @Override
        protected T compute() {
            if (hi - lo == 1) {
                return trial.apply(lo);
            }
            int mid = (lo + hi) >>> 1;
            ReduceTask<T> left = new ReduceTask<>(lo, mid, trial, combiner);
            ReduceTask<T> right = new ReduceTask<>(mid, hi, trial, combiner);
            left.fork();
            T rightResult = right.compute();
            T leftResult = left.join();
            return combiner.apply(leftResult, rightResult);
        }
    }
}
