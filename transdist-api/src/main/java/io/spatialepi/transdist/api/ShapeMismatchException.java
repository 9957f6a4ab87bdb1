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

import java.util.Arrays;

/// Thrown when a caller-supplied matrix or tensor is indexed by a different
/// set of onset times than the case table it is applied to.
public class ShapeMismatchException extends TransdistException {

    private final int[] expectedTimes;
    private final int[] actualTimes;

    public ShapeMismatchException(String artifact, int[] expectedTimes, int[] actualTimes) {
        super(String.format("%s is indexed by times %s but the case table has times %s",
            artifact, Arrays.toString(actualTimes), Arrays.toString(expectedTimes)));
        this.expectedTimes = expectedTimes.clone();
        this.actualTimes = actualTimes.clone();
    }

    public int[] getExpectedTimes() {
        return expectedTimes.clone();
    }

    public int[] getActualTimes() {
        return actualTimes.clone();
    }
}
