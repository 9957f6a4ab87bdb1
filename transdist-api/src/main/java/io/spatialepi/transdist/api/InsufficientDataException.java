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

/// Thrown when a case table has too few unique onset times or too few usable
/// case pairs to support a kernel estimate.
public class InsufficientDataException extends TransdistException {

    private final int uniqueTimes;
    private final long pairCount;

    public InsufficientDataException(String message, int uniqueTimes, long pairCount) {
        super(message + String.format(" (unique times: %d, usable pairs: %d)", uniqueTimes, pairCount));
        this.uniqueTimes = uniqueTimes;
        this.pairCount = pairCount;
    }

    public int getUniqueTimes() {
        return uniqueTimes;
    }

    public long getPairCount() {
        return pairCount;
    }
}
