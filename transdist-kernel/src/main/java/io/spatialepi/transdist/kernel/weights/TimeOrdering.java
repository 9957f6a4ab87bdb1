package io.spatialepi.transdist.kernel.weights;

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

/// Which onset-time lags may separate an infector from its infectee.
public enum TimeOrdering {

    /// The infector's onset is strictly earlier (lag >= 1).
    STRICT,

    /// Same-step infection is also allowed (lag >= 0). A case never infects itself.
    INCLUSIVE;

    /// True when an infector `lag` steps before the infectee is admissible.
    public boolean admits(int lag) {
        return this == STRICT ? lag > 0 : lag >= 0;
    }
}
