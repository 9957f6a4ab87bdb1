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

/// Base type of every failure raised by the transmission distance pipeline.
///
/// All subtypes are unchecked. A caller either receives a complete estimate
/// or one of these, never a partially computed result.
public abstract class TransdistException extends RuntimeException {

    protected TransdistException(String message) {
        super(message);
    }

    protected TransdistException(String message, Throwable cause) {
        super(message, cause);
    }
}
