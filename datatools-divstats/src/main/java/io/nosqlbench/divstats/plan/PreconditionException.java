package io.nosqlbench.divstats.plan;

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

/// Thrown when attribute computation is requested on a dataset that cannot be
/// processed as-is, such as a view with a pending deferred transformation.
///
/// Raised before any distributed work starts.
public class PreconditionException extends RuntimeException {

    public PreconditionException(String message) {
        super(message);
    }
}
