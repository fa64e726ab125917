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

package io.nosqlbench.rsa.exceptions;

/// Base type for precondition failures in the simulation and analysis pipeline.
///
/// These are configuration or programming errors detected eagerly at the start of the
/// offending operation. The pipeline aborts the current run when one is raised; nothing
/// is skipped or imputed.
public abstract class RsaPipelineException extends RuntimeException {

    private final String operation;

    protected RsaPipelineException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    /// @return the name of the operation which detected the failure
    public String getOperation() {
        return operation;
    }
}
