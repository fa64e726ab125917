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

/// Thrown when a target id has no entry in the target to label dictionary.
public class UnknownTargetIdException extends RsaPipelineException {

    private final int targetId;

    public UnknownTargetIdException(String operation, int targetId) {
        super(operation, "no label is defined for target id " + targetId);
        this.targetId = targetId;
    }

    public int getTargetId() {
        return targetId;
    }
}
