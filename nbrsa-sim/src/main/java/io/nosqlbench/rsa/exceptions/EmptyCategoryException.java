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

/// Thrown when a category in `1..C` has no observations to average over.
public class EmptyCategoryException extends RsaPipelineException {

    private final int targetId;

    public EmptyCategoryException(String operation, int targetId) {
        super(operation, "target id " + targetId + " has no observations");
        this.targetId = targetId;
    }

    public int getTargetId() {
        return targetId;
    }
}
