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

import java.util.Arrays;

/// Thrown when a cluster specification cannot be applied: the target set is empty, contains
/// ids outside the dataset's category range, has a strength outside `[0,1]`, or matches no
/// observation.
public class InvalidClusterSpecException extends RsaPipelineException {

    private final int[] targets;

    public InvalidClusterSpecException(String operation, int[] targets, String reason) {
        super(operation, reason + " (targets " + Arrays.toString(targets) + ")");
        this.targets = targets.clone();
    }

    public int[] getTargets() {
        return targets.clone();
    }
}
