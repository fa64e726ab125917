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

/// Thrown when two structures which must agree in size do not, for example a model RDM
/// whose size differs from the observed RDM, or feature vectors of unequal length.
public class DimensionMismatchException extends RsaPipelineException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String operation, String subject, int expected, int actual) {
        super(operation, String.format("%s has size %d, expected %d", subject, actual, expected));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
