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

package io.nosqlbench.rsa.classify;

/// Predictions and accuracy from a cross-validated classification.
///
/// @param predicted predicted target id per observation, 0 where never tested
/// @param accuracy fraction of tested observations predicted correctly
/// @param confusion counts indexed `[true - 1][predicted - 1]`
/// @param chanceLevel `1 / C`
public record CrossValidationResult(int[] predicted, double accuracy, int[][] confusion, double chanceLevel) {

    @Override
    public String toString() {
        return String.format("CrossValidationResult{accuracy=%.2f%%, chance=%.2f%%}",
            accuracy * 100, chanceLevel * 100);
    }
}
